package com.vibedeutsch.backend.lexicon.store;

import com.vibedeutsch.backend.lexicon.entity.LemmaEntity;
import com.vibedeutsch.backend.lexicon.entity.Provenance;
import com.vibedeutsch.backend.lexicon.entity.SenseEntity;
import com.vibedeutsch.backend.lexicon.repo.LemmaRepo;
import com.vibedeutsch.backend.testsupport.BaseSpringTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static com.vibedeutsch.backend.testsupport.LexiconFixtures.form;
import static com.vibedeutsch.backend.testsupport.LexiconFixtures.lemma;
import static com.vibedeutsch.backend.testsupport.LexiconFixtures.sense;
import static com.vibedeutsch.backend.testsupport.LexiconFixtures.translation;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class JpaMorphologyStoreTest extends BaseSpringTest {

    @Autowired MorphologyStore store;
    @Autowired LemmaRepo lemmaRepo;

    private LemmaEntity gehen;
    private SenseEntity apfelSense;

    @BeforeEach
    void setUp() {
        lemmaRepo.deleteAll();

        gehen = lemma("gehen", "verb", 950);
        sense(gehen, null, Provenance.SEED);
        form(gehen, "gehe", "praesens_ich", "present_1st_sg");
        gehen = lemmaRepo.save(gehen);

        LemmaEntity apfel = lemma("Apfel", "noun", 900);
        apfelSense = sense(apfel, "masc", Provenance.SEED);
        translation(apfelSense, "zh", "苹果");
        form(apfel, "Äpfel", "number", "plural");
        lemmaRepo.save(apfel);

        lemmaRepo.save(withSense(lemma("Tisch", "noun", 800)));
        lemmaRepo.save(withSense(lemma("Tische", "noun", 300)));
        lemmaRepo.save(withSense(lemma("Tee", "noun", 700)));
        lemmaRepo.save(withSense(lemma("Donnerstag", "noun", 500)));
    }

    private static LemmaEntity withSense(LemmaEntity l) {
        sense(l, null, Provenance.SEED);
        return l;
    }

    @Test
    void exact_lookup_is_case_sensitive() {
        assertThat(store.findLemmaByExactText("Apfel")).extracting(LemmaSummary::text).containsExactly("Apfel");
        assertThat(store.findLemmaByExactText("apfel")).isEmpty();
        assertThat(store.findLemmaByExactText("")).isEmpty();
    }

    @Test
    void inflected_form_without_sense_expands_to_lemma_senses() {
        List<InflectedHit> hits = store.findLemmaByInflectedForm("gehe");

        assertThat(hits).hasSize(1);
        assertThat(hits.get(0).lemma().text()).isEqualTo("gehen");
        assertThat(hits.get(0).featureKey()).isEqualTo("praesens_ich");
        assertThat(hits.get(0).lemma().senseId()).isNotNull();
    }

    @Test
    void length_window_orders_by_distance_then_frequency() {
        List<LemmaSummary> c = store.candidatesByLengthWindow("Tisch", 2, 10);

        // 長度 3..7：Tisch(5) Apfel(5) gehen(5) 距離 0，Tische(6) 距離 1，Tee(3) 距離 2
        assertThat(c).extracting(LemmaSummary::text)
                .containsExactly("gehen", "Apfel", "Tisch", "Tische", "Tee");
        assertThat(c).extracting(LemmaSummary::text).doesNotContain("Donnerstag");
    }

    @Test
    void length_window_respects_limit() {
        assertThat(store.candidatesByLengthWindow("Tisch", 2, 2)).hasSize(2);
        assertThat(store.candidatesByLengthWindow("Tisch", 2, 0)).isEmpty();
    }

    @Test
    void translation_lookup_returns_owning_sense() {
        List<LemmaSummary> hits = store.findSensesByTranslation("苹果");

        assertThat(hits).hasSize(1);
        assertThat(hits.get(0).senseId()).isEqualTo(apfelSense.getId());
        assertThat(hits.get(0).gender()).isEqualTo("masc");
    }

    @Test
    void load_entry_contains_forms_and_translations() {
        LemmaSummary s = store.findLemmaByExactText("Apfel").get(0);

        LexiconEntry e = store.loadEntry(s.key()).orElseThrow();

        assertThat(e.lemma()).isEqualTo("Apfel");
        assertThat(e.source()).isEqualTo("seed");
        assertThat(e.translations().get("zh")).containsExactly("苹果");
        assertThat(e.forms()).extracting(LexiconEntry.Form::form).containsExactly("Äpfel");
    }

    @Test
    void load_entry_for_missing_lemma_is_empty() {
        assertThat(store.loadEntry(new SenseKey(-1L, null))).isEmpty();
    }
}
