package com.vibedeutsch.backend.lexicon.service;

import com.vibedeutsch.backend.lexicon.entity.ExampleEntity;
import com.vibedeutsch.backend.lexicon.entity.InflectedFormEntity;
import com.vibedeutsch.backend.lexicon.entity.LemmaEntity;
import com.vibedeutsch.backend.lexicon.entity.Provenance;
import com.vibedeutsch.backend.lexicon.entity.SenseEntity;
import com.vibedeutsch.backend.lexicon.entity.TranslationEntity;
import com.vibedeutsch.backend.lexicon.nlp.TextNorm;
import com.vibedeutsch.backend.lexicon.repo.LemmaRepo;
import com.vibedeutsch.backend.lexicon.service.LexiconSeedFile.SeedExample;
import com.vibedeutsch.backend.lexicon.service.LexiconSeedFile.SeedForm;
import com.vibedeutsch.backend.lexicon.service.LexiconSeedFile.SeedLemma;
import com.vibedeutsch.backend.lexicon.service.LexiconSeedFile.SeedSense;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** seed 寫入（provenance=seed）。text + pos + notes 已存在就跳過，可重複執行。 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LexiconSeedService {

    private final LemmaRepo lemmaRepo;

    public record ImportStats(int imported, int skipped) {}

    @Transactional
    public ImportStats importAll(LexiconSeedFile file) {
        if (file == null || file.lemmas() == null) return new ImportStats(0, 0);
        int imported = 0, skipped = 0;
        for (SeedLemma s : file.lemmas()) {
            String text = TextNorm.canonical(s.text());
            if (text.isEmpty() || s.pos() == null || s.pos().isBlank()) {
                log.warn("lexicon_seed_invalid text={} pos={}", s.text(), s.pos());
                skipped++;
                continue;
            }
            if (alreadySeeded(text, s)) {
                skipped++;
                continue;
            }
            lemmaRepo.save(toEntity(text, s));
            imported++;
        }
        return new ImportStats(imported, skipped);
    }

    // 同形異義詞靠 notes 區分（Bank=銀行 / Bank=長椅）
    private boolean alreadySeeded(String text, SeedLemma s) {
        return lemmaRepo.findByExactText(text).stream()
                .anyMatch(l -> Objects.equals(l.getPos(), s.pos()) && Objects.equals(l.getNotes(), s.notes()));
    }

    private static LemmaEntity toEntity(String text, SeedLemma s) {
        LemmaEntity l = new LemmaEntity();
        l.setText(text);
        l.setPos(s.pos());
        l.setCefr(s.cefr());
        l.setFrequencyRank(s.frequencyRank() == null ? 0 : s.frequencyRank());
        l.setNotes(s.notes());
        l.setSource(Provenance.SEED);
        l.setConfidence(1.0);

        List<SeedSense> senses = (s.senses() == null || s.senses().isEmpty())
                ? List.of(new SeedSense(s.pos(), null, Map.of(), List.of()))
                : s.senses();
        for (SeedSense ss : senses) {
            SenseEntity sense = new SenseEntity();
            sense.setPos(ss.pos() == null ? s.pos() : ss.pos());
            sense.setGender(ss.gender());
            sense.setSource(Provenance.SEED);
            sense.setConfidence(1.0);
            l.addSense(sense);

            if (ss.translations() != null) {
                for (Map.Entry<String, List<String>> e : ss.translations().entrySet()) {
                    for (String t : e.getValue()) {
                        TranslationEntity te = new TranslationEntity();
                        te.setLangCode(e.getKey());
                        te.setText(t);
                        te.setSource(Provenance.SEED);
                        te.setConfidence(1.0);
                        sense.addTranslation(te);
                    }
                }
            }
            if (ss.examples() != null) {
                for (SeedExample ex : ss.examples()) {
                    ExampleEntity ee = new ExampleEntity();
                    ee.setDeText(ex.de());
                    ee.setEnText(ex.en());
                    ee.setZhText(ex.zh());
                    if (ex.level() != null) ee.setLevel(ex.level());
                    ee.setSource(Provenance.SEED);
                    sense.addExample(ee);
                }
            }
        }

        if (s.forms() != null) {
            for (SeedForm f : s.forms()) {
                InflectedFormEntity fe = new InflectedFormEntity();
                fe.setForm(TextNorm.canonical(f.form()));
                fe.setFeatureKey(f.featureKey());
                fe.setFeatureValue(f.featureValue());
                fe.setSource(Provenance.SEED);
                l.addForm(fe);
            }
        }
        return l;
    }
}
