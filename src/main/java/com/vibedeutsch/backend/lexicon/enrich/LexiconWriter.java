package com.vibedeutsch.backend.lexicon.enrich;

import com.vibedeutsch.backend.lexicon.enrich.ModelAnalysis.FormCell;
import com.vibedeutsch.backend.lexicon.enrich.ModelAnalysis.ValidAnalysis;
import com.vibedeutsch.backend.lexicon.entity.ExampleEntity;
import com.vibedeutsch.backend.lexicon.entity.InflectedFormEntity;
import com.vibedeutsch.backend.lexicon.entity.LemmaEntity;
import com.vibedeutsch.backend.lexicon.entity.Provenance;
import com.vibedeutsch.backend.lexicon.entity.SenseEntity;
import com.vibedeutsch.backend.lexicon.entity.TranslationEntity;
import com.vibedeutsch.backend.lexicon.repo.LemmaRepo;
import com.vibedeutsch.backend.lexicon.repo.SenseRepo;
import com.vibedeutsch.backend.lexicon.store.LexiconEntries;
import com.vibedeutsch.backend.lexicon.store.LexiconEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 模型補全的落庫：Lemma + Sense + Forms + Translations + Example 同一個交易，全有或全無。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LexiconWriter {

    static final double MODEL_CONFIDENCE = 0.75;
    static final double REVIEW_CONFIDENCE = 0.5;

    private final LemmaRepo lemmaRepo;
    private final SenseRepo senseRepo;

    public record Written(LexiconEntry entry, boolean created) {}

    /**
     * @param enrichmentKey 正規化查詢 key（unique；另一台機器搶先寫入時 flush 會丟 DataIntegrityViolationException）
     * @param lemmaText     已通過二次驗證的詞條文字
     */
    @Transactional
    public Written write(String enrichmentKey, String lemmaText, ValidAnalysis a, boolean needsReview) {
        Optional<LemmaEntity> sameKey = lemmaRepo.findByEnrichmentKey(enrichmentKey);
        if (sameKey.isPresent()) {
            LemmaEntity l = sameKey.get();
            return new Written(LexiconEntries.entry(l, l.getSenses().isEmpty() ? null : l.getSenses().get(0)), false);
        }

        List<SenseEntity> existing = senseRepo.findByLemmaTextAndPos(lemmaText, a.pos());
        if (!existing.isEmpty()) {
            SenseEntity target = existing.stream().filter(s -> !s.isManual()).findFirst().orElse(existing.get(0));
            attach(target, a);
            log.info("lexicon_enrich_attached lemma={} lemmaId={} senseId={} manual={}",
                    lemmaText, target.getLemma().getId(), target.getId(), target.isManual());
            return new Written(LexiconEntries.entry(target.getLemma(), target), false);
        }

        double confidence = needsReview ? REVIEW_CONFIDENCE : MODEL_CONFIDENCE;

        LemmaEntity lemma = new LemmaEntity();
        lemma.setText(lemmaText);
        lemma.setPos(a.pos());
        lemma.setSource(Provenance.EXTERNAL_MODEL);
        lemma.setNeedsReview(needsReview);
        lemma.setConfidence(confidence);
        lemma.setEnrichmentKey(enrichmentKey);

        SenseEntity sense = new SenseEntity();
        sense.setPos(a.pos());
        sense.setGender(a.gender());
        sense.setSource(Provenance.EXTERNAL_MODEL);
        sense.setNeedsReview(needsReview);
        sense.setConfidence(confidence);
        lemma.addSense(sense);

        for (FormCell f : a.forms()) {
            lemma.addForm(form(f));
        }
        addTranslations(sense, a, needsReview, confidence);
        addExample(sense, a);

        LemmaEntity saved = lemmaRepo.saveAndFlush(lemma);
        log.info("lexicon_enrich_created lemma={} lemmaId={} pos={} forms={} needsReview={}",
                lemmaText, saved.getId(), a.pos(), a.forms().size(), needsReview);
        return new Written(LexiconEntries.entry(saved, saved.getSenses().get(0)), true);
    }

    @Transactional(readOnly = true)
    public Optional<LexiconEntry> findByEnrichmentKey(String enrichmentKey) {
        return lemmaRepo.findByEnrichmentKey(enrichmentKey)
                .map(l -> LexiconEntries.entry(l, l.getSenses().isEmpty() ? null : l.getSenses().get(0)));
    }

    /** 既有義項只追加，不覆寫文法屬性；人工修正過的義項連變化形都不動 */
    private void attach(SenseEntity target, ValidAnalysis a) {
        LemmaEntity lemma = target.getLemma();
        if (!target.isManual()) {
            for (FormCell f : a.forms()) {
                boolean dup = lemma.getForms().stream().anyMatch(x ->
                        x.getForm().equals(f.form())
                        && x.getFeatureKey().equals(f.featureKey())
                        && x.getFeatureValue().equals(f.featureValue()));
                if (!dup) lemma.addForm(form(f));
            }
        }
        double confidence = target.getConfidence() == null ? MODEL_CONFIDENCE : target.getConfidence();
        addTranslations(target, a, true, confidence);
        addExample(target, a);
        lemmaRepo.saveAndFlush(lemma);
    }

    private static void addTranslations(SenseEntity sense, ValidAnalysis a, boolean needsReview, double confidence) {
        for (Map.Entry<String, List<String>> e : a.translations().entrySet()) {
            for (String text : e.getValue()) {
                boolean dup = sense.getTranslations().stream().anyMatch(t ->
                        t.getLangCode().equals(e.getKey()) && t.getText().equals(text));
                if (dup) continue;
                TranslationEntity t = new TranslationEntity();
                t.setLangCode(e.getKey());
                t.setText(text);
                t.setSource(Provenance.EXTERNAL_MODEL);
                t.setConfidence(confidence);
                t.setNeedsReview(needsReview);
                sense.addTranslation(t);
            }
        }
    }

    private static void addExample(SenseEntity sense, ValidAnalysis a) {
        ModelAnalysis.ExampleText ex = a.example();
        if (ex == null) return;
        boolean dup = sense.getExamples().stream().anyMatch(e -> Objects.equals(e.getDeText(), ex.de()));
        if (dup) return;
        ExampleEntity e = new ExampleEntity();
        e.setDeText(ex.de());
        e.setEnText(ex.en());
        e.setZhText(ex.zh());
        e.setSource(Provenance.EXTERNAL_MODEL);
        sense.addExample(e);
    }

    private static InflectedFormEntity form(FormCell f) {
        InflectedFormEntity e = new InflectedFormEntity();
        e.setForm(f.form());
        e.setFeatureKey(f.featureKey());
        e.setFeatureValue(f.featureValue());
        e.setSource(Provenance.EXTERNAL_MODEL);
        return e;
    }
}
