package com.vibedeutsch.backend.lexicon.store;

import com.vibedeutsch.backend.lexicon.entity.ExampleEntity;
import com.vibedeutsch.backend.lexicon.entity.InflectedFormEntity;
import com.vibedeutsch.backend.lexicon.entity.LemmaEntity;
import com.vibedeutsch.backend.lexicon.entity.SenseEntity;
import com.vibedeutsch.backend.lexicon.entity.TranslationEntity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Entity → 摘要 / 詞條 的轉換，需在交易內呼叫（會碰到 lazy 關聯） */
public final class LexiconEntries {

    private LexiconEntries() {}

    public static List<LemmaSummary> summaries(LemmaEntity l) {
        List<SenseEntity> senses = l.getSenses();
        int freq = l.getFrequencyRank() == null ? 0 : l.getFrequencyRank();
        if (senses == null || senses.isEmpty()) {
            return List.of(new LemmaSummary(new SenseKey(l.getId(), null), l.getText(), l.getPos(), null, freq));
        }
        List<LemmaSummary> out = new ArrayList<>(senses.size());
        for (SenseEntity s : senses) {
            out.add(summary(l, s));
        }
        return out;
    }

    public static LemmaSummary summary(LemmaEntity l, SenseEntity s) {
        int freq = l.getFrequencyRank() == null ? 0 : l.getFrequencyRank();
        return new LemmaSummary(new SenseKey(l.getId(), s.getId()), l.getText(), s.getPos(), s.getGender(), freq);
    }

    public static LexiconEntry entry(LemmaEntity l, SenseEntity s) {
        Map<String, List<String>> tr = new LinkedHashMap<>();
        List<LexiconEntry.Example> examples = new ArrayList<>();
        List<LexiconEntry.Form> forms = new ArrayList<>();

        if (s != null) {
            for (TranslationEntity t : s.getTranslations()) {
                tr.computeIfAbsent(t.getLangCode(), k -> new ArrayList<>()).add(t.getText());
            }
            for (ExampleEntity e : s.getExamples()) {
                examples.add(new LexiconEntry.Example(e.getDeText(), e.getEnText(), e.getZhText()));
            }
        }
        for (InflectedFormEntity f : l.getForms()) {
            // 沒指定義項的變化形屬於所有義項
            if (f.getSense() == null || s == null || Objects.equals(f.getSense().getId(), s.getId())) {
                forms.add(new LexiconEntry.Form(f.getForm(), f.getFeatureKey(), f.getFeatureValue()));
            }
        }

        String pos = s != null ? s.getPos() : l.getPos();
        boolean needsReview = l.isNeedsReview() || (s != null && s.isNeedsReview());
        String source = (s != null && s.getSource() != null ? s.getSource() : l.getSource()).dbValue();

        return new LexiconEntry(
                l.getId(),
                s == null ? null : s.getId(),
                l.getText(),
                pos,
                s == null ? null : s.getGender(),
                l.getCefr(),
                l.getFrequencyRank() == null ? 0 : l.getFrequencyRank(),
                source,
                needsReview,
                s != null && s.getConfidence() != null ? s.getConfidence() : l.getConfidence(),
                tr,
                forms,
                examples
        );
    }
}
