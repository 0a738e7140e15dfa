package com.vibedeutsch.backend.lexicon.store;

import java.util.List;
import java.util.Map;

/** 對外回傳的完整詞條（單一義項視角） */
public record LexiconEntry(
        long lemmaId,
        Long senseId,
        String lemma,
        String pos,
        String gender,
        String cefr,
        int frequencyRank,
        String source,
        boolean needsReview,
        Double confidence,
        Map<String, List<String>> translations,
        List<Form> forms,
        List<Example> examples
) {
    public record Form(String form, String featureKey, String featureValue) {}

    public record Example(String de, String en, String zh) {}

    public SenseKey key() {
        return new SenseKey(lemmaId, senseId);
    }
}
