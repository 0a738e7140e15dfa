package com.vibedeutsch.backend.lexicon.store;

/** 變化形命中：owning lemma/sense + 命中的文法特徵 */
public record InflectedHit(
        LemmaSummary lemma,
        String form,
        String featureKey,
        String featureValue
) {
}
