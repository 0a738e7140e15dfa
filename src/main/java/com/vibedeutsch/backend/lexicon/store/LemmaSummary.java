package com.vibedeutsch.backend.lexicon.store;

/** 比對用的輕量摘要：一筆 = 一個 lemma 的一個義項 */
public record LemmaSummary(
        SenseKey key,
        String text,
        String pos,
        String gender,
        int frequencyRank
) {
    public long lemmaId() { return key.lemmaId(); }
    public Long senseId() { return key.senseId(); }
}
