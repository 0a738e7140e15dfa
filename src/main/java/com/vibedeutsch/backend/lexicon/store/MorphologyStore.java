package com.vibedeutsch.backend.lexicon.store;

import java.util.List;
import java.util.Optional;

/**
 * 詞庫唯讀查詢面（Resolver 只透過這裡讀資料）。
 * <p>
 * 所有查詢在儲存層都是大小寫敏感的；大小寫不敏感由 Resolver 對每個變體各查一次來達成，
 * store 不做任何隱性 folding。
 */
public interface MorphologyStore {

    /** 同拼字可能有多筆（同形異義），每個義項一筆 */
    List<LemmaSummary> findLemmaByExactText(String text);

    List<InflectedHit> findLemmaByInflectedForm(String text);

    /**
     * 長度在 ±window 內的候選，依 (長度差 asc, frequencyRank desc) 排序，最多 limit 個 lemma。
     */
    List<LemmaSummary> candidatesByLengthWindow(String text, int window, int limit);

    /** 譯文文字反查義項（跨語言查詢用） */
    List<LemmaSummary> findSensesByTranslation(String text);

    Optional<LexiconEntry> loadEntry(SenseKey key);
}
