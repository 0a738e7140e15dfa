package com.vibedeutsch.backend.lexicon.store;

/**
 * Lemma/Sense 的識別鍵，去重一律用它（不靠物件參考或清單順序）。
 * senseId 為 null 代表該 lemma 尚無義項。
 */
public record SenseKey(long lemmaId, Long senseId) {
}
