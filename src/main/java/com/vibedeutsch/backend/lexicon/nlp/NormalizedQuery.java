package com.vibedeutsch.backend.lexicon.nlp;

/**
 * Normalizer 的輸出。
 *
 * @param original         使用者原始輸入（log 用，永不改動）
 * @param text             NFC + 壓縮空白後的查詢字
 * @param detectedLanguage 偵測到的語言
 * @param confidence       偵測信心 0..1
 * @param strippedArticle  被拿掉的冠詞（沒有則 null）
 * @param strippedText     去冠詞後的字（沒有則 null）
 */
public record NormalizedQuery(
        String original,
        String text,
        DetectedLanguage detectedLanguage,
        double confidence,
        String strippedArticle,
        String strippedText
) {

    public boolean isEmpty() { return text == null || text.isEmpty(); }

    public boolean hasStrippedArticle() { return strippedText != null && !strippedText.isEmpty(); }

    /** 主要查詢形式：有冠詞就用去冠詞的版本 */
    public String primaryForm() { return hasStrippedArticle() ? strippedText : text; }

    /** in-flight / cache / echo 驗證共用的 key */
    public String foldedKey() { return TextNorm.caseFold(primaryForm()); }
}
