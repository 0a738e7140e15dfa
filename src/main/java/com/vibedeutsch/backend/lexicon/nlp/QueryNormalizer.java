package com.vibedeutsch.backend.lexicon.nlp;

import java.util.Locale;
import java.util.Set;

/**
 * 查詢正規化 + 語言/腳本偵測 + 去冠詞。
 * 純函式：任何輸入（含 null / 空字串 / 亂碼）都不丟例外。
 */
public final class QueryNormalizer {

    static final double SCRIPT_CONFIDENCE = 0.95;
    static final double DIACRITIC_CONFIDENCE = 0.95;
    static final double FUNCTION_WORD_CONFIDENCE = 0.90;
    static final double LATIN_DEFAULT_CONFIDENCE = 0.60;
    static final double UNKNOWN_CONFIDENCE = 0.30;

    private final LanguageHints hints;

    public QueryNormalizer(LanguageHints hints) {
        this.hints = hints;
    }

    public NormalizedQuery normalize(String raw) {
        String original = raw == null ? "" : raw;
        String text = TextNorm.canonical(original);
        if (text.isEmpty()) {
            return new NormalizedQuery(original, "", DetectedLanguage.UNKNOWN, UNKNOWN_CONFIDENCE, null, null);
        }

        String article = null;
        String stripped = null;
        int sp = text.indexOf(' ');
        if (sp > 0 && sp < text.length() - 1) {
            String head = text.substring(0, sp);
            if (hints.isArticle(head)) {
                article = head;
                stripped = text.substring(sp + 1).trim();
            }
        }

        Detection d = detect(text);
        return new NormalizedQuery(original, text, d.language, d.confidence, article, stripped);
    }

    private record Detection(DetectedLanguage language, double confidence) {}

    private Detection detect(String text) {
        // 1) 非拉丁腳本：出現任一個字元就判定
        DetectedLanguage script = detectScript(text);
        if (script != null) return new Detection(script, SCRIPT_CONFIDENCE);

        // 2) 德語專屬字母
        if (hasGermanDiacritic(text)) return new Detection(DetectedLanguage.GERMAN, DIACRITIC_CONFIDENCE);

        // 3) 常見虛詞（完全命中）
        String lower = text.toLowerCase(Locale.GERMAN);
        for (DetectedLanguage lang : DetectedLanguage.values()) {
            Set<String> words = hints.functionWords().get(lang);
            if (words != null && words.contains(lower)) {
                return new Detection(lang, FUNCTION_WORD_CONFIDENCE);
            }
        }

        // 4) 純拉丁字母：預設目標語言，但信心低
        if (isPureLatin(text)) return new Detection(DetectedLanguage.GERMAN, LATIN_DEFAULT_CONFIDENCE);

        return new Detection(DetectedLanguage.UNKNOWN, UNKNOWN_CONFIDENCE);
    }

    private static DetectedLanguage detectScript(String text) {
        boolean kana = false, hangul = false, han = false, cyrillic = false,
                greek = false, hebrew = false, arabic = false, thai = false;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            Character.UnicodeScript sc = Character.UnicodeScript.of(cp);
            switch (sc) {
                case HIRAGANA, KATAKANA -> kana = true;
                case HANGUL -> hangul = true;
                case HAN -> han = true;
                case CYRILLIC -> cyrillic = true;
                case GREEK -> greek = true;
                case HEBREW -> hebrew = true;
                case ARABIC -> arabic = true;
                case THAI -> thai = true;
                default -> { }
            }
            i += Character.charCount(cp);
        }
        // 日文常混漢字，所以假名優先
        if (kana) return DetectedLanguage.JAPANESE;
        if (hangul) return DetectedLanguage.KOREAN;
        if (han) return DetectedLanguage.CHINESE;
        if (cyrillic) return DetectedLanguage.RUSSIAN;
        if (greek) return DetectedLanguage.GREEK;
        if (hebrew) return DetectedLanguage.HEBREW;
        if (arabic) return DetectedLanguage.ARABIC;
        if (thai) return DetectedLanguage.THAI;
        return null;
    }

    private static boolean hasGermanDiacritic(String text) {
        for (int i = 0; i < text.length(); i++) {
            switch (text.charAt(i)) {
                case 'ä', 'ö', 'ü', 'ß', 'Ä', 'Ö', 'Ü', 'ẞ' -> { return true; }
                default -> { }
            }
        }
        return false;
    }

    private static boolean isPureLatin(String text) {
        boolean sawLetter = false;
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            if (Character.isLetter(cp)) {
                if (!TextNorm.isLatin(cp)) return false;
                sawLetter = true;
            }
            i += Character.charCount(cp);
        }
        return sawLetter;
    }
}
