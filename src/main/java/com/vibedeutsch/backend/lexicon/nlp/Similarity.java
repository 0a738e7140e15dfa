package com.vibedeutsch.backend.lexicon.nlp;

/**
 * 統一的字串相似度入口：1 - editDistance / max(len(a), len(b))。
 * 兩邊先做 caseFold（NFC + 德語小寫），所以 "Tisch" 與 "tisch" = 1.0。
 */
public final class Similarity {
    private Similarity() {}

    public static double ratio(String s1, String s2) {
        String a = TextNorm.caseFold(s1);
        String b = TextNorm.caseFold(s2);
        if (a.equals(b)) return a.isEmpty() ? 0.0 : 1.0;

        int maxLen = Math.max(TextNorm.codePointLength(a), TextNorm.codePointLength(b));
        if (maxLen == 0) return 0.0;
        return 1.0 - (Levenshtein.distance(a, b) / (double) maxLen);
    }
}
