package com.vibedeutsch.backend.lexicon.nlp;

import java.text.Normalizer;
import java.text.Normalizer.Form;
import java.util.Locale;

/**
 * 查詢字串正規化：
 * 1) NFC（組合形式），讓 "ä" 與 "ä" 比對相等
 * 2) 壓縮空白 + trim
 * 3) caseFold：再加上德語 locale 的 toLowerCase（比對用，不拿來存檔）
 */
public final class TextNorm {
    private TextNorm() {}

    public static final Locale GERMAN = Locale.GERMAN;

    /** null / 空字串一律回 ""，不丟例外 */
    public static String canonical(String s) {
        if (s == null || s.isEmpty()) return "";
        String nfc = Normalizer.normalize(s, Form.NFC);
        return nfc.replaceAll("\\s+", " ").trim();
    }

    /** 比對用 key（in-flight registry / cache / echo 驗證都用同一把） */
    public static String caseFold(String s) {
        return canonical(s).toLowerCase(GERMAN);
    }

    public static boolean sameFolded(String a, String b) {
        return caseFold(a).equals(caseFold(b));
    }

    public static int codePointLength(String s) {
        return s == null ? 0 : s.codePointCount(0, s.length());
    }

    static boolean isLatin(int codePoint) {
        Character.UnicodeBlock b = Character.UnicodeBlock.of(codePoint);
        return b == Character.UnicodeBlock.BASIC_LATIN
                || b == Character.UnicodeBlock.LATIN_1_SUPPLEMENT
                || b == Character.UnicodeBlock.LATIN_EXTENDED_A
                || b == Character.UnicodeBlock.LATIN_EXTENDED_B
                || b == Character.UnicodeBlock.LATIN_EXTENDED_ADDITIONAL
                || b == Character.UnicodeBlock.LATIN_EXTENDED_C
                || b == Character.UnicodeBlock.LATIN_EXTENDED_D
                || b == Character.UnicodeBlock.LATIN_EXTENDED_E;
    }
}
