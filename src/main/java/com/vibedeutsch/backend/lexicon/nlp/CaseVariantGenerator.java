package com.vibedeutsch.backend.lexicon.nlp;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * 產生查詢字的大小寫變體（固定順序、不重複、第一個一定是原字）：
 * 原字 → 全小寫 → 全大寫 → 首字大寫；
 * 再對每個已產生的變體套一次「變音字母對照表」，新的才附加。
 *
 * 變體數量是常數上限（最多 8 個），跟字長無關。
 */
public final class CaseVariantGenerator {
    private CaseVariantGenerator() {}

    /** 對稱替換表：不依賴各 runtime 的 case mapping */
    private static final Map<Character, Character> UMLAUT_SWAP = Map.of(
            'ä', 'Ä', 'Ä', 'ä',
            'ö', 'Ö', 'Ö', 'ö',
            'ü', 'Ü', 'Ü', 'ü',
            'ß', 'ẞ', 'ẞ', 'ß'
    );

    public static List<String> variants(String text) {
        if (text == null || text.isEmpty()) return List.of("");

        LinkedHashSet<String> out = new LinkedHashSet<>(8);
        out.add(text);
        out.add(lower(text));
        out.add(upper(text));
        out.add(title(text));

        for (String v : new ArrayList<>(out)) {
            out.add(swapUmlauts(v));
        }
        return List.copyOf(out);
    }

    static String lower(String s) {
        return s.toLowerCase(TextNorm.GERMAN);
    }

    /**
     * 德語 locale 大寫；若長度變了（ß → SS）就退回逐字元大寫，
     * 讓 ß 保持原樣，變體集合才會封閉。
     */
    static String upper(String s) {
        String u = s.toUpperCase(TextNorm.GERMAN);
        if (u.length() == s.length()) return u;

        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); ) {
            int cp = s.codePointAt(i);
            sb.appendCodePoint(Character.toUpperCase(cp));
            i += Character.charCount(cp);
        }
        return sb.toString();
    }

    static String title(String s) {
        int first = s.codePointAt(0);
        int n = Character.charCount(first);
        return new StringBuilder(s.length())
                .appendCodePoint(Character.toTitleCase(first))
                .append(lower(s.substring(n)))
                .toString();
    }

    static String swapUmlauts(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            Character swapped = UMLAUT_SWAP.get(c);
            sb.append(swapped != null ? swapped : c);
        }
        return sb.toString();
    }
}
