package com.vibedeutsch.backend.lexicon.enrich;

import com.fasterxml.jackson.databind.JsonNode;
import com.vibedeutsch.backend.lexicon.enrich.ModelAnalysis.ExampleText;
import com.vibedeutsch.backend.lexicon.enrich.ModelAnalysis.FormCell;
import com.vibedeutsch.backend.lexicon.enrich.ModelAnalysis.SuggestedWord;
import com.vibedeutsch.backend.lexicon.nlp.TextNorm;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 模型 JSON → {@link ModelAnalysis}。
 * 結構不對（缺 found / input_word / lemma、詞性不在白名單、沒有任何可用譯文）一律 MalformedResponse；
 * 個別壞掉的變化形、譯文、例句只丟掉該筆。
 */
public final class ModelAnalysisDecoder {

    static final Set<String> ALLOWED_POS = Set.of(
            "noun", "verb", "vt", "vi", "vr", "aux", "modal", "adj", "adv", "prep", "det", "art",
            "pron", "conj", "interj", "num",
            "adjective", "adverb", "preposition", "pronoun", "conjunction", "article", "interjection", "other"
    );

    private static final Set<String> GENDERS = Set.of("masc", "fem", "neut");

    private static final Set<String> PLACEHOLDERS = Set.of(
            "...", "???", "n/a", "null", "undefined", "error", "invalid"
    );

    private static final String TRANSLATION_PREFIX = "translations_";
    private static final int MAX_TRANSLATION_LEN = 200;
    private static final int MAX_LEMMA_LEN = 128;
    private static final int MAX_FEATURE_KEY_LEN = 32;
    private static final int MAX_FEATURE_VALUE_LEN = 64;
    private static final int MAX_LANG_LEN = 8;
    private static final int MIN_EXAMPLE_LEN = 3;
    private static final int MAX_EXAMPLE_LEN = 500;

    private final int maxSuggestions;

    public ModelAnalysisDecoder(int maxSuggestions) {
        this.maxSuggestions = maxSuggestions;
    }

    /**
     * @param query 原始查詢字（用來過濾「建議 == 原字」）
     */
    public ModelAnalysis decode(JsonNode root, String query) {
        if (root == null || !root.isObject()) return new ModelAnalysis.MalformedResponse("NOT_AN_OBJECT");

        JsonNode found = root.get("found");
        if (found == null || !found.isBoolean()) return new ModelAnalysis.MalformedResponse("FOUND_MISSING");

        String echoed = text(root.get("input_word"));
        if (echoed == null) return new ModelAnalysis.MalformedResponse("ECHO_MISSING");

        if (!found.booleanValue()) {
            List<SuggestedWord> suggestions = suggestions(root.get("suggestions"), query);
            if (suggestions.isEmpty()) {
                return new ModelAnalysis.InvalidAnalysis(echoed, text(root.get("message")));
            }
            return new ModelAnalysis.SuggestionList(echoed, suggestions);
        }

        String lemma = text(root.get("lemma"));
        if (lemma == null || lemma.length() > MAX_LEMMA_LEN) return new ModelAnalysis.MalformedResponse("LEMMA_INVALID");

        String pos = text(root.get("pos"));
        pos = pos == null ? null : pos.toLowerCase(Locale.ROOT);
        if (pos == null || !ALLOWED_POS.contains(pos)) return new ModelAnalysis.MalformedResponse("POS_INVALID");

        Map<String, List<String>> translations = translations(root);
        if (translations.isEmpty()) return new ModelAnalysis.MalformedResponse("NO_VALID_TRANSLATION");

        List<FormCell> forms = forms(root.get("word_forms"));
        String gender = gender(root.get("gender"), forms);

        return new ModelAnalysis.ValidAnalysis(
                TextNorm.canonical(echoed),
                TextNorm.canonical(lemma),
                pos,
                gender,
                translations,
                forms,
                example(root.get("example"))
        );
    }

    private Map<String, List<String>> translations(JsonNode root) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (!e.getKey().startsWith(TRANSLATION_PREFIX) || !e.getValue().isArray()) continue;
            String lang = e.getKey().substring(TRANSLATION_PREFIX.length()).toLowerCase(Locale.ROOT);
            if (lang.isBlank() || lang.length() > MAX_LANG_LEN) continue;

            List<String> kept = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            for (JsonNode n : e.getValue()) {
                String t = text(n);
                if (isValidTranslation(t) && seen.add(t.toLowerCase(Locale.ROOT))) kept.add(t);
            }
            if (!kept.isEmpty()) out.put(lang, List.copyOf(kept));
        }
        return out;
    }

    static boolean isValidTranslation(String t) {
        if (t == null || t.isBlank() || t.length() > MAX_TRANSLATION_LEN) return false;
        if (PLACEHOLDERS.contains(t.trim().toLowerCase(Locale.ROOT))) return false;
        return t.codePoints().anyMatch(Character::isLetterOrDigit);
    }

    private static List<FormCell> forms(JsonNode arr) {
        if (arr == null || !arr.isArray()) return List.of();
        List<FormCell> out = new ArrayList<>();
        for (JsonNode n : arr) {
            if (n == null || !n.isObject()) continue;
            String k = text(n.get("feature_key"));
            String v = text(n.get("feature_value"));
            String f = text(n.get("form"));
            if (k == null || v == null || f == null) continue;
            if (k.length() > MAX_FEATURE_KEY_LEN || v.length() > MAX_FEATURE_VALUE_LEN || f.length() > MAX_LEMMA_LEN) continue;
            out.add(new FormCell(k, v, TextNorm.canonical(f)));
        }
        return List.copyOf(out);
    }

    private static String gender(JsonNode top, List<FormCell> forms) {
        String g = text(top);
        if (g != null && GENDERS.contains(g.toLowerCase(Locale.ROOT))) return g.toLowerCase(Locale.ROOT);
        for (FormCell f : forms) {
            if ("gender".equals(f.featureKey()) && GENDERS.contains(f.featureValue())) return f.featureValue();
        }
        return null;
    }

    private static ExampleText example(JsonNode n) {
        if (n == null || !n.isObject()) return null;
        String de = text(n.get("de"));
        if (de == null || de.length() < MIN_EXAMPLE_LEN || de.length() > MAX_EXAMPLE_LEN) return null;
        String en = clip(text(n.get("en")));
        String zh = clip(text(n.get("zh")));
        if (en == null && zh == null) return null;
        return new ExampleText(de, en, zh);
    }

    private List<SuggestedWord> suggestions(JsonNode arr, String query) {
        if (arr == null || !arr.isArray()) return List.of();
        String q = TextNorm.caseFold(query);
        Set<String> seen = new HashSet<>();
        List<SuggestedWord> out = new ArrayList<>();
        for (JsonNode n : arr) {
            if (out.size() >= maxSuggestions) break;
            String word = n.isTextual() ? text(n) : text(n.get("word"));
            if (word == null) continue;
            String folded = TextNorm.caseFold(word);
            if (folded.equals(q) || !seen.add(folded)) continue;
            String pos = n.isObject() ? text(n.get("pos")) : null;
            String meaning = n.isObject() ? text(n.get("meaning")) : null;
            out.add(new SuggestedWord(TextNorm.canonical(word), pos, meaning));
        }
        return List.copyOf(out);
    }

    private static String clip(String s) {
        if (s == null) return null;
        return s.length() > MAX_EXAMPLE_LEN ? s.substring(0, MAX_EXAMPLE_LEN) : s;
    }

    private static String text(JsonNode n) {
        if (n == null || !n.isTextual()) return null;
        String s = n.asText().trim();
        return s.isEmpty() ? null : s;
    }
}
