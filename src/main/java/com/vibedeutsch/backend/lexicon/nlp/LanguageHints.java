package com.vibedeutsch.backend.lexicon.nlp;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Normalizer 用的唯讀查表（由建構子注入，不做成全域 static）。
 * - articles：德語冠詞（定/不定，全格）
 * - functionWords：各語言常見虛詞，完全命中給 0.90
 */
public record LanguageHints(Set<String> articles, Map<DetectedLanguage, Set<String>> functionWords) {

    public LanguageHints {
        articles = Set.copyOf(articles);
        functionWords = Map.copyOf(functionWords);
    }

    public boolean isArticle(String token) {
        return token != null && articles.contains(token.toLowerCase(Locale.GERMAN));
    }

    public static LanguageHints germanDefaults() {
        return new LanguageHints(
                Set.of("der", "die", "das", "den", "dem", "des",
                        "ein", "eine", "einen", "einem", "einer", "eines"),
                Map.of(
                        DetectedLanguage.GERMAN, Set.of(
                                "der", "die", "das", "ein", "eine", "und", "ich", "du", "er", "sie", "es",
                                "wir", "ihr", "auf", "für", "mit", "zu", "von", "bei", "nach", "über",
                                "durch", "ohne", "um", "nicht", "ist", "sind"),
                        DetectedLanguage.ENGLISH, Set.of(
                                "the", "and", "you", "that", "this", "have", "with", "for", "not", "are",
                                "from", "they", "know", "want", "been", "good", "much", "some", "time",
                                "very", "when", "come", "here", "how", "just", "like", "long", "make",
                                "many", "over", "such", "take", "than", "them", "well", "were")
                )
        );
    }
}
