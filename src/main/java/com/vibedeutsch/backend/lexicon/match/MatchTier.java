package com.vibedeutsch.backend.lexicon.match;

/** 比對層級，宣告順序 = 優先順序 */
public enum MatchTier {
    DIRECT("direct"),
    INFLECTED("inflected"),
    ARTICLE_STRIPPED("article_stripped"),
    FUZZY("fuzzy"),
    TRANSLATION("translation");

    private final String code;

    MatchTier(String code) {
        this.code = code;
    }

    public String code() { return code; }
}
