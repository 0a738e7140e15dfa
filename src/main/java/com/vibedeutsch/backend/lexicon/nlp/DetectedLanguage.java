package com.vibedeutsch.backend.lexicon.nlp;

public enum DetectedLanguage {
    GERMAN("de"),
    ENGLISH("en"),
    CHINESE("zh"),
    JAPANESE("ja"),
    KOREAN("ko"),
    RUSSIAN("ru"),
    GREEK("el"),
    HEBREW("he"),
    ARABIC("ar"),
    THAI("th"),
    UNKNOWN("und");

    private final String tag;

    DetectedLanguage(String tag) {
        this.tag = tag;
    }

    public String tag() { return tag; }

    public boolean isTarget() { return this == GERMAN; }
}
