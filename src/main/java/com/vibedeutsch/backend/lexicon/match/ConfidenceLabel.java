package com.vibedeutsch.backend.lexicon.match;

public enum ConfidenceLabel {
    VERY_HIGH("very_high"),
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low"),
    VERY_LOW("very_low");

    private final String code;

    ConfidenceLabel(String code) {
        this.code = code;
    }

    public String code() { return code; }

    public static ConfidenceLabel of(double score) {
        if (score >= 0.9) return VERY_HIGH;
        if (score >= 0.8) return HIGH;
        if (score >= 0.6) return MEDIUM;
        if (score >= 0.4) return LOW;
        return VERY_LOW;
    }
}
