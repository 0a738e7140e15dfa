package com.vibedeutsch.backend.lexicon.entity;

import java.util.Locale;

/** 資料來源標記：seed 匯入 / 人工修正 / 外部模型補全 */
public enum Provenance {
    SEED("seed"),
    MANUAL("manual"),
    EXTERNAL_MODEL("external-model");

    private final String dbValue;

    Provenance(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() { return dbValue; }

    public static Provenance fromDbValue(String v) {
        if (v == null || v.isBlank()) return null;
        String s = v.trim().toLowerCase(Locale.ROOT);
        for (Provenance p : values()) {
            if (p.dbValue.equals(s)) return p;
        }
        throw new IllegalArgumentException("UNKNOWN_PROVENANCE: " + v);
    }
}
