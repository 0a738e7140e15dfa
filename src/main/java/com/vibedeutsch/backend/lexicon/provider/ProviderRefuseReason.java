package com.vibedeutsch.backend.lexicon.provider;

public enum ProviderRefuseReason {
    SAFETY,
    RECITATION,
    HARM_CATEGORY;

    public String errorCode() {
        return "PROVIDER_REFUSED_" + name();
    }

    public static ProviderRefuseReason fromErrorCodeOrNull(String code) {
        if (code == null) return null;
        if (!code.startsWith("PROVIDER_REFUSED_")) return null;
        String tail = code.substring("PROVIDER_REFUSED_".length());
        for (ProviderRefuseReason r : values()) {
            if (r.name().equals(tail)) return r;
        }
        return null;
    }
}
