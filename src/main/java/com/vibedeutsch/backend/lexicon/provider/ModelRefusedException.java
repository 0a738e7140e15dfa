package com.vibedeutsch.backend.lexicon.provider;

public class ModelRefusedException extends RuntimeException {
    private final ProviderRefuseReason reason;

    public ModelRefusedException(ProviderRefuseReason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ProviderRefuseReason reason() {
        return reason;
    }
}
