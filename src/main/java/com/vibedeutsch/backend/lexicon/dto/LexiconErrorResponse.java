package com.vibedeutsch.backend.lexicon.dto;

public record LexiconErrorResponse(
        String errorCode,
        String message,
        String requestId
) {}
