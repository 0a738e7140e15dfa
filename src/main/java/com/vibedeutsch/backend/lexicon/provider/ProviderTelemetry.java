package com.vibedeutsch.backend.lexicon.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** 每次模型呼叫固定一行 log，方便 grep provider_call */
@Slf4j
@Component
public class ProviderTelemetry {

    public void ok(String provider, String modelId, String word, long latencyMs, Integer totalTok) {
        log.info("provider_call status=OK provider={} modelId={} word={} latencyMs={} tokensTotal={}",
                safe(provider), safe(modelId), safe(word), latencyMs, n(totalTok));
    }

    public void fail(String provider, String modelId, String word, long latencyMs,
                     String errorCode, Integer retryAfterSec) {
        log.warn("provider_call status=FAIL provider={} modelId={} word={} latencyMs={} errorCode={} retryAfterSec={}",
                safe(provider), safe(modelId), safe(word), latencyMs, safe(errorCode), n(retryAfterSec));
    }

    private static String safe(String s) { return (s == null || s.isBlank()) ? "UNKNOWN" : s; }
    private static Object n(Integer v) { return v == null ? "NA" : v; }
}
