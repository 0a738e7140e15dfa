package com.vibedeutsch.backend.lexicon.provider;

import org.springframework.http.HttpHeaders;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 外部模型例外 → 固定的錯誤碼（PROVIDER_*）。
 * 只有 retryable() 為 true 的錯誤才會讓呼叫端重試。
 */
public final class ProviderErrorMapper {

    private ProviderErrorMapper() {}

    public record Mapped(String code, String message, Integer retryAfterSec) {
        public boolean retryable() {
            return switch (code) {
                case "PROVIDER_TIMEOUT", "PROVIDER_RATE_LIMITED", "PROVIDER_UPSTREAM_5XX",
                     "PROVIDER_NETWORK_ERROR", "PROVIDER_BAD_PAYLOAD", "PROVIDER_FAILED" -> true;
                default -> false;
            };
        }

        public boolean refused() {
            return ProviderRefuseReason.fromErrorCodeOrNull(code) != null;
        }
    }

    private static final Pattern RETRY_DELAY_FIELD =
            Pattern.compile("\"retrydelay\"\\s*:\\s*\"(\\d{1,6})s\"");

    private static final int MIN_429_RETRY_SEC = 2;
    private static final int MAX_RETRY_SEC = 3600;

    public static Mapped map(Throwable e) {
        Throwable t = unwrap(e);
        if (t == null) return new Mapped("PROVIDER_FAILED", null, null);

        if (t instanceof ModelRefusedException mre) {
            return new Mapped(mre.reason().errorCode(), safeMsg(mre), null);
        }

        if (isTimeoutThrowable(t)) {
            return new Mapped("PROVIDER_TIMEOUT", safeMsg(t), null);
        }

        if (t instanceof IllegalStateException ise) {
            String m = ise.getMessage();
            if (m != null && (m.startsWith("PROVIDER_") || m.startsWith("GEMINI_"))) {
                return new Mapped(m, safeMsg(ise), null);
            }
        }

        if (t instanceof RestClientResponseException re) {
            int status = re.getStatusCode().value();
            String body = re.getResponseBodyAsString();
            String lower = ((re.getMessage() == null ? "" : re.getMessage()) + " " + body).toLowerCase(Locale.ROOT);

            Integer retryAfter = parseRetryAfterHeaderOrNull(re.getResponseHeaders());
            if (retryAfter == null) retryAfter = parseRetryDelayOrNull(lower);

            // 403 的 "API key ... blocked" 是設定問題，不是內容拒絕
            if (status == 401 || status == 403) return new Mapped("PROVIDER_AUTH_FAILED", "auth failed", null);
            if (status == 429) {
                int sec = retryAfter == null ? MIN_429_RETRY_SEC : Math.max(MIN_429_RETRY_SEC, retryAfter);
                return new Mapped("PROVIDER_RATE_LIMITED", "rate limited", clampSec(sec));
            }
            if (status == 408) return new Mapped("PROVIDER_TIMEOUT", "timeout", retryAfter);
            if (re.getStatusCode().is5xxServerError()) {
                return new Mapped("PROVIDER_UPSTREAM_5XX", "upstream 5xx", retryAfter == null ? null : clampSec(retryAfter));
            }
            if (status == 400) {
                String refused = detectRefusalCodeOrNull(lower);
                if (refused != null) return new Mapped(refused, "blocked by provider policy", null);
            }
            if (re.getStatusCode().is4xxClientError()) return new Mapped("PROVIDER_BAD_REQUEST", "bad request", null);
            return new Mapped("PROVIDER_FAILED", "http error", retryAfter);
        }

        if (t instanceof ResourceAccessException rae) {
            return new Mapped("PROVIDER_NETWORK_ERROR", safeMsg(rae), null);
        }

        if (t instanceof RestClientException rce) {
            // 回應 JSON 反序列化失敗也會落在這
            return new Mapped("PROVIDER_BAD_PAYLOAD", safeMsg(rce), null);
        }

        return new Mapped("PROVIDER_FAILED", safeMsg(t), null);
    }

    /** RECITATION 優先，SAFETY 次之，blocked/policy 歸 HARM_CATEGORY */
    private static String detectRefusalCodeOrNull(String lower) {
        if (lower == null || lower.isBlank()) return null;
        if (lower.contains("recitation") || lower.contains("copyright")) return ProviderRefuseReason.RECITATION.errorCode();
        if (lower.contains("safety")) return ProviderRefuseReason.SAFETY.errorCode();
        if (lower.contains("blocked") || lower.contains("policy")) return ProviderRefuseReason.HARM_CATEGORY.errorCode();
        return null;
    }

    private static Integer parseRetryAfterHeaderOrNull(HttpHeaders headers) {
        if (headers == null) return null;
        String ra = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (ra == null || ra.isBlank()) return null;
        try {
            return clampSec(Integer.parseInt(ra.trim()));
        } catch (NumberFormatException ignored) {
            // HTTP-date 格式不處理
            return null;
        }
    }

    private static Integer parseRetryDelayOrNull(String lower) {
        Matcher m = RETRY_DELAY_FIELD.matcher(lower);
        return m.find() ? clampSec(Integer.parseInt(m.group(1))) : null;
    }

    private static Throwable unwrap(Throwable e) {
        Throwable t = e;
        while ((t instanceof ExecutionException || t instanceof CompletionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static int clampSec(int v) {
        return Math.max(0, Math.min(MAX_RETRY_SEC, v));
    }

    private static boolean isTimeoutThrowable(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof SocketTimeoutException || c instanceof TimeoutException) return true;
            if ("java.net.http.HttpTimeoutException".equals(c.getClass().getName())) return true;
        }
        return false;
    }

    private static String safeMsg(Throwable t) {
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? t.getClass().getSimpleName() : m;
    }
}
