package com.vibedeutsch.backend.lexicon.provider;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 命中 SAFETY / RECITATION / blocked rating 就當拒答，不重打、不落庫。
 */
public final class GeminiRefusalDetector {

    private GeminiRefusalDetector() {}

    public static ProviderRefuseReason detectOrNull(JsonNode resp) {
        if (resp == null || resp.isNull()) return null;

        // candidates 可能是空的，只剩 promptFeedback
        String blockReason = text(resp.path("promptFeedback").path("blockReason"));
        ProviderRefuseReason r = fromReason(blockReason);
        if (r != null) return r;

        JsonNode cand0 = resp.path("candidates").path(0);
        r = fromReason(text(cand0.path("finishReason")));
        if (r != null) return r;

        if (hasBlockedRating(cand0.path("safetyRatings"))) return ProviderRefuseReason.HARM_CATEGORY;
        if (hasBlockedRating(resp.path("promptFeedback").path("safetyRatings"))) return ProviderRefuseReason.HARM_CATEGORY;

        // blockReason 有值但不是上面兩種（OTHER / BLOCKLIST / PROHIBITED_CONTENT）
        if (blockReason != null) return ProviderRefuseReason.HARM_CATEGORY;
        return null;
    }

    private static ProviderRefuseReason fromReason(String reason) {
        if ("SAFETY".equalsIgnoreCase(reason)) return ProviderRefuseReason.SAFETY;
        if ("RECITATION".equalsIgnoreCase(reason)) return ProviderRefuseReason.RECITATION;
        return null;
    }

    private static boolean hasBlockedRating(JsonNode arr) {
        if (arr == null || !arr.isArray()) return false;
        for (JsonNode it : arr) {
            if (it != null && it.path("blocked").asBoolean(false)) return true;
        }
        return false;
    }

    private static String text(JsonNode n) {
        if (n == null || n.isMissingNode() || n.isNull()) return null;
        String s = n.asText(null);
        return (s == null || s.isBlank()) ? null : s;
    }
}
