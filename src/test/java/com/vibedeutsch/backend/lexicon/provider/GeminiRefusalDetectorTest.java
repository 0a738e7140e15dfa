package com.vibedeutsch.backend.lexicon.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GeminiRefusalDetectorTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void finish_reason_safety_is_refusal() throws Exception {
        var resp = om.readTree("{\"candidates\":[{\"finishReason\":\"SAFETY\"}]}");
        assertThat(GeminiRefusalDetector.detectOrNull(resp)).isEqualTo(ProviderRefuseReason.SAFETY);
    }

    @Test
    void prompt_block_reason_other_is_harm_category() throws Exception {
        var resp = om.readTree("{\"promptFeedback\":{\"blockReason\":\"PROHIBITED_CONTENT\"}}");
        assertThat(GeminiRefusalDetector.detectOrNull(resp)).isEqualTo(ProviderRefuseReason.HARM_CATEGORY);
    }

    @Test
    void blocked_safety_rating_is_harm_category() throws Exception {
        var resp = om.readTree("""
                {"candidates":[{"finishReason":"STOP","safetyRatings":[{"category":"X","blocked":true}]}]}
                """);
        assertThat(GeminiRefusalDetector.detectOrNull(resp)).isEqualTo(ProviderRefuseReason.HARM_CATEGORY);
    }

    @Test
    void normal_stop_is_not_refusal() throws Exception {
        var resp = om.readTree("{\"candidates\":[{\"finishReason\":\"STOP\",\"content\":{\"parts\":[{\"text\":\"{}\"}]}}]}");
        assertThat(GeminiRefusalDetector.detectOrNull(resp)).isNull();
        assertThat(GeminiRefusalDetector.detectOrNull(null)).isNull();
    }
}
