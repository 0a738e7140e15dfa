package com.vibedeutsch.backend.lexicon.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.vibedeutsch.backend.lexicon.provider.config.GeminiProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * Gemini generateContent（text-only, JSON mode）。
 * 回傳模型輸出的 JSON 物件；輸出不是 JSON 時回 TextNode，交給 decoder 判成 malformed。
 */
@Slf4j
public class GeminiLexiconClient implements LexiconModelClient {

    static final String PROVIDER = "GEMINI";
    private static final int PREVIEW_LEN = 200;

    private static final String SYSTEM_PROMPT =
            "You are a meticulous German lexicon engine. "
            + "Always return STRICT JSON that matches the schema. "
            + "Never add explanatory text outside JSON. "
            + "If something is unknown, OMIT the field.";

    private static final String USER_PROMPT = """
            Return a single JSON object for the EXACT German word "%1$s". Do NOT correct the input.
            Echo the word you analyzed, unchanged, in "input_word".

            If the word is VALID German (lemma or inflected form):
            {"found": true, "input_word": "%1$s", "lemma": "dictionary base form",
             "pos": "noun|verb|vt|vi|vr|aux|modal|adj|adv|prep|det|art|pron|conj|interj|num",
             "gender": "masc|fem|neut (nouns only)",
             "word_forms": [{"feature_key": "...", "feature_value": "...", "form": "..."}],
             "translations_en": ["..."], "translations_zh": ["..."],
             "example": {"de": "...", "en": "...", "zh": "..."}}

            Verb cells: feature_key="tense", feature_value="<tense>_<person>",
            persons ich|du|er_sie_es|wir|ihr|sie_Sie.
            Noun article: feature_key="gender", feature_value masc|fem|neut, form der|die|das.
            Noun plural: feature_key="number", feature_value="plural".
            Adjective degrees: feature_key="degree", feature_value comparative|superlative.

            If "%1$s" is NOT valid German:
            {"found": false, "input_word": "%1$s", "message": "not a recognized German word",
             "suggestions": [{"word": "...", "pos": "...", "meaning": "brief EN gloss"}]}
            """;

    private final RestClient http;
    private final GeminiProperties props;
    private final ObjectMapper om;
    private final ProviderTelemetry telemetry;

    public GeminiLexiconClient(RestClient http, GeminiProperties props, ObjectMapper om, ProviderTelemetry telemetry) {
        this.http = http;
        this.props = props;
        this.om = om;
        this.telemetry = telemetry;
    }

    @Override
    public String providerCode() { return PROVIDER; }

    @Override
    public JsonNode analyze(String word) {
        long t0 = System.nanoTime();
        String modelId = props.getModel();
        try {
            JsonNode resp = callGenerateContent(word, modelId);

            ProviderRefuseReason reason = GeminiRefusalDetector.detectOrNull(resp);
            if (reason != null) {
                log.warn("gemini_refused word={} modelId={} reason={}", word, modelId, reason);
                throw new ModelRefusedException(reason, reason.errorCode());
            }

            String text = extractJoinedTextOrNull(resp);
            JsonNode payload = parseOrText(text);
            telemetry.ok(PROVIDER, modelId, word, msSince(t0), totalTokens(resp));
            return payload;
        } catch (RestClientResponseException re) {
            ProviderErrorMapper.Mapped mapped = ProviderErrorMapper.map(re);
            telemetry.fail(PROVIDER, modelId, word, msSince(t0), mapped.code(), mapped.retryAfterSec());
            ProviderRefuseReason reason = ProviderRefuseReason.fromErrorCodeOrNull(mapped.code());
            if (reason != null) throw new ModelRefusedException(reason, mapped.code());
            throw re;
        } catch (RuntimeException e) {
            if (!(e instanceof ModelRefusedException)) {
                ProviderErrorMapper.Mapped mapped = ProviderErrorMapper.map(e);
                telemetry.fail(PROVIDER, modelId, word, msSince(t0), mapped.code(), mapped.retryAfterSec());
            } else {
                telemetry.fail(PROVIDER, modelId, word, msSince(t0), e.getMessage(), null);
            }
            throw e;
        }
    }

    private JsonNode callGenerateContent(String word, String modelId) {
        ObjectNode req = buildRequest(word);
        return http.post()
                .uri("/v1beta/models/{model}:generateContent", modelId)
                .header("x-goog-api-key", requireApiKey())
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .body(req)
                .retrieve()
                .body(JsonNode.class);
    }

    ObjectNode buildRequest(String word) {
        ObjectNode root = om.createObjectNode();

        ObjectNode sys = root.putObject("systemInstruction");
        sys.putArray("parts").addObject().put("text", SYSTEM_PROMPT);

        ArrayNode contents = root.putArray("contents");
        ObjectNode c0 = contents.addObject();
        c0.put("role", "user");
        // 原字不做任何處理直接放進 prompt
        c0.putArray("parts").addObject().put("text", USER_PROMPT.formatted(word));

        ObjectNode gen = root.putObject("generationConfig");
        gen.put("responseMimeType", "application/json");
        gen.put("maxOutputTokens", props.getMaxOutputTokens());
        gen.put("temperature", props.getTemperature());
        return root;
    }

    private JsonNode parseOrText(String text) {
        if (text == null) return TextNode.valueOf("");
        String s = stripCodeFence(text);
        try {
            return om.readTree(s);
        } catch (JsonProcessingException e) {
            log.warn("gemini_non_json_output preview={}", safeOneLine200(text));
            return TextNode.valueOf(text);
        }
    }

    private static String stripCodeFence(String s) {
        String t = s.trim();
        if (t.startsWith("```")) {
            int nl = t.indexOf('\n');
            int end = t.lastIndexOf("```");
            if (nl > 0 && end > nl) return t.substring(nl + 1, end).trim();
        }
        return t;
    }

    private static String extractJoinedTextOrNull(JsonNode resp) {
        if (resp == null) return null;
        JsonNode parts = resp.path("candidates").path(0).path("content").path("parts");
        if (!parts.isArray()) return null;
        StringBuilder sb = new StringBuilder(256);
        for (JsonNode p : parts) {
            String t = p.path("text").asText(null);
            if (t != null) sb.append(t);
        }
        String joined = sb.toString().trim();
        return joined.isEmpty() ? null : joined;
    }

    private static Integer totalTokens(JsonNode resp) {
        JsonNode t = resp == null ? null : resp.path("usageMetadata").path("totalTokenCount");
        return (t != null && t.isInt()) ? t.asInt() : null;
    }

    private static String safeOneLine200(String s) {
        if (s == null) return null;
        String t = s.replace("\r", " ").replace("\n", " ").trim();
        return (t.length() > PREVIEW_LEN) ? t.substring(0, PREVIEW_LEN) : t;
    }

    private static long msSince(long t0) {
        return (System.nanoTime() - t0) / 1_000_000;
    }

    private String requireApiKey() {
        String k = props.getApiKey();
        if (k == null || k.isBlank()) throw new IllegalStateException("GEMINI_API_KEY_MISSING");
        return k.trim();
    }
}
