package com.vibedeutsch.backend.lexicon.provider;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 外部生成模型：analyze(word) → 模型回的原始 JSON。
 * 型別化驗證一律在 enrich 層做，這裡不解讀內容。
 */
public interface LexiconModelClient {

    String providerCode();

    /**
     * @throws ModelRefusedException 模型拒答（SAFETY / RECITATION / HARM_CATEGORY）
     * @throws Exception             網路、HTTP、逾時等，交給 {@link ProviderErrorMapper} 分類
     */
    JsonNode analyze(String word) throws Exception;
}
