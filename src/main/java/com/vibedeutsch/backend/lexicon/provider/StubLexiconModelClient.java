package com.vibedeutsch.backend.lexicon.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** gemini 關閉時用：永遠回「不是德文字」，不給建議，不會寫入任何東西 */
public class StubLexiconModelClient implements LexiconModelClient {

    private final ObjectMapper om;

    public StubLexiconModelClient(ObjectMapper om) {
        this.om = om;
    }

    @Override
    public String providerCode() { return "STUB"; }

    @Override
    public JsonNode analyze(String word) {
        ObjectNode n = om.createObjectNode();
        n.put("found", false);
        n.put("input_word", word);
        n.put("message", "model disabled");
        n.putArray("suggestions");
        return n;
    }
}
