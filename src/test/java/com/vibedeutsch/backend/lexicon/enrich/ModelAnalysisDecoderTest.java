package com.vibedeutsch.backend.lexicon.enrich;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ModelAnalysisDecoderTest {

    private final ObjectMapper om = new ObjectMapper();
    private final ModelAnalysisDecoder decoder = new ModelAnalysisDecoder(3);

    private JsonNode json(String s) throws Exception {
        return om.readTree(s);
    }

    @Test
    void valid_word_is_decoded_with_forms_translations_and_example() throws Exception {
        ModelAnalysis a = decoder.decode(json("""
                {"found": true, "input_word": "Kaffee", "lemma": "Kaffee", "pos": "Noun", "gender": "masc",
                 "word_forms": [
                   {"feature_key": "gender", "feature_value": "masc", "form": "der"},
                   {"feature_key": "number", "feature_value": "plural", "form": "Kaffees"},
                   {"feature_key": "number", "form": "broken"}
                 ],
                 "translations_en": ["coffee", "Coffee", "n/a"],
                 "translations_zh": ["咖啡"],
                 "example": {"de": "Ich trinke Kaffee.", "en": "I drink coffee."}}
                """), "Kaffee");

        assertThat(a).isInstanceOf(ModelAnalysis.ValidAnalysis.class);
        ModelAnalysis.ValidAnalysis v = (ModelAnalysis.ValidAnalysis) a;
        assertThat(v.pos()).isEqualTo("noun");
        assertThat(v.gender()).isEqualTo("masc");
        assertThat(v.forms()).hasSize(2);
        assertThat(v.translations().get("en")).containsExactly("coffee");
        assertThat(v.translations().get("zh")).containsExactly("咖啡");
        assertThat(v.example().de()).isEqualTo("Ich trinke Kaffee.");
        assertThat(v.hasForm("kaffees")).isTrue();
    }

    @Test
    void unknown_pos_is_malformed() throws Exception {
        ModelAnalysis a = decoder.decode(json("""
                {"found": true, "input_word": "x", "lemma": "x", "pos": "banana", "translations_en": ["x"]}
                """), "x");

        assertThat(a).isEqualTo(new ModelAnalysis.MalformedResponse("POS_INVALID"));
    }

    @Test
    void missing_translations_are_malformed() throws Exception {
        ModelAnalysis a = decoder.decode(json("""
                {"found": true, "input_word": "Haus", "lemma": "Haus", "pos": "noun", "translations_en": ["???"]}
                """), "Haus");

        assertThat(a).isEqualTo(new ModelAnalysis.MalformedResponse("NO_VALID_TRANSLATION"));
    }

    @Test
    void missing_echo_is_malformed() throws Exception {
        assertThat(decoder.decode(json("{\"found\": false}"), "x"))
                .isEqualTo(new ModelAnalysis.MalformedResponse("ECHO_MISSING"));
        assertThat(decoder.decode(json("{\"input_word\": \"x\"}"), "x"))
                .isEqualTo(new ModelAnalysis.MalformedResponse("FOUND_MISSING"));
    }

    @Test
    void non_object_output_is_malformed() {
        assertThat(decoder.decode(TextNode.valueOf("sorry, I cannot"), "x"))
                .isEqualTo(new ModelAnalysis.MalformedResponse("NOT_AN_OBJECT"));
        assertThat(decoder.decode(null, "x")).isInstanceOf(ModelAnalysis.MalformedResponse.class);
    }

    @Test
    void suggestions_drop_the_query_itself_and_duplicates_and_are_capped() throws Exception {
        ModelAnalysis a = decoder.decode(json("""
                {"found": false, "input_word": "xyzq",
                 "suggestions": [
                   {"word": "XYZQ"}, {"word": "Xylophon", "pos": "noun", "meaning": "xylophone"},
                   "xylophon", "Zyklus", "Quiz", "Quark"
                 ]}
                """), "xyzq");

        assertThat(a).isInstanceOf(ModelAnalysis.SuggestionList.class);
        ModelAnalysis.SuggestionList list = (ModelAnalysis.SuggestionList) a;
        assertThat(list.suggestions()).extracting(ModelAnalysis.SuggestedWord::word)
                .containsExactly("Xylophon", "Zyklus", "Quiz");
        assertThat(list.suggestions().get(0).meaning()).isEqualTo("xylophone");
    }

    @Test
    void not_found_without_suggestions_is_invalid_analysis() throws Exception {
        ModelAnalysis a = decoder.decode(json("""
                {"found": false, "input_word": "qqq", "message": "not a recognized German word"}
                """), "qqq");

        assertThat(a).isEqualTo(new ModelAnalysis.InvalidAnalysis("qqq", "not a recognized German word"));
    }

    @Test
    void example_without_any_rendering_is_dropped() throws Exception {
        ModelAnalysis a = decoder.decode(json("""
                {"found": true, "input_word": "Tee", "lemma": "Tee", "pos": "noun",
                 "translations_en": ["tea"], "example": {"de": "Ich trinke Tee."}}
                """), "Tee");

        assertThat(((ModelAnalysis.ValidAnalysis) a).example()).isNull();
    }
}
