package com.vibedeutsch.backend.lexicon.enrich;

import com.vibedeutsch.backend.lexicon.nlp.TextNorm;

import java.util.List;
import java.util.Map;

/**
 * 模型回應解碼後的封閉型別；未定型的 JSON 不會離開 decoder。
 */
public sealed interface ModelAnalysis
        permits ModelAnalysis.ValidAnalysis, ModelAnalysis.InvalidAnalysis,
                ModelAnalysis.SuggestionList, ModelAnalysis.MalformedResponse {

    record FormCell(String featureKey, String featureValue, String form) {}

    record ExampleText(String de, String en, String zh) {}

    record SuggestedWord(String word, String pos, String meaning) {}

    /** 模型認為是合法德文字 */
    record ValidAnalysis(
            String echoedInput,
            String lemma,
            String pos,
            String gender,
            Map<String, List<String>> translations,
            List<FormCell> forms,
            ExampleText example
    ) implements ModelAnalysis {
        public boolean hasForm(String folded) {
            for (FormCell f : forms) {
                if (TextNorm.caseFold(f.form()).equals(folded)) return true;
            }
            return false;
        }
    }

    /** 不是德文字，也沒有建議 */
    record InvalidAnalysis(String echoedInput, String message) implements ModelAnalysis {}

    /** 不是德文字，附建議 */
    record SuggestionList(String echoedInput, List<SuggestedWord> suggestions) implements ModelAnalysis {}

    record MalformedResponse(String detail) implements ModelAnalysis {}
}
