package com.vibedeutsch.backend.lexicon.match;

/**
 * 「你是不是要找 X？」的一筆建議。
 *
 * @param similarity 模糊比對的分數；模型給的建議為 null
 * @param origin     fuzzy / model
 */
public record Suggestion(
        String word,
        String pos,
        String meaning,
        Double similarity,
        String origin
) {
    public static final String ORIGIN_FUZZY = "fuzzy";
    public static final String ORIGIN_MODEL = "model";

    public static Suggestion fromFuzzy(ResolutionCandidate c) {
        return new Suggestion(c.lemma().text(), c.lemma().pos(), null, c.similarity(), ORIGIN_FUZZY);
    }

    public static Suggestion fromModel(String word, String pos, String meaning) {
        return new Suggestion(word, pos, meaning, null, ORIGIN_MODEL);
    }
}
