package com.vibedeutsch.backend.lexicon.nlp;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SimilarityTest {

    @Test
    void one_missing_letter_in_five_scores_point_eight() {
        assertThat(Similarity.ratio("gehn", "gehen")).isCloseTo(0.8, within(1e-9));
    }

    @Test
    void comparison_is_case_insensitive() {
        assertThat(Similarity.ratio("Tisch", "tisch")).isEqualTo(1.0);
        assertThat(Similarity.ratio("ÄPFEL", "äpfel")).isEqualTo(1.0);
    }

    @Test
    void empty_strings_score_zero() {
        assertThat(Similarity.ratio("", "")).isEqualTo(0.0);
        assertThat(Similarity.ratio("abc", "")).isEqualTo(0.0);
    }

    @Test
    void distance_counts_code_points() {
        assertThat(Levenshtein.distance("straße", "strasse")).isEqualTo(2);
        assertThat(Levenshtein.distance("kitten", "sitting")).isEqualTo(3);
    }
}
