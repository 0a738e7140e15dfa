package com.vibedeutsch.backend.lexicon.service;

import java.util.List;
import java.util.Map;

/** seed/lexicon-seed.json 的結構 */
public record LexiconSeedFile(List<SeedLemma> lemmas) {

    public record SeedLemma(
            String text,
            String pos,
            String cefr,
            Integer frequencyRank,
            String notes,
            List<SeedSense> senses,
            List<SeedForm> forms
    ) {}

    public record SeedSense(
            String pos,
            String gender,
            Map<String, List<String>> translations,
            List<SeedExample> examples
    ) {}

    public record SeedForm(String form, String featureKey, String featureValue) {}

    public record SeedExample(String de, String en, String zh, String level) {}
}
