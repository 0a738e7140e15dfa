package com.vibedeutsch.backend.lexicon.match;

import com.vibedeutsch.backend.lexicon.store.InflectedHit;
import com.vibedeutsch.backend.lexicon.store.LemmaSummary;
import com.vibedeutsch.backend.lexicon.store.SenseKey;

/**
 * 暫時性的比對結果（不落庫）。
 *
 * @param tier           命中的層級
 * @param matchType      direct / inflected / fuzzy / translation（article-stripped 層仍標 direct 或 inflected）
 * @param matchedVariant 實際命中的查詢字串（變體）
 * @param featureKey     變化形命中時的文法特徵，其餘為 null
 */
public record ResolutionCandidate(
        LemmaSummary lemma,
        MatchTier tier,
        String matchType,
        String matchedVariant,
        String featureKey,
        String featureValue,
        double similarity,
        ConfidenceLabel confidence
) {
    public SenseKey key() { return lemma.key(); }

    public static ResolutionCandidate direct(LemmaSummary l, MatchTier tier, String variant) {
        return new ResolutionCandidate(l, tier, MatchTier.DIRECT.code(), variant, null, null, 1.0, ConfidenceLabel.of(1.0));
    }

    public static ResolutionCandidate inflected(InflectedHit hit, MatchTier tier, String variant) {
        return new ResolutionCandidate(hit.lemma(), tier, MatchTier.INFLECTED.code(), variant,
                hit.featureKey(), hit.featureValue(), 1.0, ConfidenceLabel.of(1.0));
    }

    public static ResolutionCandidate fuzzy(LemmaSummary l, String query, double similarity) {
        return new ResolutionCandidate(l, MatchTier.FUZZY, MatchTier.FUZZY.code(), query, null, null,
                similarity, ConfidenceLabel.of(similarity));
    }

    public static ResolutionCandidate translation(LemmaSummary l, String variant) {
        return new ResolutionCandidate(l, MatchTier.TRANSLATION, MatchTier.TRANSLATION.code(), variant, null, null,
                1.0, ConfidenceLabel.of(1.0));
    }
}
