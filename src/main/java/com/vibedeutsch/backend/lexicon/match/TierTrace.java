package com.vibedeutsch.backend.lexicon.match;

import java.util.List;

/**
 * 單一層級的執行紀錄。
 *
 * @param skipReason 未執行時的原因（例如 QUERY_TOO_SHORT），有執行則為 null
 */
public record TierTrace(
        MatchTier tier,
        boolean attempted,
        String skipReason,
        List<ResolutionCandidate> candidates,
        List<ResolutionCandidate> suggestions
) {
    public static TierTrace skipped(MatchTier tier, String reason) {
        return new TierTrace(tier, false, reason, List.of(), List.of());
    }

    public static TierTrace ran(MatchTier tier, List<ResolutionCandidate> candidates) {
        return new TierTrace(tier, true, null, List.copyOf(candidates), List.of());
    }
}
