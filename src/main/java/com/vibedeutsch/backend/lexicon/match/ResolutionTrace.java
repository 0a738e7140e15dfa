package com.vibedeutsch.backend.lexicon.match;

import java.util.List;

/** 整次比對的軌跡：每一層的結果都保留，不會默默丟掉 */
public record ResolutionTrace(
        String query,
        List<String> variants,
        List<TierTrace> tiers
) {
    public static ResolutionTrace empty(String query) {
        return new ResolutionTrace(query, List.of(), List.of());
    }
}
