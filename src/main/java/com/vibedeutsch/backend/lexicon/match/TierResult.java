package com.vibedeutsch.backend.lexicon.match;

import java.util.List;

/** Resolver 的輸出：決定性候選 + 低信心建議 + 軌跡 */
public record TierResult(
        List<ResolutionCandidate> candidates,
        List<ResolutionCandidate> suggestions,
        ResolutionTrace trace
) {
    public enum Kind { NONE, SINGLE, MULTIPLE }

    public Kind kind() {
        if (candidates.isEmpty()) return Kind.NONE;
        return candidates.size() == 1 ? Kind.SINGLE : Kind.MULTIPLE;
    }
}
