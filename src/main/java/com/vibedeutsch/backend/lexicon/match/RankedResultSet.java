package com.vibedeutsch.backend.lexicon.match;

import java.util.List;

/**
 * 排好序的候選清單，每一筆都帶分數與信心標籤，由呼叫端決定要不要直接選第一個。
 */
public record RankedResultSet(List<Ranked> entries) {

    public record Ranked(int rank, ResolutionCandidate candidate) {}

    public int size() { return entries.size(); }

    public boolean isEmpty() { return entries.isEmpty(); }

    public ResolutionCandidate top() {
        return entries.isEmpty() ? null : entries.get(0).candidate();
    }

    /** 只有「唯一一筆 direct 完全命中」才建議自動採用 */
    public boolean isLoneExactMatch() {
        return entries.size() == 1 && entries.get(0).candidate().tier() == MatchTier.DIRECT;
    }
}
