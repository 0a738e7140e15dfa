package com.vibedeutsch.backend.lexicon.service;

import com.vibedeutsch.backend.lexicon.match.RankedResultSet;
import com.vibedeutsch.backend.lexicon.match.ResolutionCandidate;
import com.vibedeutsch.backend.lexicon.match.ResolutionTrace;
import com.vibedeutsch.backend.lexicon.match.Suggestion;
import com.vibedeutsch.backend.lexicon.store.LexiconEntry;

import java.util.List;

/**
 * resolve() 唯一的回傳型別，只有這五種形狀。
 * NotFound / Rejected 一定帶（可能是空的）建議清單與 reason code。
 */
public sealed interface ResolutionResult
        permits ResolutionResult.Found, ResolutionResult.Ambiguous, ResolutionResult.NotFound,
                ResolutionResult.Rejected, ResolutionResult.TransientFailure {

    String status();

    /**
     * @param match   詞庫比對命中的候選；由 enrichment 新建或接上的詞條為 null
     * @param created enrichment 這次新建了詞條
     */
    record Found(LexiconEntry entry, ResolutionCandidate match, boolean created, ResolutionTrace trace)
            implements ResolutionResult {
        @Override public String status() { return "found"; }
    }

    record Ambiguous(RankedResultSet ranked, ResolutionTrace trace) implements ResolutionResult {
        @Override public String status() { return "ambiguous"; }
    }

    record NotFound(String reason, List<Suggestion> suggestions, ResolutionTrace trace) implements ResolutionResult {
        public NotFound {
            suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        }
        @Override public String status() { return "not_found"; }
    }

    record Rejected(String reason, List<Suggestion> suggestions, ResolutionTrace trace) implements ResolutionResult {
        public Rejected {
            suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        }
        @Override public String status() { return "rejected"; }
    }

    record TransientFailure(String reason, ResolutionTrace trace) implements ResolutionResult {
        @Override public String status() { return "transient_failure"; }
    }
}
