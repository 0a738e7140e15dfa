package com.vibedeutsch.backend.lexicon.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.vibedeutsch.backend.lexicon.match.RankedResultSet;
import com.vibedeutsch.backend.lexicon.match.ResolutionCandidate;
import com.vibedeutsch.backend.lexicon.match.ResolutionTrace;
import com.vibedeutsch.backend.lexicon.match.Suggestion;
import com.vibedeutsch.backend.lexicon.match.TierTrace;
import com.vibedeutsch.backend.lexicon.service.ResolutionResult;
import com.vibedeutsch.backend.lexicon.store.LexiconEntry;

import java.util.List;

/**
 * GET /api/v1/lexicon/resolve 的回應。
 * status：found / ambiguous / not_found / rejected / transient_failure
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResolveResponse(
        String status,
        String query,
        String reason,
        LexiconEntry entry,
        CandidateDto match,
        Boolean created,
        Boolean autoSelectable,
        List<CandidateDto> candidates,
        List<Suggestion> suggestions,
        TraceDto trace
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CandidateDto(
            Integer rank,
            long lemmaId,
            Long senseId,
            String lemma,
            String pos,
            String gender,
            String tier,
            String matchType,
            String matchedVariant,
            String featureKey,
            String featureValue,
            double similarity,
            String confidence
    ) {
        static CandidateDto of(Integer rank, ResolutionCandidate c) {
            return new CandidateDto(
                    rank,
                    c.lemma().lemmaId(),
                    c.lemma().senseId(),
                    c.lemma().text(),
                    c.lemma().pos(),
                    c.lemma().gender(),
                    c.tier().code(),
                    c.matchType(),
                    c.matchedVariant(),
                    c.featureKey(),
                    c.featureValue(),
                    c.similarity(),
                    c.confidence().code()
            );
        }
    }

    public record TierDto(String tier, boolean attempted, String skipReason,
                          List<CandidateDto> candidates, List<CandidateDto> suggestions) {}

    public record TraceDto(List<String> variants, List<TierDto> tiers) {}

    public static ResolveResponse from(ResolutionResult r) {
        if (r instanceof ResolutionResult.Found f) {
            return new ResolveResponse(f.status(), query(f.trace()), null, f.entry(),
                    f.match() == null ? null : CandidateDto.of(null, f.match()),
                    f.created(), null, null, null, trace(f.trace()));
        }
        if (r instanceof ResolutionResult.Ambiguous a) {
            RankedResultSet set = a.ranked();
            List<CandidateDto> ranked = set.entries().stream()
                    .map(e -> CandidateDto.of(e.rank(), e.candidate()))
                    .toList();
            return new ResolveResponse(a.status(), query(a.trace()), null, null, null, null,
                    set.isLoneExactMatch(), ranked, null, trace(a.trace()));
        }
        if (r instanceof ResolutionResult.NotFound n) {
            return new ResolveResponse(n.status(), query(n.trace()), n.reason(), null, null, null, null, null,
                    n.suggestions(), trace(n.trace()));
        }
        if (r instanceof ResolutionResult.Rejected rj) {
            return new ResolveResponse(rj.status(), query(rj.trace()), rj.reason(), null, null, null, null, null,
                    rj.suggestions(), trace(rj.trace()));
        }
        ResolutionResult.TransientFailure t = (ResolutionResult.TransientFailure) r;
        return new ResolveResponse(t.status(), query(t.trace()), t.reason(), null, null, null, null, null,
                null, trace(t.trace()));
    }

    private static String query(ResolutionTrace t) {
        return t == null ? null : t.query();
    }

    private static TraceDto trace(ResolutionTrace t) {
        if (t == null || t.tiers().isEmpty()) return null;
        List<TierDto> tiers = t.tiers().stream().map(ResolveResponse::tier).toList();
        return new TraceDto(t.variants(), tiers);
    }

    private static TierDto tier(TierTrace tt) {
        return new TierDto(
                tt.tier().code(),
                tt.attempted(),
                tt.skipReason(),
                tt.candidates().stream().map(c -> CandidateDto.of(null, c)).toList(),
                tt.suggestions().stream().map(c -> CandidateDto.of(null, c)).toList()
        );
    }
}
