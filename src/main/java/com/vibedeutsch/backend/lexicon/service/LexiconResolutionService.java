package com.vibedeutsch.backend.lexicon.service;

import com.vibedeutsch.backend.lexicon.enrich.EnrichmentGateway;
import com.vibedeutsch.backend.lexicon.enrich.EnrichmentOutcome;
import com.vibedeutsch.backend.lexicon.match.AmbiguityAggregator;
import com.vibedeutsch.backend.lexicon.match.ResolutionCandidate;
import com.vibedeutsch.backend.lexicon.match.ResolutionTrace;
import com.vibedeutsch.backend.lexicon.match.ResolverProperties;
import com.vibedeutsch.backend.lexicon.match.Suggestion;
import com.vibedeutsch.backend.lexicon.match.TierResult;
import com.vibedeutsch.backend.lexicon.match.TieredResolver;
import com.vibedeutsch.backend.lexicon.nlp.NormalizedQuery;
import com.vibedeutsch.backend.lexicon.nlp.QueryNormalizer;
import com.vibedeutsch.backend.lexicon.nlp.TextNorm;
import com.vibedeutsch.backend.lexicon.store.LexiconEntry;
import com.vibedeutsch.backend.lexicon.store.MorphologyStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 對外唯一入口：resolve(raw) → Found | Ambiguous | NotFound | Rejected | TransientFailure。
 * 例外不會穿出這一層。
 */
@Slf4j
@Service
public class LexiconResolutionService {

    public static final String REASON_EMPTY_QUERY = "EMPTY_QUERY";
    public static final String REASON_TOO_LONG = "QUERY_TOO_LONG";
    public static final String REASON_STORE_UNAVAILABLE = "STORE_UNAVAILABLE";
    public static final String REASON_INTERNAL = "INTERNAL_ERROR";

    private final QueryNormalizer normalizer;
    private final TieredResolver resolver;
    private final AmbiguityAggregator aggregator;
    private final MorphologyStore store;
    private final EnrichmentGateway gateway;
    private final SearchHistoryService history;
    private final ResolverProperties props;

    public LexiconResolutionService(QueryNormalizer normalizer,
                                    TieredResolver resolver,
                                    AmbiguityAggregator aggregator,
                                    MorphologyStore store,
                                    EnrichmentGateway gateway,
                                    SearchHistoryService history,
                                    ResolverProperties props) {
        this.normalizer = normalizer;
        this.resolver = resolver;
        this.aggregator = aggregator;
        this.store = store;
        this.gateway = gateway;
        this.history = history;
        this.props = props;
    }

    public ResolutionResult resolve(String raw) {
        NormalizedQuery q = normalizer.normalize(raw);
        ResolutionResult result;
        try {
            result = resolveNormalized(q);
        } catch (DataAccessException | TransactionException e) {
            log.warn("lexicon_store_unavailable query={} err={}", q.text(), e.toString());
            result = new ResolutionResult.TransientFailure(REASON_STORE_UNAVAILABLE, ResolutionTrace.empty(q.text()));
        } catch (RuntimeException e) {
            log.error("lexicon_resolve_failed query={}", q.text(), e);
            result = new ResolutionResult.TransientFailure(REASON_INTERNAL, ResolutionTrace.empty(q.text()));
        }

        log.info("lexicon_resolve query={} lang={} status={}", q.text(), q.detectedLanguage().tag(), result.status());
        history.record(q, result);
        return result;
    }

    private ResolutionResult resolveNormalized(NormalizedQuery q) {
        if (q.isEmpty()) {
            return new ResolutionResult.NotFound(REASON_EMPTY_QUERY, List.of(), ResolutionTrace.empty(""));
        }
        if (TextNorm.codePointLength(q.text()) > props.getMaxQueryLength()) {
            return new ResolutionResult.Rejected(REASON_TOO_LONG, List.of(), ResolutionTrace.empty(q.text()));
        }

        TierResult tiers = resolver.resolve(q);
        ResolutionTrace trace = tiers.trace();

        switch (tiers.kind()) {
            case SINGLE -> {
                ResolutionCandidate c = tiers.candidates().get(0);
                Optional<LexiconEntry> entry = store.loadEntry(c.key());
                if (entry.isEmpty()) {
                    // 比對到之後被刪掉了
                    return new ResolutionResult.TransientFailure(REASON_STORE_UNAVAILABLE, trace);
                }
                return new ResolutionResult.Found(entry.get(), c, false, trace);
            }
            case MULTIPLE -> {
                return new ResolutionResult.Ambiguous(aggregator.aggregate(tiers.candidates()), trace);
            }
            default -> {
                List<Suggestion> fuzzy = tiers.suggestions().stream().map(Suggestion::fromFuzzy).toList();
                return fromEnrichment(gateway.enrich(q), fuzzy, trace);
            }
        }
    }

    private ResolutionResult fromEnrichment(EnrichmentOutcome o, List<Suggestion> fuzzy, ResolutionTrace trace) {
        if (o instanceof EnrichmentOutcome.Resolved r) {
            return new ResolutionResult.Found(r.entry(), null, r.created(), trace);
        }
        if (o instanceof EnrichmentOutcome.Suggestions s) {
            // 詞庫裡相近的字排前面
            return new ResolutionResult.NotFound(s.reason(), merge(fuzzy, s.suggestions()), trace);
        }
        if (o instanceof EnrichmentOutcome.Rejected r) {
            return new ResolutionResult.Rejected(r.reason(), merge(r.suggestions(), fuzzy), trace);
        }
        EnrichmentOutcome.Failed f = (EnrichmentOutcome.Failed) o;
        return new ResolutionResult.TransientFailure(f.reason(), trace);
    }

    private List<Suggestion> merge(List<Suggestion> first, List<Suggestion> second) {
        int max = props.getMaxSuggestions();
        Set<String> seen = new HashSet<>();
        List<Suggestion> out = new ArrayList<>(max);
        for (List<Suggestion> list : List.of(first, second)) {
            for (Suggestion s : list) {
                if (out.size() >= max) return out;
                if (seen.add(TextNorm.caseFold(s.word()))) out.add(s);
            }
        }
        return out;
    }
}
