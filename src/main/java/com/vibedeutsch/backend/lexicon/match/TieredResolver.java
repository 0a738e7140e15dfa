package com.vibedeutsch.backend.lexicon.match;

import com.vibedeutsch.backend.lexicon.nlp.CaseVariantGenerator;
import com.vibedeutsch.backend.lexicon.nlp.DetectedLanguage;
import com.vibedeutsch.backend.lexicon.nlp.NormalizedQuery;
import com.vibedeutsch.backend.lexicon.nlp.Similarity;
import com.vibedeutsch.backend.lexicon.nlp.TextNorm;
import com.vibedeutsch.backend.lexicon.store.InflectedHit;
import com.vibedeutsch.backend.lexicon.store.LemmaSummary;
import com.vibedeutsch.backend.lexicon.store.MorphologyStore;
import com.vibedeutsch.backend.lexicon.store.SenseKey;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 分層比對：direct → inflected → article-stripped → fuzzy →（非德語）translation。
 * 前一層有候選就停，後面的層在 trace 裡標成 skipped。
 * <p>
 * 只讀、不寫，沒有共享狀態，可多執行緒同時呼叫。
 */
@Slf4j
public class TieredResolver {

    static final String SKIP_SHORT_CIRCUIT = "RESOLVED_BY_EARLIER_TIER";
    static final String SKIP_NO_ARTICLE = "NO_ARTICLE";
    static final String SKIP_TOO_SHORT = "QUERY_TOO_SHORT";
    static final String SKIP_TARGET_LANGUAGE = "TARGET_LANGUAGE_QUERY";

    private static final Comparator<ResolutionCandidate> FUZZY_ORDER =
            Comparator.comparingDouble(ResolutionCandidate::similarity).reversed()
                    .thenComparing(Comparator.comparingInt((ResolutionCandidate c) -> c.lemma().frequencyRank()).reversed())
                    .thenComparing(c -> c.lemma().text())
                    .thenComparingLong(c -> c.lemma().lemmaId());

    private final MorphologyStore store;
    private final ResolverProperties props;

    public TieredResolver(MorphologyStore store, ResolverProperties props) {
        this.store = store;
        this.props = props;
    }

    public TierResult resolve(NormalizedQuery q) {
        if (q == null || q.isEmpty()) {
            return new TierResult(List.of(), List.of(), ResolutionTrace.empty(""));
        }

        List<String> variants = CaseVariantGenerator.variants(q.text());
        List<TierTrace> traces = new ArrayList<>(MatchTier.values().length);
        List<ResolutionCandidate> suggestions = List.of();
        List<ResolutionCandidate> found = List.of();

        for (MatchTier tier : MatchTier.values()) {
            if (!found.isEmpty()) {
                traces.add(TierTrace.skipped(tier, SKIP_SHORT_CIRCUIT));
                continue;
            }
            switch (tier) {
                case DIRECT -> {
                    found = direct(variants, MatchTier.DIRECT);
                    traces.add(TierTrace.ran(tier, found));
                }
                case INFLECTED -> {
                    found = inflected(variants, MatchTier.INFLECTED);
                    traces.add(TierTrace.ran(tier, found));
                }
                case ARTICLE_STRIPPED -> {
                    if (!q.hasStrippedArticle()) {
                        traces.add(TierTrace.skipped(tier, SKIP_NO_ARTICLE));
                        continue;
                    }
                    List<String> stripped = CaseVariantGenerator.variants(q.strippedText());
                    found = direct(stripped, MatchTier.ARTICLE_STRIPPED);
                    if (found.isEmpty()) found = inflected(stripped, MatchTier.ARTICLE_STRIPPED);
                    traces.add(TierTrace.ran(tier, found));
                }
                case FUZZY -> {
                    String primary = q.primaryForm();
                    if (TextNorm.codePointLength(primary) < props.getMinFuzzyLength()) {
                        traces.add(TierTrace.skipped(tier, SKIP_TOO_SHORT));
                        continue;
                    }
                    TierTrace t = fuzzy(primary);
                    found = t.candidates();
                    suggestions = t.suggestions();
                    traces.add(t);
                }
                case TRANSLATION -> {
                    if (!wantsTranslationLookup(q)) {
                        traces.add(TierTrace.skipped(tier, SKIP_TARGET_LANGUAGE));
                        continue;
                    }
                    found = translation(variants);
                    traces.add(TierTrace.ran(tier, found));
                }
            }
        }

        log.debug("lexicon_tiers query={} variants={} candidates={} suggestions={}",
                q.text(), variants.size(), found.size(), suggestions.size());
        return new TierResult(found, suggestions, new ResolutionTrace(q.text(), variants, List.copyOf(traces)));
    }

    private List<ResolutionCandidate> direct(List<String> variants, MatchTier tier) {
        Map<SenseKey, ResolutionCandidate> out = new LinkedHashMap<>();
        for (String v : variants) {
            for (LemmaSummary l : store.findLemmaByExactText(v)) {
                out.putIfAbsent(l.key(), ResolutionCandidate.direct(l, tier, v));
            }
        }
        return List.copyOf(out.values());
    }

    private List<ResolutionCandidate> inflected(List<String> variants, MatchTier tier) {
        Map<SenseKey, ResolutionCandidate> out = new LinkedHashMap<>();
        for (String v : variants) {
            for (InflectedHit hit : store.findLemmaByInflectedForm(v)) {
                // 同一義項多個特徵命中（例如 1sg / 3pl 同形）時保留第一個
                out.putIfAbsent(hit.lemma().key(), ResolutionCandidate.inflected(hit, tier, v));
            }
        }
        return List.copyOf(out.values());
    }

    private TierTrace fuzzy(String primary) {
        List<LemmaSummary> window = store.candidatesByLengthWindow(primary, props.getLengthWindow(), props.getCandidateLimit());

        Map<SenseKey, ResolutionCandidate> scored = new LinkedHashMap<>();
        for (LemmaSummary l : window) {
            double sim = Similarity.ratio(primary, l.text());
            if (sim < props.getDisplayThreshold()) continue;
            scored.putIfAbsent(l.key(), ResolutionCandidate.fuzzy(l, primary, sim));
        }

        List<ResolutionCandidate> sorted = new ArrayList<>(scored.values());
        sorted.sort(FUZZY_ORDER);

        List<ResolutionCandidate> accepted = new ArrayList<>();
        List<ResolutionCandidate> shown = new ArrayList<>();
        for (ResolutionCandidate c : sorted) {
            if (c.similarity() >= props.getAutoAcceptThreshold()) {
                accepted.add(c);
            } else if (shown.size() < props.getMaxSuggestions()) {
                shown.add(c);
            }
        }
        return new TierTrace(MatchTier.FUZZY, true, null, List.copyOf(accepted), List.copyOf(shown));
    }

    private boolean wantsTranslationLookup(NormalizedQuery q) {
        DetectedLanguage lang = q.detectedLanguage();
        return lang != null
                && !lang.isTarget()
                && lang != DetectedLanguage.UNKNOWN
                && q.confidence() >= props.getTranslationMinConfidence();
    }

    private List<ResolutionCandidate> translation(List<String> variants) {
        Map<SenseKey, ResolutionCandidate> out = new LinkedHashMap<>();
        for (String v : variants) {
            for (LemmaSummary l : store.findSensesByTranslation(v)) {
                out.putIfAbsent(l.key(), ResolutionCandidate.translation(l, v));
            }
        }
        return List.copyOf(out.values());
    }
}
