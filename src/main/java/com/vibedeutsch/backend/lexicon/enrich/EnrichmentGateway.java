package com.vibedeutsch.backend.lexicon.enrich;

import com.fasterxml.jackson.databind.JsonNode;
import com.vibedeutsch.backend.lexicon.enrich.InFlightRegistry.Ticket;
import com.vibedeutsch.backend.lexicon.enrich.ModelAnalysis.InvalidAnalysis;
import com.vibedeutsch.backend.lexicon.enrich.ModelAnalysis.MalformedResponse;
import com.vibedeutsch.backend.lexicon.enrich.ModelAnalysis.SuggestedWord;
import com.vibedeutsch.backend.lexicon.enrich.ModelAnalysis.SuggestionList;
import com.vibedeutsch.backend.lexicon.enrich.ModelAnalysis.ValidAnalysis;
import com.vibedeutsch.backend.lexicon.match.Suggestion;
import com.vibedeutsch.backend.lexicon.nlp.NormalizedQuery;
import com.vibedeutsch.backend.lexicon.nlp.TextNorm;
import com.vibedeutsch.backend.lexicon.provider.LexiconModelClient;
import com.vibedeutsch.backend.lexicon.provider.ProviderErrorMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.Cache;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.TransactionException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 用外部模型擴充詞庫，但不讓模型的「自動更正」污染詞庫：
 * <ol>
 *   <li>prompt 帶原字，要求模型原樣回傳 input_word</li>
 *   <li>回傳的 input_word 與查詢 case-fold 後不同 → 拒絕，只當建議，不寫入</li>
 *   <li>lemma 再驗一次：不是原字、也不在它自己的變化形裡 → 改用原字當 lemma 並標 needs_review</li>
 *   <li>單一交易寫入；同一 key 同時只會有一份工作在跑</li>
 * </ol>
 * 只有「不落庫」的結果（建議 / 拒絕）會進快取。
 */
@Slf4j
public class EnrichmentGateway {

    public static final String REASON_AUTO_CORRECTION = "AUTO_CORRECTION_REJECTED";
    public static final String REASON_NOT_A_WORD = "NOT_A_GERMAN_WORD";
    public static final String REASON_EMPTY_QUERY = "EMPTY_QUERY";
    public static final String REASON_DISABLED = "ENRICHMENT_DISABLED";
    public static final String REASON_TIMEOUT = "ENRICHMENT_TIMEOUT";
    public static final String REASON_BUSY = "ENRICHMENT_BUSY";
    public static final String REASON_FAILED = "ENRICHMENT_FAILED";
    public static final String REASON_INTERRUPTED = "ENRICHMENT_INTERRUPTED";
    public static final String REASON_PROVIDER_TIMEOUT = "PROVIDER_TIMEOUT";
    public static final String REASON_BAD_PAYLOAD = "PROVIDER_BAD_PAYLOAD";
    public static final String REASON_STORE_UNAVAILABLE = "STORE_UNAVAILABLE";
    public static final String REASON_CONFLICT = "PERSISTENCE_CONFLICT";

    private final LexiconModelClient model;
    private final ModelAnalysisDecoder decoder;
    private final LexiconWriter writer;
    private final Cache cache;
    private final InFlightRegistry<EnrichmentOutcome> registry;
    private final Executor workExecutor;
    /** 模型呼叫要能 cancel(true) 中斷，所以用 ExecutorService 的 FutureTask */
    private final ExecutorService modelExecutor;
    private final EnrichmentProperties props;

    public EnrichmentGateway(LexiconModelClient model,
                             ModelAnalysisDecoder decoder,
                             LexiconWriter writer,
                             Cache cache,
                             InFlightRegistry<EnrichmentOutcome> registry,
                             Executor workExecutor,
                             ExecutorService modelExecutor,
                             EnrichmentProperties props) {
        this.model = model;
        this.decoder = decoder;
        this.writer = writer;
        this.cache = cache;
        this.registry = registry;
        this.workExecutor = workExecutor;
        this.modelExecutor = modelExecutor;
        this.props = props;
    }

    public EnrichmentOutcome enrich(NormalizedQuery q) {
        String word = q == null ? "" : q.primaryForm();
        String key = q == null ? "" : q.foldedKey();
        if (key.isEmpty()) return new EnrichmentOutcome.Suggestions(REASON_EMPTY_QUERY, List.of());
        if (!props.isEnabled()) return new EnrichmentOutcome.Suggestions(REASON_DISABLED, List.of());

        EnrichmentOutcome cached = cache.get(key, EnrichmentOutcome.class);
        if (cached != null) {
            log.debug("lexicon_enrich_cache_hit key={}", key);
            return cached;
        }

        Ticket<EnrichmentOutcome> ticket = registry.runOrJoin(key, () -> run(word, key), workExecutor);
        try {
            return ticket.future().get(props.getCallerTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // 不取消共享的 future：其他等待者與寫入照常完成
            log.warn("lexicon_enrich_caller_timeout key={} leader={} timeoutMs={}",
                    key, ticket.leader(), props.getCallerTimeout().toMillis());
            return new EnrichmentOutcome.Failed(REASON_TIMEOUT, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new EnrichmentOutcome.Failed(REASON_INTERRUPTED, true);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RejectedExecutionException) {
                log.warn("lexicon_enrich_rejected_by_pool key={}", key);
                return new EnrichmentOutcome.Failed(REASON_BUSY, true);
            }
            log.error("lexicon_enrich_failed key={} err={}", key, cause == null ? null : cause.toString(), cause);
            return new EnrichmentOutcome.Failed(REASON_FAILED, true);
        }
    }

    /** registry 內實際執行的工作（每個 key 同時只有一份） */
    EnrichmentOutcome run(String word, String key) {
        JsonNode raw;
        Future<JsonNode> call = modelExecutor.submit(() -> model.analyze(word));
        try {
            raw = call.get(props.getModelTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("lexicon_enrich_model_timeout word={} provider={} timeoutMs={}",
                    word, model.providerCode(), props.getModelTimeout().toMillis());
            return new EnrichmentOutcome.Failed(REASON_PROVIDER_TIMEOUT, true);
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            return new EnrichmentOutcome.Failed(REASON_INTERRUPTED, true);
        } catch (ExecutionException e) {
            ProviderErrorMapper.Mapped mapped = ProviderErrorMapper.map(e.getCause());
            if (mapped.refused()) {
                log.warn("lexicon_enrich_refused word={} code={}", word, mapped.code());
                return remember(key, new EnrichmentOutcome.Rejected(mapped.code(), List.of()));
            }
            log.warn("lexicon_enrich_model_failed word={} code={} retryAfterSec={}",
                    word, mapped.code(), mapped.retryAfterSec());
            return new EnrichmentOutcome.Failed(mapped.code(), mapped.retryable());
        }

        ModelAnalysis analysis = decoder.decode(raw, word);
        if (analysis instanceof MalformedResponse m) {
            log.warn("lexicon_enrich_malformed word={} detail={}", word, m.detail());
            return new EnrichmentOutcome.Failed(REASON_BAD_PAYLOAD, true);
        }

        String echoed = echoedInput(analysis);
        if (!TextNorm.caseFold(echoed).equals(key)) {
            log.warn("lexicon_autocorrect_rejected query={} echoed={}", word, echoed);
            return remember(key, new EnrichmentOutcome.Rejected(REASON_AUTO_CORRECTION, correctionSuggestions(analysis, echoed)));
        }

        if (analysis instanceof InvalidAnalysis) {
            return remember(key, new EnrichmentOutcome.Suggestions(REASON_NOT_A_WORD, List.of()));
        }
        if (analysis instanceof SuggestionList list) {
            return remember(key, new EnrichmentOutcome.Suggestions(REASON_NOT_A_WORD, toSuggestions(list.suggestions())));
        }
        return persist(word, key, (ValidAnalysis) analysis);
    }

    private EnrichmentOutcome persist(String word, String key, ValidAnalysis v) {
        String lemmaText = v.lemma();
        boolean needsReview = false;
        // 二次驗證：lemma 必須是原字本身，或原字出現在模型給的變化形裡
        if (!TextNorm.caseFold(v.lemma()).equals(key) && !v.hasForm(key)) {
            log.warn("lexicon_lemma_mismatch query={} lemma={} fallback=query", word, v.lemma());
            lemmaText = word;
            needsReview = true;
        }

        try {
            LexiconWriter.Written w = writer.write(key, lemmaText, v, needsReview);
            return new EnrichmentOutcome.Resolved(w.entry(), w.created());
        } catch (DataIntegrityViolationException e) {
            // 另一台機器先寫入同一個 key：丟掉自己的結果，回傳贏家
            log.info("lexicon_enrich_lost_race key={}", key);
            return writer.findByEnrichmentKey(key)
                    .<EnrichmentOutcome>map(entry -> new EnrichmentOutcome.Resolved(entry, false))
                    .orElseGet(() -> new EnrichmentOutcome.Failed(REASON_CONFLICT, true));
        } catch (DataAccessException | TransactionException e) {
            log.warn("lexicon_enrich_write_failed key={} err={}", key, e.toString());
            return new EnrichmentOutcome.Failed(REASON_STORE_UNAVAILABLE, true);
        }
    }

    private EnrichmentOutcome remember(String key, EnrichmentOutcome outcome) {
        cache.put(key, outcome);
        return outcome;
    }

    private static String echoedInput(ModelAnalysis a) {
        if (a instanceof ValidAnalysis v) return v.echoedInput();
        if (a instanceof InvalidAnalysis i) return i.echoedInput();
        if (a instanceof SuggestionList s) return s.echoedInput();
        return "";
    }

    /** 模型其實分析了另一個字：那個字本身就是「你是不是要找」 */
    private List<Suggestion> correctionSuggestions(ModelAnalysis a, String echoed) {
        List<Suggestion> out = new ArrayList<>();
        if (a instanceof ValidAnalysis v) {
            List<String> en = v.translations().get("en");
            out.add(Suggestion.fromModel(v.lemma(), v.pos(), en == null || en.isEmpty() ? null : en.get(0)));
            if (!TextNorm.sameFolded(v.lemma(), echoed)) out.add(0, Suggestion.fromModel(echoed, v.pos(), null));
        } else {
            out.add(Suggestion.fromModel(echoed, null, null));
            if (a instanceof SuggestionList s) out.addAll(toSuggestions(s.suggestions()));
        }
        return out.size() > props.getMaxSuggestions() ? out.subList(0, props.getMaxSuggestions()) : out;
    }

    private static List<Suggestion> toSuggestions(List<SuggestedWord> words) {
        List<Suggestion> out = new ArrayList<>(words.size());
        for (SuggestedWord w : words) {
            out.add(Suggestion.fromModel(w.word(), w.pos(), w.meaning()));
        }
        return out;
    }
}
