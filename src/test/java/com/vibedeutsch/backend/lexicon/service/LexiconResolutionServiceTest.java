package com.vibedeutsch.backend.lexicon.service;

import com.vibedeutsch.backend.lexicon.entity.SearchHistoryEntity;
import com.vibedeutsch.backend.lexicon.enrich.EnrichmentGateway;
import com.vibedeutsch.backend.lexicon.enrich.EnrichmentOutcome;
import com.vibedeutsch.backend.lexicon.match.AmbiguityAggregator;
import com.vibedeutsch.backend.lexicon.match.MatchTier;
import com.vibedeutsch.backend.lexicon.match.ResolverProperties;
import com.vibedeutsch.backend.lexicon.match.Suggestion;
import com.vibedeutsch.backend.lexicon.match.TieredResolver;
import com.vibedeutsch.backend.lexicon.nlp.LanguageHints;
import com.vibedeutsch.backend.lexicon.nlp.NormalizedQuery;
import com.vibedeutsch.backend.lexicon.nlp.QueryNormalizer;
import com.vibedeutsch.backend.lexicon.repo.SearchHistoryRepo;
import com.vibedeutsch.backend.lexicon.store.LexiconEntry;
import com.vibedeutsch.backend.lexicon.store.MorphologyStore;
import com.vibedeutsch.backend.testsupport.InMemoryMorphologyStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class LexiconResolutionServiceTest {

    private final QueryNormalizer normalizer = new QueryNormalizer(LanguageHints.germanDefaults());
    private final ResolverProperties props = new ResolverProperties();
    private InMemoryMorphologyStore store;
    private EnrichmentGateway gateway;
    private SearchHistoryService history;
    private LexiconResolutionService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryMorphologyStore();
        store.addLemma(1L, "gehen", "verb", null, 950);
        store.addForm(1L, "gehe", "praesens_ich", "present_1st_sg");
        store.addLemma(2L, "nehmen", "verb", null, 940);
        store.addLemma(10L, "Bank", "noun", "fem", 610);
        store.addLemma(11L, "Bank", "noun", "fem", 430);

        gateway = mock(EnrichmentGateway.class);
        history = mock(SearchHistoryService.class);
        service = newService(store);
    }

    private LexiconResolutionService newService(MorphologyStore s) {
        return new LexiconResolutionService(normalizer, new TieredResolver(s, props), new AmbiguityAggregator(),
                s, gateway, history, props);
    }

    private static LexiconEntry modelEntry(String lemma) {
        return new LexiconEntry(50, 500L, lemma, "noun", "masc", null, 0, "external-model", false, 0.75,
                Map.of("en", List.of("coffee")), List.of(), List.of());
    }

    @Test
    void inflected_form_is_found_without_enrichment() {
        ResolutionResult r = service.resolve("gehe");

        assertThat(r).isInstanceOf(ResolutionResult.Found.class);
        ResolutionResult.Found f = (ResolutionResult.Found) r;
        assertThat(f.entry().lemma()).isEqualTo("gehen");
        assertThat(f.match().tier()).isEqualTo(MatchTier.INFLECTED);
        assertThat(f.created()).isFalse();
        verifyNoInteractions(gateway);
        verify(history).record(any(NormalizedQuery.class), any(ResolutionResult.class));
    }

    @Test
    void homographs_are_ambiguous() {
        ResolutionResult r = service.resolve("Bank");

        assertThat(r).isInstanceOf(ResolutionResult.Ambiguous.class);
        ResolutionResult.Ambiguous a = (ResolutionResult.Ambiguous) r;
        assertThat(a.ranked().size()).isEqualTo(2);
        assertThat(a.ranked().top().lemma().lemmaId()).isEqualTo(10L);
    }

    @Test
    void autocorrected_model_answer_never_becomes_found() {
        when(gateway.enrich(any())).thenReturn(new EnrichmentOutcome.Rejected(
                EnrichmentGateway.REASON_AUTO_CORRECTION,
                List.of(Suggestion.fromModel("nehmen", "verb", "to take"))));

        ResolutionResult r = service.resolve("nim");

        assertThat(r).isInstanceOf(ResolutionResult.Rejected.class);
        ResolutionResult.Rejected rej = (ResolutionResult.Rejected) r;
        assertThat(rej.reason()).isEqualTo(EnrichmentGateway.REASON_AUTO_CORRECTION);
        assertThat(rej.suggestions()).extracting(Suggestion::word).containsExactly("nehmen");
    }

    @Test
    void enriched_entry_is_found_and_flagged_created() {
        when(gateway.enrich(any())).thenReturn(new EnrichmentOutcome.Resolved(modelEntry("Kaffee"), true));

        ResolutionResult r = service.resolve("Kaffee");

        assertThat(r).isInstanceOf(ResolutionResult.Found.class);
        assertThat(((ResolutionResult.Found) r).created()).isTrue();
        assertThat(((ResolutionResult.Found) r).match()).isNull();
    }

    @Test
    void fuzzy_suggestions_come_before_model_suggestions_and_are_deduped() {
        when(gateway.enrich(any())).thenReturn(new EnrichmentOutcome.Suggestions(
                EnrichmentGateway.REASON_NOT_A_WORD,
                List.of(Suggestion.fromModel("Gehen", "noun", "walking"), Suggestion.fromModel("geht", "verb", null))));

        ResolutionResult r = service.resolve("gehn");

        assertThat(r).isInstanceOf(ResolutionResult.NotFound.class);
        ResolutionResult.NotFound nf = (ResolutionResult.NotFound) r;
        assertThat(nf.suggestions()).extracting(Suggestion::word).startsWith("gehen").contains("geht");
        assertThat(nf.suggestions()).extracting(Suggestion::word).doesNotContain("Gehen");
        assertThat(nf.suggestions().get(0).origin()).isEqualTo(Suggestion.ORIGIN_FUZZY);
    }

    @Test
    void empty_input_is_not_found_without_touching_gateway() {
        ResolutionResult r = service.resolve("   ");

        assertThat(r).isInstanceOf(ResolutionResult.NotFound.class);
        assertThat(((ResolutionResult.NotFound) r).reason()).isEqualTo(LexiconResolutionService.REASON_EMPTY_QUERY);
        assertThat(store.calls()).isZero();
        verifyNoInteractions(gateway);
    }

    @Test
    void overlong_query_is_rejected() {
        ResolutionResult r = service.resolve("a".repeat(props.getMaxQueryLength() + 1));

        assertThat(r).isInstanceOf(ResolutionResult.Rejected.class);
        assertThat(((ResolutionResult.Rejected) r).reason()).isEqualTo(LexiconResolutionService.REASON_TOO_LONG);
        verifyNoInteractions(gateway);
    }

    @Test
    void enrichment_failure_is_transient() {
        when(gateway.enrich(any())).thenReturn(new EnrichmentOutcome.Failed(EnrichmentGateway.REASON_PROVIDER_TIMEOUT, true));

        ResolutionResult r = service.resolve("Kaffee");

        assertThat(r).isInstanceOf(ResolutionResult.TransientFailure.class);
        assertThat(((ResolutionResult.TransientFailure) r).reason()).isEqualTo(EnrichmentGateway.REASON_PROVIDER_TIMEOUT);
    }

    @Test
    void store_outage_becomes_transient_failure_not_exception() {
        MorphologyStore broken = mock(MorphologyStore.class);
        when(broken.findLemmaByExactText(anyString())).thenThrow(new DataAccessResourceFailureException("db down"));
        service = newService(broken);

        ResolutionResult r = service.resolve("gehen");

        assertThat(r).isInstanceOf(ResolutionResult.TransientFailure.class);
        assertThat(((ResolutionResult.TransientFailure) r).reason()).isEqualTo(LexiconResolutionService.REASON_STORE_UNAVAILABLE);
        verify(history).record(any(NormalizedQuery.class), any(ResolutionResult.class));
    }

    @Test
    void transaction_begin_failure_is_store_unavailable() {
        MorphologyStore broken = mock(MorphologyStore.class);
        when(broken.findLemmaByExactText(anyString()))
                .thenThrow(new CannotCreateTransactionException("could not open JPA EntityManager"));
        service = newService(broken);

        ResolutionResult r = service.resolve("gehen");

        assertThat(r).isInstanceOf(ResolutionResult.TransientFailure.class);
        assertThat(((ResolutionResult.TransientFailure) r).reason()).isEqualTo(LexiconResolutionService.REASON_STORE_UNAVAILABLE);
    }

    @Test
    void history_outage_does_not_change_the_result() {
        SearchHistoryRepo historyRepo = mock(SearchHistoryRepo.class);
        when(historyRepo.save(any(SearchHistoryEntity.class)))
                .thenThrow(new CannotCreateTransactionException("could not open JPA EntityManager"));
        history = new SearchHistoryService(historyRepo);
        service = newService(store);

        ResolutionResult r = service.resolve("gehen");

        assertThat(r).isInstanceOf(ResolutionResult.Found.class);
        assertThat(((ResolutionResult.Found) r).entry().lemma()).isEqualTo("gehen");
        verify(historyRepo).save(any(SearchHistoryEntity.class));
    }
}
