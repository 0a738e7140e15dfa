package com.vibedeutsch.backend.lexicon.config;

import com.vibedeutsch.backend.lexicon.enrich.EnrichmentGateway;
import com.vibedeutsch.backend.lexicon.enrich.EnrichmentProperties;
import com.vibedeutsch.backend.lexicon.enrich.InFlightRegistry;
import com.vibedeutsch.backend.lexicon.enrich.LexiconWriter;
import com.vibedeutsch.backend.lexicon.enrich.ModelAnalysisDecoder;
import com.vibedeutsch.backend.lexicon.match.AmbiguityAggregator;
import com.vibedeutsch.backend.lexicon.match.ResolverProperties;
import com.vibedeutsch.backend.lexicon.match.TieredResolver;
import com.vibedeutsch.backend.lexicon.nlp.LanguageHints;
import com.vibedeutsch.backend.lexicon.nlp.QueryNormalizer;
import com.vibedeutsch.backend.lexicon.provider.LexiconModelClient;
import com.vibedeutsch.backend.lexicon.store.MorphologyStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.CacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableConfigurationProperties({ResolverProperties.class, EnrichmentProperties.class})
public class LexiconConfig {

    @Bean
    public LanguageHints languageHints() {
        return LanguageHints.germanDefaults();
    }

    @Bean
    public QueryNormalizer queryNormalizer(LanguageHints hints) {
        return new QueryNormalizer(hints);
    }

    @Bean
    public TieredResolver tieredResolver(MorphologyStore store, ResolverProperties props) {
        return new TieredResolver(store, props);
    }

    @Bean
    public AmbiguityAggregator ambiguityAggregator() {
        return new AmbiguityAggregator();
    }

    @Bean
    public ModelAnalysisDecoder modelAnalysisDecoder(EnrichmentProperties props) {
        return new ModelAnalysisDecoder(props.getMaxSuggestions());
    }

    @Bean
    public EnrichmentGateway enrichmentGateway(
            LexiconModelClient modelClient,
            ModelAnalysisDecoder decoder,
            LexiconWriter writer,
            @Qualifier("lexiconCacheManager") CacheManager cacheManager,
            @Qualifier("lexiconEnrichmentExecutor") ThreadPoolTaskExecutor workExecutor,
            @Qualifier("lexiconModelExecutor") ThreadPoolTaskExecutor modelExecutor,
            EnrichmentProperties props
    ) {
        return new EnrichmentGateway(
                modelClient,
                decoder,
                writer,
                cacheManager.getCache(EnrichmentCacheConfig.ENRICHMENT_CACHE),
                new InFlightRegistry<>(),
                workExecutor,
                modelExecutor.getThreadPoolExecutor(),
                props
        );
    }
}
