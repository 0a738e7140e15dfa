package com.vibedeutsch.backend.lexicon.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.vibedeutsch.backend.lexicon.enrich.EnrichmentProperties;
import org.springframework.cache.CacheManager;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** enrichment 結果快取：key = 正規化查詢，只放不落庫的結果 */
@Configuration
public class EnrichmentCacheConfig {

    public static final String ENRICHMENT_CACHE = "lexiconEnrichment";

    @Bean("lexiconCacheManager")
    public CacheManager lexiconCacheManager(EnrichmentProperties props) {
        CaffeineCacheManager mgr = new CaffeineCacheManager(ENRICHMENT_CACHE);
        mgr.setCaffeine(Caffeine.newBuilder()
                .expireAfterWrite(props.getCacheTtl())
                .maximumSize(props.getCacheMaxSize())
        );
        return mgr;
    }
}
