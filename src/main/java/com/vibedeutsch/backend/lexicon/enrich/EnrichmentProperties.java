package com.vibedeutsch.backend.lexicon.enrich;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "app.lexicon.enrichment")
public class EnrichmentProperties {

    /** 關掉就不呼叫模型，查不到直接 NotFound */
    private boolean enabled = true;

    /** 單次模型呼叫上限，超過就取消 */
    private Duration modelTimeout = Duration.ofSeconds(20);

    /** 呼叫端最多等多久（含排隊 + 寫入） */
    private Duration callerTimeout = Duration.ofSeconds(25);

    private Duration cacheTtl = Duration.ofMinutes(30);

    private long cacheMaxSize = 10_000;

    private int maxSuggestions = 5;
}
