package com.vibedeutsch.backend.lexicon.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * 啟動完成後匯入 seed 詞庫。失敗不讓服務起不來，只記 log。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.lexicon.seed", name = "enabled", havingValue = "true")
public class LexiconSeedImporter {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper om;
    private final LexiconSeedService seedService;

    @Value("${app.lexicon.seed.location:classpath:seed/lexicon-seed.json}")
    private String location;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        importFrom(location);
    }

    public LexiconSeedService.ImportStats importFrom(String loc) {
        Resource r = resourceLoader.getResource(loc);
        if (!r.exists()) {
            log.warn("lexicon_seed_missing location={}", loc);
            return new LexiconSeedService.ImportStats(0, 0);
        }
        try (InputStream in = r.getInputStream()) {
            LexiconSeedFile file = om.readValue(in, LexiconSeedFile.class);
            LexiconSeedService.ImportStats stats = seedService.importAll(file);
            log.info("lexicon_seed_done location={} imported={} skipped={}", loc, stats.imported(), stats.skipped());
            return stats;
        } catch (IOException e) {
            log.warn("lexicon_seed_failed location={} err={}", loc, e.toString());
            return new LexiconSeedService.ImportStats(0, 0);
        }
    }
}
