package com.vibedeutsch.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableAsync
public class AsyncSchedulingConfig {

    /** enrichment 流程（解碼 + 驗證 + 寫入），每個 key 同時最多一份 */
    @Bean("lexiconEnrichmentExecutor")
    public ThreadPoolTaskExecutor lexiconEnrichmentExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(4);
        ex.setMaxPoolSize(8);
        ex.setQueueCapacity(200);
        ex.setThreadNamePrefix("lexicon-enrich-");
        ex.initialize();
        return ex;
    }

    /** 外部模型呼叫（會阻塞），跟 enrichment 分開避免互相卡死 */
    @Bean("lexiconModelExecutor")
    public ThreadPoolTaskExecutor lexiconModelExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(4);
        ex.setMaxPoolSize(8);
        ex.setQueueCapacity(200);
        ex.setThreadNamePrefix("lexicon-model-");
        ex.initialize();
        return ex;
    }

    @Bean("historyPurgeExecutor")
    public TaskExecutor historyPurgeExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(1);
        ex.setMaxPoolSize(1);
        ex.setQueueCapacity(10);
        ex.setThreadNamePrefix("history-purge-");
        ex.initialize();
        return ex;
    }
}
