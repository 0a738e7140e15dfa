package com.vibedeutsch.backend.lexicon.job;

import com.vibedeutsch.backend.lexicon.repo.SearchHistoryRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

// 每天清一次，保留最近 N 天
@Component
@RequiredArgsConstructor
@Slf4j
public class SearchHistoryPurgeJob {

    private final SearchHistoryRepo repo;
    private final TransactionTemplate tx;

    @Value("${app.lexicon.history.purge.enabled:true}") private boolean enabled;
    @Value("${app.lexicon.history.purge.retention-days:90}") private int retentionDays;
    @Value("${app.lexicon.history.purge.batch-size:5000}") private int batchSize;
    @Value("${app.lexicon.history.purge.max-total-per-run:500000}") private int maxTotalPerRun;

    /** 每日 04:20（台北時間） */
    @Scheduled(cron = "${app.lexicon.history.purge.cron:0 20 4 * * *}", zone = "Asia/Taipei")
    @Async("historyPurgeExecutor")
    public void scheduledPurge() {
        if (!enabled) return;
        purge(Instant.now());
    }

    public int purge(Instant now) {
        Instant cutoff = now.minus(Duration.ofDays(retentionDays));
        int total = 0;

        while (true) {
            List<Long> ids = repo.findIdsOlderThan(cutoff, PageRequest.of(0, batchSize));
            if (ids.isEmpty()) break;

            Integer n = tx.execute(status -> repo.deleteByIds(ids));
            int deleted = n == null ? 0 : n;
            total += deleted;
            if (shouldStop(total, ids.size(), batchSize, maxTotalPerRun) || deleted == 0) break;
        }

        log.info("search_history_purge cutoff={} deleted={} retentionDays={} batchSize={}",
                cutoff, total, retentionDays, batchSize);
        return total;
    }

    static boolean shouldStop(int deletedSoFar, int lastBatch, int batchSize, int maxTotal) {
        return lastBatch < batchSize || deletedSoFar >= maxTotal;
    }
}
