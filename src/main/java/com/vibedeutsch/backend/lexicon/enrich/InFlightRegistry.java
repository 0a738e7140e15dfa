package com.vibedeutsch.backend.lexicon.enrich;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * 同一個 key 同時只跑一份工作；後到的呼叫端直接拿同一個 future。
 * entry 在工作結束（成功、例外、排程被拒）時一定移除。
 */
@Slf4j
public class InFlightRegistry<T> {

    private final ConcurrentHashMap<String, CompletableFuture<T>> inFlight = new ConcurrentHashMap<>();

    public record Ticket<T>(CompletableFuture<T> future, boolean leader) {}

    public Ticket<T> runOrJoin(String key, Supplier<T> work, Executor executor) {
        CompletableFuture<T> mine = new CompletableFuture<>();
        CompletableFuture<T> existing = inFlight.putIfAbsent(key, mine);
        if (existing != null) {
            log.debug("inflight_join key={}", key);
            return new Ticket<>(existing, false);
        }

        try {
            executor.execute(() -> {
                try {
                    mine.complete(work.get());
                } catch (RuntimeException | Error e) {
                    mine.completeExceptionally(e);
                } finally {
                    // 先 complete 再移除：這段時間進來的人拿到的是已完成的結果
                    inFlight.remove(key, mine);
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.remove(key, mine);
            mine.completeExceptionally(e);
        }
        return new Ticket<>(mine, true);
    }

    public boolean isInFlight(String key) {
        return inFlight.containsKey(key);
    }

    public int size() {
        return inFlight.size();
    }
}
