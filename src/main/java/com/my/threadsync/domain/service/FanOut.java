package com.my.threadsync.domain.service;

import io.smallrye.mutiny.Uni;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * 단계 내부의 병렬 처리를 크기가 고정된 작업 풀 위에서 실행한다.
 * 블로킹 작업은 {@link #submit(Supplier)} 로만 풀에 올라가고, {@link #all(List, Function)} 은 결과를 합치기만 한다.
 */
public class FanOut implements AutoCloseable {

    private final ExecutorService executor;
    private final int maxConcurrency;

    public FanOut(int maxConcurrency) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency는 1 이상이어야 합니다: " + maxConcurrency);
        }
        this.maxConcurrency = maxConcurrency;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(maxConcurrency, runnable -> {
            Thread thread = new Thread(runnable, "sync-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public int maxConcurrency() {
        return maxConcurrency;
    }

    public <T> Uni<T> submit(Supplier<T> task) {
        return Uni.createFrom().item(task).runSubscriptionOn(executor);
    }

    /**
     * 모든 항목을 동시에 구독하고 입력 순서대로 결과를 모은다.
     */
    public <T, R> Uni<List<R>> all(List<T> items, Function<T, Uni<R>> task) {
        if (items.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }
        List<Uni<R>> unis = items.stream().map(task).toList();
        return Uni.join().all(unis).andFailFast();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
