package com.my.threadsync.domain.service;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FanOutTest {

    @Test
    void results_keep_input_order() {
        try (FanOut fanOut = new FanOut(4)) {
            List<Integer> result = fanOut.all(List.of(30, 10, 20), delay -> fanOut.submit(() -> {
                sleep(delay);
                return delay;
            })).await().indefinitely();

            assertThat(result).containsExactly(30, 10, 20);
        }
    }

    @Test
    void never_runs_more_tasks_than_pool_size() {
        try (FanOut fanOut = new FanOut(2)) {
            AtomicInteger running = new AtomicInteger();
            AtomicInteger peak = new AtomicInteger();

            fanOut.all(List.of(1, 2, 3, 4, 5, 6), i -> fanOut.submit(() -> {
                peak.accumulateAndGet(running.incrementAndGet(), Math::max);
                sleep(20);
                running.decrementAndGet();
                return i;
            })).await().indefinitely();

            assertThat(peak.get()).isLessThanOrEqualTo(2);
        }
    }

    @Test
    void tasks_run_concurrently() throws InterruptedException {
        try (FanOut fanOut = new FanOut(2)) {
            CountDownLatch both = new CountDownLatch(2);

            fanOut.all(List.of(1, 2), i -> fanOut.submit(() -> {
                both.countDown();
                try {
                    return both.await(2, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            })).await().indefinitely();

            assertThat(both.getCount()).isZero();
        }
    }

    @Test
    void empty_input_completes_immediately() {
        try (FanOut fanOut = new FanOut(1)) {
            assertThat(fanOut.all(List.<Integer>of(), i -> fanOut.submit(() -> i)).await().indefinitely()).isEmpty();
        }
    }

    @Test
    void pool_size_must_be_positive() {
        assertThatThrownBy(() -> new FanOut(0)).isInstanceOf(IllegalArgumentException.class);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
