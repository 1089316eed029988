package com.my.threadsync.adapter.in.idempotency;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryIdempotencyStoreTest {

    private final AtomicReference<OffsetDateTime> now =
            new AtomicReference<>(OffsetDateTime.of(2024, 5, 1, 9, 0, 0, 0, ZoneOffset.UTC));
    private final InMemoryIdempotencyStore store = new InMemoryIdempotencyStore(Duration.ofHours(24), now::get);

    @Test
    void remembers_processed_commands() {
        assertThat(store.isProcessed("cmd-1")).isFalse();

        store.markProcessed("cmd-1");

        assertThat(store.isProcessed("cmd-1")).isTrue();
        assertThat(store.isProcessed("cmd-2")).isFalse();
    }

    @Test
    void forgets_commands_after_ttl() {
        store.markProcessed("cmd-1");

        now.set(now.get().plusHours(23));
        assertThat(store.isProcessed("cmd-1")).isTrue();

        now.set(now.get().plusHours(2));
        assertThat(store.isProcessed("cmd-1")).isFalse();
    }
}
