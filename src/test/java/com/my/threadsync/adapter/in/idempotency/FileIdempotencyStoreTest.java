package com.my.threadsync.adapter.in.idempotency;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class FileIdempotencyStoreTest {

    @TempDir
    Path tempDir;

    private final AtomicReference<OffsetDateTime> now =
            new AtomicReference<>(OffsetDateTime.of(2024, 5, 1, 9, 0, 0, 0, ZoneOffset.UTC));

    @Test
    void creates_log_file_with_parent_directories() {
        Path logPath = tempDir.resolve("state/processed.log");

        new FileIdempotencyStore(logPath, Duration.ofHours(24), now::get);

        assertThat(logPath).exists();
    }

    @Test
    void survives_restart() {
        Path logPath = tempDir.resolve("processed.log");
        new FileIdempotencyStore(logPath, Duration.ofHours(24), now::get).markProcessed("cmd-1");

        FileIdempotencyStore reopened = new FileIdempotencyStore(logPath, Duration.ofHours(24), now::get);

        assertThat(reopened.isProcessed("cmd-1")).isTrue();
        assertThat(reopened.isProcessed("cmd-2")).isFalse();
    }

    @Test
    void expired_entries_are_ignored_and_compacted() throws Exception {
        Path logPath = tempDir.resolve("processed.log");
        FileIdempotencyStore store = new FileIdempotencyStore(logPath, Duration.ofHours(1), now::get);
        store.markProcessed("old");

        now.set(now.get().plusHours(2));
        assertThat(store.isProcessed("old")).isFalse();

        store.markProcessed("new");
        assertThat(Files.readAllLines(logPath)).singleElement().asString().startsWith("new|");
    }

    @Test
    void malformed_lines_are_skipped() throws Exception {
        Path logPath = tempDir.resolve("processed.log");
        long millis = now.get().toInstant().toEpochMilli();
        Files.writeString(logPath, "garbage\ncmd-1|not-a-number\ncmd-2|" + millis + "\n");

        FileIdempotencyStore store = new FileIdempotencyStore(logPath, Duration.ofHours(24), now::get);

        assertThat(store.isProcessed("cmd-1")).isFalse();
        assertThat(store.isProcessed("cmd-2")).isTrue();
    }
}
