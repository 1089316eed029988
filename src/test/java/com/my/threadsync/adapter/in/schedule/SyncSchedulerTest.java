package com.my.threadsync.adapter.in.schedule;

import com.my.threadsync.config.AppConfig;
import com.my.threadsync.domain.exception.SyncAlreadyRunningException;
import com.my.threadsync.domain.port.in.SyncThreadsUseCase;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class SyncSchedulerTest {

    private final SyncThreadsUseCase syncThreads = mock(SyncThreadsUseCase.class);

    @Test
    void zero_interval_never_syncs() {
        SyncScheduler scheduler = new SyncScheduler(syncThreads, config(0));

        scheduler.start();
        scheduler.stop();

        verifyNoInteractions(syncThreads);
    }

    @Test
    void overlapping_run_is_skipped_quietly() {
        when(syncThreads.syncAll()).thenThrow(new SyncAlreadyRunningException("C1", "run-1"));
        SyncScheduler scheduler = new SyncScheduler(syncThreads, config(0));

        assertThatCode(scheduler::syncSafely).doesNotThrowAnyException();
        verify(syncThreads).syncAll();
    }

    @Test
    void failures_do_not_escape_the_timer() {
        when(syncThreads.syncAll()).thenThrow(new IllegalStateException("Slack down"));
        SyncScheduler scheduler = new SyncScheduler(syncThreads, config(0));

        assertThatCode(scheduler::syncSafely).doesNotThrowAnyException();
    }

    private static AppConfig config(int intervalMinutes) {
        AppConfig config = mock(AppConfig.class, RETURNS_DEEP_STUBS);
        when(config.schedule().intervalMinutes()).thenReturn(intervalMinutes);
        return config;
    }
}
