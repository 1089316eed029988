package com.my.threadsync.domain.model;

import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineRunTest {

    private static final OffsetDateTime START = OffsetDateTime.parse("2024-05-01T10:00:00Z");

    @Test
    void stages_only_move_forward() {
        PipelineRun run = new PipelineRun("r1", "C1", START);
        run.advance(PipelineStage.FETCHING_THREAD_LIST, "listing");

        assertThatThrownBy(() -> run.advance(PipelineStage.VALIDATING_ACCESS, "back"))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> run.advance(PipelineStage.COMPLETED, "done"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void snapshot_tracks_current_thread_until_next_stage() {
        PipelineRun run = new PipelineRun("r1", "C1", START);
        run.advance(PipelineStage.PUBLISHING, "Publishing 2 threads");
        run.working("1.1", "Publishing thread 1/2: 1.1");

        PipelineProgress during = run.snapshot();
        assertThat(during.currentStep()).isEqualTo(6);
        assertThat(during.totalSteps()).isEqualTo(7);
        assertThat(during.currentThread()).isEqualTo("1.1");

        SyncReport report = new SyncReport(1, List.of(), List.of(), List.of(), List.of(), 1, 1, 0, 0, List.of());
        run.complete(report, START.plusMinutes(1));

        PipelineProgress done = run.snapshot();
        assertThat(done.stage()).isEqualTo(PipelineStage.COMPLETED);
        assertThat(done.currentThread()).isNull();
        assertThat(done.message()).startsWith("Sync complete: 0 created");
    }

    @Test
    void failed_run_cannot_be_completed() {
        PipelineRun run = new PipelineRun("r1", "C1", START);
        run.fail("boom", START);

        assertThat(run.snapshot().currentStep()).isZero();
        assertThat(run.snapshot().failedStage()).isEqualTo(PipelineStage.STARTING);
        assertThat(run.snapshot().error()).isEqualTo("boom");
        assertThatThrownBy(() -> run.fail("again", START)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void failed_run_keeps_the_stage_it_failed_in() {
        PipelineRun run = new PipelineRun("r1", "C1", START);
        run.advance(PipelineStage.VALIDATING_ACCESS, "Validating channel access");
        run.advance(PipelineStage.DOWNLOADING_MEDIA, "Downloading media");

        run.fail("disk full", START);

        PipelineProgress progress = run.snapshot();
        assertThat(progress.stage()).isEqualTo(PipelineStage.ERROR);
        assertThat(progress.failedStage()).isEqualTo(PipelineStage.DOWNLOADING_MEDIA);
        assertThat(progress.currentStep()).isEqualTo(4);
        assertThat(progress.message()).isEqualTo("Sync failed: disk full");
    }

    @Test
    void report_summary_separates_local_and_remote_counts() {
        SyncReport report = new SyncReport(3,
                List.of(new ThreadSyncResult(SyncAction.CREATED, "1.1", 1L, "A", null)),
                List.of(),
                List.of(ThreadSyncResult.skipped("3.3", "thread has no messages")),
                List.of(new SyncError("2.2", PipelineStage.PUBLISHING, "HTTP 500")),
                2, 1, 4, 2, List.of(new SyncError("1.1", PipelineStage.DOWNLOADING_MEDIA, "too small")));

        assertThat(report.summary()).isEqualTo("Sync complete: 1 created, 0 updated, 1 skipped, 1 errors"
                + " | artifacts saved: 2 transcripts, 1 new scaffolds | media: 4 downloaded, 2 cached, 1 failed");
        assertThat(report.published()).isEqualTo(1);
    }
}
