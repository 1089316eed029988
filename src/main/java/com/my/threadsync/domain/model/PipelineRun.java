package com.my.threadsync.domain.model;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * 실행 하나의 진행 상태. 실행마다 새로 만들어 호출자에게 넘기며 전역 상태로 두지 않는다.
 */
public class PipelineRun {

    private final String runId;
    private final String channelId;
    private final OffsetDateTime startedAt;

    private PipelineStage stage = PipelineStage.STARTING;
    private PipelineStage failedStage;
    private String message = "Starting sync";
    private String currentThread;
    private OffsetDateTime finishedAt;
    private SyncReport report;
    private String error;

    public PipelineRun(String runId, String channelId, OffsetDateTime startedAt) {
        this.runId = Objects.requireNonNull(runId, "runId");
        this.channelId = channelId;
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
    }

    public String runId() {
        return runId;
    }

    public String channelId() {
        return channelId;
    }

    public synchronized PipelineStage stage() {
        return stage;
    }

    public synchronized boolean isFinished() {
        return stage.isTerminal();
    }

    public synchronized void advance(PipelineStage next, String message) {
        if (stage.isTerminal()) {
            throw new IllegalStateException("이미 종료된 실행입니다: " + runId);
        }
        if (next.isTerminal() || next.step() < stage.step()) {
            throw new IllegalStateException("허용되지 않는 단계 전이: " + stage + " -> " + next);
        }
        this.stage = next;
        this.message = message;
        this.currentThread = null;
    }

    public synchronized void working(String fingerprint, String message) {
        this.currentThread = fingerprint;
        this.message = message;
    }

    public synchronized void complete(SyncReport report, OffsetDateTime at) {
        requireLive();
        this.stage = PipelineStage.COMPLETED;
        this.report = report;
        this.message = report.summary();
        this.currentThread = null;
        this.finishedAt = at;
    }

    public synchronized void fail(String error, OffsetDateTime at) {
        requireLive();
        this.failedStage = stage;
        this.stage = PipelineStage.ERROR;
        this.error = error;
        this.message = "Sync failed: " + error;
        this.currentThread = null;
        this.finishedAt = at;
    }

    public synchronized OffsetDateTime finishedAt() {
        return finishedAt;
    }

    public synchronized PipelineProgress snapshot() {
        int step = stage == PipelineStage.ERROR ? failedStage.step() : stage.step();
        return new PipelineProgress(runId, channelId, stage, message, step, PipelineStage.TOTAL_STEPS,
                currentThread, startedAt, finishedAt, report, error, failedStage);
    }

    private void requireLive() {
        if (stage.isTerminal()) {
            throw new IllegalStateException("이미 종료된 실행입니다: " + runId);
        }
    }
}
