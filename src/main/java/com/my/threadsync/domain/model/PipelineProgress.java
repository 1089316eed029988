package com.my.threadsync.domain.model;

import java.time.OffsetDateTime;

/**
 * {@link PipelineRun} 의 불변 스냅샷. 폴링하는 쪽에 그대로 넘겨도 안전하다.
 * 실패한 실행은 {@code failedStage} 와 그 단계의 {@code currentStep} 을 유지한다.
 */
public record PipelineProgress(String runId,
                               String channelId,
                               PipelineStage stage,
                               String message,
                               int currentStep,
                               int totalSteps,
                               String currentThread,
                               OffsetDateTime startedAt,
                               OffsetDateTime finishedAt,
                               SyncReport report,
                               String error,
                               PipelineStage failedStage) {
}
