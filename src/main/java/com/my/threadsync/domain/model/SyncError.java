package com.my.threadsync.domain.model;

/**
 * 실행 보고서에 남는 격리된 실패 한 건.
 */
public record SyncError(String fingerprint, PipelineStage stage, String message) {
}
