package com.my.threadsync.domain.exception;

import com.my.threadsync.domain.model.PipelineStage;

/**
 * 접근 검증이나 스레드 목록 조회처럼 실행 전체를 멈추는 실패.
 */
public class PipelineAbortedException extends RuntimeException {

    private final PipelineStage stage;

    public PipelineAbortedException(PipelineStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public PipelineStage stage() {
        return stage;
    }
}
