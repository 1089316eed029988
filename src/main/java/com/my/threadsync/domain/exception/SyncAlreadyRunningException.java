package com.my.threadsync.domain.exception;

public class SyncAlreadyRunningException extends RuntimeException {

    private final String runId;

    public SyncAlreadyRunningException(String channelId, String runId) {
        super("채널 " + channelId + " 에 대한 동기화가 이미 진행 중입니다. (runId: " + runId + ")");
        this.runId = runId;
    }

    public String runId() {
        return runId;
    }
}
