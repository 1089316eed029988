package com.my.threadsync.domain.model;

/**
 * 동기화 실행의 단계. 선형으로만 전이하며 COMPLETED/ERROR 가 종료 상태다.
 */
public enum PipelineStage {
    STARTING(0, "starting"),
    VALIDATING_ACCESS(1, "validating-access"),
    FETCHING_THREAD_LIST(2, "fetching-thread-list"),
    FETCHING_THREAD_MESSAGES(3, "fetching-thread-messages"),
    DOWNLOADING_MEDIA(4, "downloading-media"),
    EXPORTING_TRANSCRIPTS(5, "exporting-transcripts"),
    PUBLISHING(6, "publishing"),
    COMPLETED(7, "completed"),
    ERROR(-1, "error");

    public static final int TOTAL_STEPS = 7;

    private final int step;
    private final String label;

    PipelineStage(int step, String label) {
        this.step = step;
        this.label = label;
    }

    public int step() {
        return step;
    }

    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == ERROR;
    }
}
