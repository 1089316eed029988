package com.my.threadsync.domain.service;

import com.my.threadsync.domain.exception.SyncAlreadyRunningException;
import com.my.threadsync.domain.model.PipelineRun;
import com.my.threadsync.domain.port.out.ClockPort;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * 실행 컨텍스트를 runId 로 조회할 수 있게 보관하고, 종료 후 일정 시간이 지나면 지운다.
 * 같은 채널에 대해 프로세스 안에서 동시에 하나의 실행만 허용한다.
 */
public class PipelineRunRegistry implements AutoCloseable {

    private final ClockPort clockPort;
    private final Duration retention;
    private final Map<String, PipelineRun> runs = new ConcurrentHashMap<>();
    private final Map<String, String> liveRunByChannel = new ConcurrentHashMap<>();
    private final ScheduledExecutorService evictor;

    public PipelineRunRegistry(ClockPort clockPort, Duration retention) {
        this.clockPort = clockPort;
        this.retention = retention;
        this.evictor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "pipeline-run-evictor");
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized PipelineRun begin(String channelId) {
        String key = channelKey(channelId);
        String liveRunId = liveRunByChannel.get(key);
        if (liveRunId != null) {
            PipelineRun live = runs.get(liveRunId);
            if (live != null && !live.isFinished()) {
                throw new SyncAlreadyRunningException(channelId, liveRunId);
            }
        }
        PipelineRun run = new PipelineRun(UUID.randomUUID().toString(), channelId, clockPort.now());
        runs.put(run.runId(), run);
        liveRunByChannel.put(key, run.runId());
        return run;
    }

    public synchronized void finished(PipelineRun run) {
        liveRunByChannel.remove(channelKey(run.channelId()), run.runId());
        evictor.schedule(() -> runs.remove(run.runId()), retention.toMillis(), TimeUnit.MILLISECONDS);
    }

    public Optional<PipelineRun> find(String runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    public Optional<PipelineRun> liveRun(String channelId) {
        String runId = liveRunByChannel.get(channelKey(channelId));
        return runId == null ? Optional.empty() : find(runId);
    }

    @Override
    public void close() {
        evictor.shutdownNow();
    }

    private static String channelKey(String channelId) {
        return channelId == null ? "" : channelId;
    }
}
