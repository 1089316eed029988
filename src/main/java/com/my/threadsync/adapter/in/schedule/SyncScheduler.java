package com.my.threadsync.adapter.in.schedule;

import com.my.threadsync.config.AppConfig;
import com.my.threadsync.domain.exception.SyncAlreadyRunningException;
import com.my.threadsync.domain.model.SyncReport;
import com.my.threadsync.domain.port.in.SyncThreadsUseCase;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * {@code app.schedule.interval-minutes} 마다 전체 동기화를 돌린다. 0 이면 꺼진다.
 */
@Startup
@ApplicationScoped
public class SyncScheduler {

    private static final Logger log = Logger.getLogger(SyncScheduler.class);

    private final SyncThreadsUseCase syncThreadsUseCase;
    private final int intervalMinutes;
    private ScheduledExecutorService executor;

    @Inject
    public SyncScheduler(SyncThreadsUseCase syncThreadsUseCase, AppConfig appConfig) {
        this.syncThreadsUseCase = syncThreadsUseCase;
        this.intervalMinutes = appConfig.schedule().intervalMinutes();
    }

    @PostConstruct
    void start() {
        if (intervalMinutes <= 0) {
            log.info("주기 동기화가 비활성화되어 있습니다.");
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "sync-scheduler");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleWithFixedDelay(this::syncSafely, intervalMinutes, intervalMinutes, TimeUnit.MINUTES);
        log.infof("주기 동기화 시작: %d분 간격", intervalMinutes);
    }

    void syncSafely() {
        try {
            SyncReport report = syncThreadsUseCase.syncAll();
            log.info(report.summary());
        } catch (SyncAlreadyRunningException e) {
            log.infof("이미 실행 중인 동기화가 있어 이번 주기를 건너뜁니다: %s", e.getMessage());
        } catch (Exception e) {
            log.warnf("주기 동기화 실패: %s", e.getMessage());
        }
    }

    @PreDestroy
    void stop() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }
}
