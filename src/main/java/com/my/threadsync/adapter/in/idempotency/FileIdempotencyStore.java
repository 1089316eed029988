package com.my.threadsync.adapter.in.idempotency;

import com.my.threadsync.config.AppConfig;
import com.my.threadsync.domain.port.out.ClockPort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code commandId|epochMillis} 줄을 추가하는 로그 파일. 재시작 후에도 중복 명령을 걸러낸다.
 * 만료된 줄은 기록할 때 정리한다.
 */
@IfBuildProperty(name = "app.idempotency.backend", stringValue = "file", enableIfMissing = true)
@ApplicationScoped
public class FileIdempotencyStore implements IdempotencyStore {

    private static final Logger log = Logger.getLogger(FileIdempotencyStore.class);

    private final Path logPath;
    private final Duration ttl;
    private final ClockPort clockPort;

    @Inject
    public FileIdempotencyStore(AppConfig appConfig, ClockPort clockPort) {
        this(Path.of(appConfig.idempotency().path()), Duration.ofHours(appConfig.idempotency().ttlHours()), clockPort);
    }

    public FileIdempotencyStore(Path logPath, Duration ttl, ClockPort clockPort) {
        this.logPath = logPath;
        this.ttl = ttl;
        this.clockPort = clockPort;
        try {
            Path parent = logPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(logPath)) {
                Files.createFile(logPath);
            }
        } catch (IOException e) {
            throw new IllegalStateException("명령 중복 방지 로그 초기화 실패: " + logPath, e);
        }
    }

    @Override
    public synchronized boolean isProcessed(String commandId) {
        return readFresh().containsKey(commandId);
    }

    @Override
    public synchronized void markProcessed(String commandId) {
        Map<String, Long> fresh = readFresh();
        fresh.put(commandId, clockPort.now().toInstant().toEpochMilli());
        List<String> lines = fresh.entrySet().stream()
                .map(entry -> entry.getKey() + "|" + entry.getValue())
                .toList();
        try {
            Files.write(logPath, lines, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new IllegalStateException("명령 중복 방지 로그 기록 실패: " + logPath, e);
        }
    }

    private Map<String, Long> readFresh() {
        Instant cutoff = clockPort.now().toInstant().minus(ttl);
        Map<String, Long> entries = new LinkedHashMap<>();
        List<String> lines;
        try {
            lines = Files.readAllLines(logPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("명령 중복 방지 로그 조회 실패: " + logPath, e);
        }
        for (String line : lines) {
            int separator = line.lastIndexOf('|');
            if (separator <= 0) {
                continue;
            }
            try {
                long millis = Long.parseLong(line.substring(separator + 1).trim());
                if (Instant.ofEpochMilli(millis).isAfter(cutoff)) {
                    entries.put(line.substring(0, separator), millis);
                }
            } catch (NumberFormatException e) {
                log.warnf("잘못된 중복 방지 로그 줄을 무시합니다: %s", line);
            }
        }
        return entries;
    }
}
