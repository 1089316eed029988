package com.my.threadsync.adapter.in.idempotency;

import com.my.threadsync.config.AppConfig;
import com.my.threadsync.domain.port.out.ClockPort;
import io.quarkus.arc.properties.IfBuildProperty;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@IfBuildProperty(name = "app.idempotency.backend", stringValue = "memory")
@ApplicationScoped
public class InMemoryIdempotencyStore implements IdempotencyStore {

    private final Duration ttl;
    private final ClockPort clockPort;
    private final Map<String, Instant> processed = new ConcurrentHashMap<>();

    @Inject
    public InMemoryIdempotencyStore(AppConfig appConfig, ClockPort clockPort) {
        this(Duration.ofHours(appConfig.idempotency().ttlHours()), clockPort);
    }

    public InMemoryIdempotencyStore(Duration ttl, ClockPort clockPort) {
        this.ttl = ttl;
        this.clockPort = clockPort;
    }

    @Override
    public boolean isProcessed(String commandId) {
        evictExpired();
        return processed.containsKey(commandId);
    }

    @Override
    public void markProcessed(String commandId) {
        evictExpired();
        processed.put(commandId, clockPort.now().toInstant());
    }

    private void evictExpired() {
        Instant cutoff = clockPort.now().toInstant().minus(ttl);
        processed.entrySet().removeIf(entry -> entry.getValue().isBefore(cutoff));
    }
}
