package com.my.threadsync.adapter.out.clock;

import com.my.threadsync.domain.port.out.ClockPort;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;

/**
 * 타임스탬프와 매핑의 lastUpdatedAt 에 쓰는 시각. {@code app.pipeline.timezone} 기준이다.
 */
public class OffsetClockAdapter implements ClockPort {

    private final Clock clock;

    private OffsetClockAdapter(Clock clock) {
        this.clock = clock;
    }

    public static OffsetClockAdapter of(ZoneId zoneId) {
        return new OffsetClockAdapter(Clock.system(zoneId));
    }

    public static OffsetClockAdapter fixed(Instant instant, ZoneId zoneId) {
        return new OffsetClockAdapter(Clock.fixed(instant, zoneId));
    }

    @Override
    public OffsetDateTime now() {
        return OffsetDateTime.now(clock);
    }
}
