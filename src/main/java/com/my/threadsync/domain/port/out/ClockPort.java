package com.my.threadsync.domain.port.out;

import java.time.OffsetDateTime;

public interface ClockPort {
    OffsetDateTime now();
}
