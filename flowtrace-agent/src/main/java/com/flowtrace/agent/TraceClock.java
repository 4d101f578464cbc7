package com.flowtrace.agent;

import java.time.Instant;

/**
 * Source of event timestamps, in microseconds since the epoch.
 */
@FunctionalInterface
public interface TraceClock {

    TraceClock SYSTEM = () -> {
        Instant now = Instant.now();
        return now.getEpochSecond() * 1_000_000L + now.getNano() / 1_000;
    };

    long nowMicros();
}
