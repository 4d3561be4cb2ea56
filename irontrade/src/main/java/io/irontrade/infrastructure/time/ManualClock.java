package io.irontrade.infrastructure.time;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * Clock that only moves when told to. Drives simulated environments in
 * backtests and tests.
 */
public class ManualClock extends Clock {

    private final ZoneId zone;
    private volatile Instant instant;

    public ManualClock(Instant start) {
        this(start, ZoneOffset.UTC);
    }

    public ManualClock(Instant start, ZoneId zone) {
        if (start == null || zone == null) {
            throw new IllegalArgumentException("Start instant and zone are required");
        }
        this.instant = start;
        this.zone = zone;
    }

    public synchronized Instant advance(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Cannot move clock backwards: " + duration);
        }
        instant = instant.plus(duration);
        return instant;
    }

    public void set(Instant instant) {
        this.instant = instant;
    }

    @Override
    public Instant instant() {
        return instant;
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new ManualClock(instant, zone);
    }
}
