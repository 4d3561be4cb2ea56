package io.irontrade.infrastructure.time;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class ManualClockTest {

    private static final Instant START = Instant.parse("2025-12-17T18:30:00Z");

    @Test
    void testAdvanceAndSet() {
        ManualClock clock = new ManualClock(START);

        assertEquals(START, clock.instant());
        assertEquals(START.plusSeconds(90), clock.advance(Duration.ofSeconds(90)));
        assertEquals(START.plusSeconds(90), clock.instant());

        clock.set(START.minusSeconds(10));
        assertEquals(START.minusSeconds(10), clock.instant());
        assertEquals(ZoneOffset.UTC, clock.getZone());
    }

    @Test
    void testCannotMoveBackwards() {
        ManualClock clock = new ManualClock(START);

        assertThrows(IllegalArgumentException.class, () -> clock.advance(Duration.ofSeconds(-1)));
        assertEquals(START, clock.instant());
    }

    @Test
    void testWithZoneKeepsInstant() {
        Clock zoned = new ManualClock(START).withZone(ZoneId.of("Europe/London"));

        assertEquals(START, zoned.instant());
        assertEquals(ZoneId.of("Europe/London"), zoned.getZone());
    }
}
