package io.irontrade.domain.data;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class BarTest {

    private static final Instant START = Instant.parse("2025-12-17T18:27:00Z");

    @Test
    void testMidPrice() {
        Bar bar = new Bar(BigDecimal.ONE, new BigDecimal("20"), new BigDecimal("5"), BigDecimal.TEN, START);

        assertEquals(0, bar.midPrice().compareTo(new BigDecimal("12.5")));
    }

    @Test
    void testFormingWindow() {
        Bar bar = new Bar(BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE, START);
        Duration minute = Duration.ofMinutes(1);

        assertTrue(bar.isFormingAt(START, minute));
        assertTrue(bar.isFormingAt(START.plusSeconds(59), minute));
        assertFalse(bar.isFormingAt(START.plusSeconds(60), minute));
    }

    @Test
    void testNullFieldsRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new Bar(null, BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE, START));
        assertThrows(IllegalArgumentException.class,
            () -> new Bar(BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE, BigDecimal.ONE, null));
    }
}
