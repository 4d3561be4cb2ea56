package io.irontrade.domain.data;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

/**
 * OHLC price summary over a time window starting at dateTime.
 */
public record Bar(
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    Instant dateTime
) {
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    public Bar {
        if (open == null || high == null || low == null || close == null) {
            throw new IllegalArgumentException("Bar prices cannot be null");
        }
        if (dateTime == null) {
            throw new IllegalArgumentException("Bar dateTime cannot be null");
        }
    }

    /**
     * Midpoint of the bar's range: (low + high) / 2.
     */
    public BigDecimal midPrice() {
        return low.add(high).divide(TWO);
    }

    /**
     * Whether the bar's window is still open at the given instant.
     */
    public boolean isFormingAt(Instant instant, Duration barDuration) {
        return dateTime.plus(barDuration).isAfter(instant);
    }
}
