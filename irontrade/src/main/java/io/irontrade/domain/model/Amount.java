package io.irontrade.domain.model;

import java.math.BigDecimal;

/**
 * Requested order size, either in units of the quantity asset or as a value
 * in the notional asset.
 */
public interface Amount {

    BigDecimal value();

    static Amount quantity(BigDecimal quantity) {
        return new Quantity(quantity);
    }

    static Amount notional(BigDecimal notional) {
        return new Notional(notional);
    }

    record Quantity(BigDecimal quantity) implements Amount {
        public Quantity {
            requirePositive(quantity, "Quantity");
        }

        @Override
        public BigDecimal value() {
            return quantity;
        }
    }

    record Notional(BigDecimal notional) implements Amount {
        public Notional {
            requirePositive(notional, "Notional");
        }

        @Override
        public BigDecimal value() {
            return notional;
        }
    }

    private static void requirePositive(BigDecimal value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
        if (value.signum() <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
