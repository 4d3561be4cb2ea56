package io.irontrade.config;

import io.irontrade.domain.model.AssetPair;
import io.irontrade.util.Env;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Settings for a simulated environment.
 *
 * Environment variables (or system properties):
 * - IRONTRADE_SIM_CURRENCY         account currency (USD)
 * - IRONTRADE_SIM_BALANCE          starting currency balance (100000)
 * - IRONTRADE_SIM_PAIRS            tracked pairs, comma separated (none)
 * - IRONTRADE_SIM_BAR_SECONDS      bar duration (60)
 * - IRONTRADE_SIM_REFRESH_SECONDS  price refresh interval (30)
 */
public record SimulationConfig(
    String currency,
    BigDecimal startingBalance,
    Set<AssetPair> assetPairs,
    Duration barDuration,
    Duration refreshInterval
) {
    public static final String DEFAULT_CURRENCY = "USD";
    public static final BigDecimal DEFAULT_BALANCE = new BigDecimal("100000");
    public static final Duration DEFAULT_BAR_DURATION = Duration.ofMinutes(1);
    public static final Duration DEFAULT_REFRESH_INTERVAL = Duration.ofSeconds(30);

    public SimulationConfig {
        if (currency == null || currency.isBlank()) {
            throw new IllegalArgumentException("Currency cannot be null or empty");
        }
        if (startingBalance == null || startingBalance.signum() < 0) {
            throw new IllegalArgumentException("Starting balance cannot be negative");
        }
        if (barDuration == null || barDuration.isNegative() || barDuration.isZero()) {
            throw new IllegalArgumentException("Bar duration must be positive");
        }
        if (refreshInterval == null || refreshInterval.isNegative() || refreshInterval.isZero()) {
            throw new IllegalArgumentException("Refresh interval must be positive");
        }
        assetPairs = assetPairs == null ? Set.of() : Set.copyOf(assetPairs);
    }

    public static SimulationConfig defaults() {
        return new SimulationConfig(DEFAULT_CURRENCY, DEFAULT_BALANCE, Set.of(),
            DEFAULT_BAR_DURATION, DEFAULT_REFRESH_INTERVAL);
    }

    /**
     * @throws IllegalArgumentException if a configured pair is malformed
     */
    public static SimulationConfig fromEnv() {
        Set<AssetPair> pairs = Env.getList("IRONTRADE_SIM_PAIRS", List.of()).stream()
            .map(AssetPair::parse)
            .collect(Collectors.toSet());
        return new SimulationConfig(
            Env.get("IRONTRADE_SIM_CURRENCY", DEFAULT_CURRENCY),
            Env.getDecimal("IRONTRADE_SIM_BALANCE", DEFAULT_BALANCE),
            pairs,
            Duration.ofSeconds(Env.getLong("IRONTRADE_SIM_BAR_SECONDS", DEFAULT_BAR_DURATION.toSeconds())),
            Duration.ofSeconds(Env.getLong("IRONTRADE_SIM_REFRESH_SECONDS", DEFAULT_REFRESH_INTERVAL.toSeconds()))
        );
    }
}
