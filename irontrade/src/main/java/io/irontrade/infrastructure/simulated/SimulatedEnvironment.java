package io.irontrade.infrastructure.simulated;

import io.irontrade.application.port.output.BarDataSource;
import io.irontrade.broker.Environment;
import io.irontrade.broker.exception.EnvironmentAlreadyInitializedException;
import io.irontrade.broker.exception.EnvironmentNotInitializedException;
import io.irontrade.domain.account.Account;
import io.irontrade.domain.data.Bar;
import io.irontrade.domain.model.AssetPair;
import io.irontrade.domain.order.Order;
import io.irontrade.domain.order.OrderRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Environment that replays bar data against a SimulatedClient.
 *
 * Prices follow an injected Clock: every client call first catches up from
 * the last processed instant to clock.instant() in refreshInterval steps,
 * pricing each tracked pair at the mid-price of the bar in effect.
 *
 * The latest bar reported through Market is the last closed bar; a bar
 * whose window is still open at the current instant is never returned.
 *
 * Lifecycle:
 * 1. Build via builder(clock, barDataSource, client)
 * 2. init() once
 * 3. Use Client/Market methods
 */
public class SimulatedEnvironment implements Environment {
    private static final Logger log = LoggerFactory.getLogger(SimulatedEnvironment.class);

    private final Clock clock;
    private final BarDataSource barDataSource;
    private final SimulatedClient client;
    private final Set<AssetPair> assetPairsToTrade;
    private final Duration barDuration;
    private final Duration refreshInterval;

    private Instant lastProcessedTime;

    private SimulatedEnvironment(Builder builder) {
        this.clock = builder.clock;
        this.barDataSource = builder.barDataSource;
        this.client = builder.client;
        this.assetPairsToTrade = Set.copyOf(builder.assetPairsToTrade);
        this.barDuration = builder.barDuration;
        this.refreshInterval = builder.refreshInterval;
    }

    public static Builder builder(Clock clock, BarDataSource barDataSource, SimulatedClient client) {
        return new Builder(clock, barDataSource, client);
    }

    /**
     * Must be called once, before any Client or Market call.
     *
     * @throws EnvironmentAlreadyInitializedException if called twice
     */
    public synchronized void init() {
        if (lastProcessedTime != null) {
            throw new EnvironmentAlreadyInitializedException();
        }
        lastProcessedTime = clock.instant();
        log.info("[SIM_ENV] Initialized at {} tracking {} (bar={}, refresh={})",
            lastProcessedTime, assetPairsToTrade, barDuration, refreshInterval);
        update();
    }

    public synchronized boolean isInitialized() {
        return lastProcessedTime != null;
    }

    /**
     * Catch prices up to the clock's current instant.
     *
     * @throws EnvironmentNotInitializedException before init()
     */
    public synchronized void update() {
        if (lastProcessedTime == null) {
            throw new EnvironmentNotInitializedException();
        }
        Instant now = clock.instant();
        Instant t = lastProcessedTime;
        int passes = 0;
        while (!t.isAfter(now)) {
            refreshPrices(now);
            passes++;
            if (t.equals(now)) {
                break;
            }
            Instant next = t.plus(refreshInterval);
            t = next.isBefore(now) ? next : now;
        }
        log.debug("[SIM_ENV] Updated {} -> {} in {} passes", lastProcessedTime, now, passes);
        lastProcessedTime = now;
    }

    private void refreshPrices(Instant at) {
        for (AssetPair assetPair : assetPairsToTrade) {
            Optional<Bar> bar = barDataSource.getBar(assetPair, at, barDuration);
            if (bar.isPresent()) {
                client.setNotionalPerUnit(assetPair, bar.get().midPrice());
            }
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // CLIENT
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public synchronized CompletableFuture<String> placeOrder(OrderRequest request) {
        return afterUpdate(() -> client.placeOrder(request));
    }

    @Override
    public synchronized CompletableFuture<List<Order>> getOrders() {
        return afterUpdate(client::getOrders);
    }

    @Override
    public synchronized CompletableFuture<Order> getOrder(String orderId) {
        return afterUpdate(() -> client.getOrder(orderId));
    }

    @Override
    public synchronized CompletableFuture<Account> getAccount() {
        return afterUpdate(client::getAccount);
    }

    private <T> CompletableFuture<T> afterUpdate(Supplier<CompletableFuture<T>> call) {
        try {
            update();
        } catch (RuntimeException e) {
            log.warn("[SIM_ENV] Update failed: {}", e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
        return call.get();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // MARKET
    // ═══════════════════════════════════════════════════════════════════════

    @Override
    public synchronized CompletableFuture<Optional<Bar>> getLatestBar(AssetPair assetPair, Duration barDuration) {
        if (lastProcessedTime == null) {
            return CompletableFuture.failedFuture(new EnvironmentNotInitializedException());
        }
        try {
            Instant now = clock.instant();
            Optional<Bar> bar = barDataSource.getBar(assetPair, now, barDuration);
            if (bar.isPresent() && bar.get().isFormingAt(now, barDuration)) {
                // Only closed bars are published; fall back to the previous window
                bar = barDataSource.getBar(assetPair, now.minus(barDuration), barDuration);
            }
            return CompletableFuture.completedFuture(bar);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    public SimulatedClient getClient() {
        return client;
    }

    public Set<AssetPair> getAssetPairsToTrade() {
        return assetPairsToTrade;
    }

    public Duration getBarDuration() {
        return barDuration;
    }

    public Duration getRefreshInterval() {
        return refreshInterval;
    }

    /**
     * Builder for SimulatedEnvironment. Defaults: no tracked pairs,
     * one-minute bars, 30 second refresh.
     */
    public static class Builder {
        private final Clock clock;
        private final BarDataSource barDataSource;
        private final SimulatedClient client;
        private final Set<AssetPair> assetPairsToTrade = new LinkedHashSet<>();
        private Duration barDuration = Duration.ofMinutes(1);
        private Duration refreshInterval = Duration.ofSeconds(30);

        private Builder(Clock clock, BarDataSource barDataSource, SimulatedClient client) {
            if (clock == null || barDataSource == null || client == null) {
                throw new IllegalArgumentException("Clock, bar data source and client are required");
            }
            this.clock = clock;
            this.barDataSource = barDataSource;
            this.client = client;
        }

        public Builder assetPairsToTrade(Set<AssetPair> assetPairs) {
            assetPairsToTrade.clear();
            assetPairsToTrade.addAll(assetPairs);
            return this;
        }

        public Builder assetPairToTrade(AssetPair assetPair) {
            assetPairsToTrade.add(assetPair);
            return this;
        }

        public Builder barDuration(Duration barDuration) {
            if (barDuration == null || barDuration.isNegative() || barDuration.isZero()) {
                throw new IllegalArgumentException("Bar duration must be positive");
            }
            this.barDuration = barDuration;
            return this;
        }

        public Builder refreshInterval(Duration refreshInterval) {
            if (refreshInterval == null || refreshInterval.isNegative() || refreshInterval.isZero()) {
                throw new IllegalArgumentException("Refresh interval must be positive");
            }
            this.refreshInterval = refreshInterval;
            return this;
        }

        public SimulatedEnvironment build() {
            return new SimulatedEnvironment(this);
        }
    }
}
