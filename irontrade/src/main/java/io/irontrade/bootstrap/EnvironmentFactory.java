package io.irontrade.bootstrap;

import io.irontrade.application.port.output.BarDataSource;
import io.irontrade.config.SimulationConfig;
import io.irontrade.domain.model.AssetPair;
import io.irontrade.infrastructure.broker.common.RetryPolicy;
import io.irontrade.infrastructure.broker.metrics.BrokerMetrics;
import io.irontrade.infrastructure.live.AlpacaClient;
import io.irontrade.infrastructure.live.AlpacaCredentials;
import io.irontrade.infrastructure.live.AlpacaHttp;
import io.irontrade.infrastructure.live.AlpacaMarket;
import io.irontrade.infrastructure.live.LiveEnvironment;
import io.irontrade.infrastructure.simulated.SimulatedBroker;
import io.irontrade.infrastructure.simulated.SimulatedClient;
import io.irontrade.infrastructure.simulated.SimulatedEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * EnvironmentFactory - wires a simulated or live Environment.
 *
 * Usage:
 * <pre>
 * SimulatedEnvironment env = EnvironmentFactory.simulated(SimulationConfig.fromEnv(), clock, bars);
 * env.init();
 *
 * LiveEnvironment live = EnvironmentFactory.live(AlpacaCredentials.fromEnv());
 * </pre>
 */
public final class EnvironmentFactory {
    private static final Logger log = LoggerFactory.getLogger(EnvironmentFactory.class);

    public static SimulatedEnvironment simulated(SimulationConfig config, Clock clock, BarDataSource barDataSource) {
        return simulated(config, clock, barDataSource, null);
    }

    /**
     * Build an uninitialized simulated environment; the caller runs init().
     *
     * @param metrics Metrics collector (nullable)
     */
    public static SimulatedEnvironment simulated(
        SimulationConfig config,
        Clock clock,
        BarDataSource barDataSource,
        BrokerMetrics metrics
    ) {
        SimulatedBroker.Builder brokerBuilder = SimulatedBroker.builder(config.currency())
            .balance(config.startingBalance())
            .metrics(metrics);
        // Every tracked pair is priced on update, so its notional asset must be accepted
        for (AssetPair assetPair : config.assetPairs()) {
            brokerBuilder.notionalAsset(assetPair.notionalAsset());
        }
        SimulatedBroker broker = brokerBuilder.build();

        log.info("[FACTORY] Simulated environment: currency={}, balance={}, pairs={}",
            config.currency(), config.startingBalance(), config.assetPairs());

        return SimulatedEnvironment.builder(clock, barDataSource, new SimulatedClient(broker))
            .assetPairsToTrade(config.assetPairs())
            .barDuration(config.barDuration())
            .refreshInterval(config.refreshInterval())
            .build();
    }

    public static LiveEnvironment live(AlpacaCredentials credentials) {
        return live(credentials, null);
    }

    /**
     * @param metrics Metrics collector (nullable)
     */
    public static LiveEnvironment live(AlpacaCredentials credentials, BrokerMetrics metrics) {
        if (!credentials.isPaper()) {
            log.warn("[FACTORY] Live environment is NOT a paper account: {}", credentials.tradingUrl());
        }
        AlpacaHttp http = new AlpacaHttp(credentials, RetryPolicy::forApiRequests, metrics);
        log.info("[FACTORY] Live environment: {}", credentials);
        return new LiveEnvironment(new AlpacaClient(http, metrics), new AlpacaMarket(http, metrics));
    }

    private EnvironmentFactory() {}
}
