package io.irontrade.infrastructure.live;

import com.fasterxml.jackson.databind.JsonNode;
import io.irontrade.broker.Market;
import io.irontrade.domain.data.Bar;
import io.irontrade.domain.model.AssetPair;
import io.irontrade.infrastructure.broker.metrics.BrokerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Alpaca crypto market data.
 *
 * Endpoint: GET /v1beta3/crypto/us/latest/bars?symbols={pair}
 *
 * Only one-minute bars are published as "latest", so other durations are rejected.
 */
public class AlpacaMarket implements Market {
    private static final Logger log = LoggerFactory.getLogger(AlpacaMarket.class);

    private final AlpacaHttp http;
    private final String baseUrl;
    private final BrokerMetrics metrics;

    /**
     * @param metrics Metrics collector (nullable)
     */
    public AlpacaMarket(AlpacaHttp http, BrokerMetrics metrics) {
        this.http = http;
        this.baseUrl = http.getCredentials().dataUrl();
        this.metrics = metrics;
    }

    @Override
    public CompletableFuture<Optional<Bar>> getLatestBar(AssetPair assetPair, Duration barDuration) {
        if (!ONE_MINUTE.equals(barDuration)) {
            return CompletableFuture.failedFuture(
                new IllegalArgumentException("Only one-minute bars are supported, got " + barDuration));
        }
        return CompletableFuture.supplyAsync(() -> {
            String symbol = assetPair.toString();
            String url = baseUrl + "/v1beta3/crypto/us/latest/bars?symbols="
                + URLEncoder.encode(symbol, StandardCharsets.UTF_8);
            JsonNode response = http.get("getLatestBar", url);

            JsonNode bar = response.path("bars").get(symbol);
            if (bar == null || bar.isNull()) {
                log.debug("[ALPACA] No latest bar for {}", symbol);
                return Optional.empty();
            }
            if (metrics != null) {
                metrics.recordPriceUpdate(AlpacaHttp.BROKER_CODE, symbol);
            }
            return Optional.of(AlpacaConverters.toBar(bar));
        });
    }
}
