package io.irontrade.infrastructure.broker.metrics;

import io.irontrade.domain.order.OrderType;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Histogram;
import io.prometheus.client.exporter.common.TextFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prometheus implementation of BrokerMetrics interface.
 *
 * Key Metrics:
 * - broker_orders_total{broker, status} - Order success/failure counts
 * - broker_order_latency_seconds{broker} - Order placement latency distribution
 * - broker_fills_total{broker, type} - Fills by order type
 * - broker_price_updates_total{broker, symbol} - Prices fed to the broker
 * - broker_requests_total{broker, operation, status} - API requests
 * - broker_retries_total{broker, reason} - Retry attempts
 *
 * Usage:
 * <pre>
 * PrometheusBrokerMetrics metrics = new PrometheusBrokerMetrics();
 * SimulatedBroker broker = SimulatedBroker.builder("USD").metrics(metrics).build();
 *
 * String body = metrics.scrape();  // text exposition format
 * </pre>
 */
public class PrometheusBrokerMetrics implements BrokerMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusBrokerMetrics.class);

    private final CollectorRegistry registry;

    // Order metrics
    private final Counter orderCounter;
    private final Histogram orderLatency;
    private final Counter fillCounter;

    // Price feed metrics
    private final Counter priceUpdateCounter;

    // Request metrics
    private final Counter requestCounter;
    private final Histogram requestLatency;

    // Retry metrics
    private final Counter retryCounter;
    private final Histogram retryAttempts;

    // In-memory state for aggregations
    private final Map<String, MetricsState> stateMap = new ConcurrentHashMap<>();

    public PrometheusBrokerMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusBrokerMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.orderCounter = Counter.build()
            .name("broker_orders_total")
            .help("Total number of orders placed")
            .labelNames("broker", "status")
            .register(registry);

        this.orderLatency = Histogram.build()
            .name("broker_order_latency_seconds")
            .help("Order placement latency in seconds")
            .labelNames("broker")
            .buckets(0.0001, 0.001, 0.01, 0.05, 0.1, 0.5, 1.0, 5.0)
            .register(registry);

        this.fillCounter = Counter.build()
            .name("broker_fills_total")
            .help("Total number of filled orders")
            .labelNames("broker", "type")
            .register(registry);

        this.priceUpdateCounter = Counter.build()
            .name("broker_price_updates_total")
            .help("Total number of price updates")
            .labelNames("broker", "symbol")
            .register(registry);

        this.requestCounter = Counter.build()
            .name("broker_requests_total")
            .help("Total number of API requests")
            .labelNames("broker", "operation", "status")
            .register(registry);

        this.requestLatency = Histogram.build()
            .name("broker_request_latency_seconds")
            .help("API request latency in seconds")
            .labelNames("broker", "operation")
            .buckets(0.01, 0.05, 0.1, 0.2, 0.5, 1.0, 2.0, 5.0)
            .register(registry);

        this.retryCounter = Counter.build()
            .name("broker_retries_total")
            .help("Total number of retry attempts")
            .labelNames("broker", "reason")
            .register(registry);

        this.retryAttempts = Histogram.build()
            .name("broker_retry_attempts")
            .help("Number of retry attempts per operation")
            .labelNames("broker")
            .buckets(1, 2, 3, 5, 10)
            .register(registry);

        log.info("[PrometheusBrokerMetrics] Initialized");
    }

    @Override
    public void recordOrderSuccess(String brokerCode, OrderType orderType, Duration latency) {
        orderCounter.labels(brokerCode, "success").inc();
        orderLatency.labels(brokerCode).observe(toSeconds(latency));

        getState(brokerCode).recordOrderSuccess();
    }

    @Override
    public void recordOrderFailure(String brokerCode, String errorType, Duration latency) {
        orderCounter.labels(brokerCode, "failure").inc();
        orderLatency.labels(brokerCode).observe(toSeconds(latency));

        getState(brokerCode).recordOrderFailure(errorType);
    }

    @Override
    public void recordOrderFill(String brokerCode, OrderType orderType) {
        fillCounter.labels(brokerCode, orderType.name()).inc();

        getState(brokerCode).recordFill();
    }

    @Override
    public void recordPriceUpdate(String brokerCode, String assetSymbol) {
        priceUpdateCounter.labels(brokerCode, assetSymbol).inc();

        getState(brokerCode).recordPriceUpdate();
    }

    @Override
    public void recordRequest(String brokerCode, String operation, boolean success, Duration latency) {
        requestCounter.labels(brokerCode, operation, success ? "success" : "failure").inc();
        requestLatency.labels(brokerCode, operation).observe(toSeconds(latency));

        getState(brokerCode).recordRequest(success);
    }

    @Override
    public void recordRetry(String brokerCode, int attemptNumber, String retryReason) {
        retryCounter.labels(brokerCode, retryReason).inc();
        retryAttempts.labels(brokerCode).observe(attemptNumber);

        getState(brokerCode).recordRetry();
    }

    @Override
    public Map<String, Object> getMetrics(String brokerCode) {
        MetricsState state = stateMap.get(brokerCode);
        if (state == null) {
            return new HashMap<>();
        }
        return state.toMap();
    }

    @Override
    public void reset(String brokerCode) {
        stateMap.remove(brokerCode);
        log.info("[PrometheusBrokerMetrics] Reset metrics for {}", brokerCode);
    }

    /**
     * Get Prometheus CollectorRegistry for scraping.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }

    /**
     * Render all registered metrics in Prometheus text format.
     */
    public String scrape() {
        try {
            Writer writer = new StringWriter();
            TextFormat.write004(writer, registry.metricFamilySamples());
            return writer.toString();
        } catch (IOException e) {
            log.error("[PrometheusBrokerMetrics] Failed to export metrics: {}", e.getMessage(), e);
            throw new UncheckedIOException(e);
        }
    }

    private static double toSeconds(Duration latency) {
        return latency.toNanos() / 1_000_000_000.0;
    }

    private MetricsState getState(String brokerCode) {
        return stateMap.computeIfAbsent(brokerCode, k -> new MetricsState(brokerCode));
    }

    /**
     * In-memory state for aggregated metrics.
     */
    private static class MetricsState {
        private final String brokerCode;
        private long totalOrders = 0;
        private long successfulOrders = 0;
        private long failedOrders = 0;
        private long filledOrders = 0;
        private long priceUpdates = 0;
        private long totalRequests = 0;
        private long failedRequests = 0;
        private long totalRetries = 0;
        private final Map<String, Long> failuresByType = new HashMap<>();

        MetricsState(String brokerCode) {
            this.brokerCode = brokerCode;
        }

        synchronized void recordOrderSuccess() {
            totalOrders++;
            successfulOrders++;
        }

        synchronized void recordOrderFailure(String errorType) {
            totalOrders++;
            failedOrders++;
            failuresByType.merge(errorType, 1L, Long::sum);
        }

        synchronized void recordFill() {
            filledOrders++;
        }

        synchronized void recordPriceUpdate() {
            priceUpdates++;
        }

        synchronized void recordRequest(boolean success) {
            totalRequests++;
            if (!success) {
                failedRequests++;
            }
        }

        synchronized void recordRetry() {
            totalRetries++;
        }

        synchronized Map<String, Object> toMap() {
            Map<String, Object> map = new HashMap<>();
            map.put("brokerCode", brokerCode);
            map.put("totalOrders", totalOrders);
            map.put("successfulOrders", successfulOrders);
            map.put("failedOrders", failedOrders);
            map.put("successRate", totalOrders > 0 ? (double) successfulOrders / totalOrders : 0.0);
            map.put("filledOrders", filledOrders);
            map.put("priceUpdates", priceUpdates);
            map.put("totalRequests", totalRequests);
            map.put("failedRequests", failedRequests);
            map.put("totalRetries", totalRetries);
            map.put("failuresByType", new HashMap<>(failuresByType));
            return map;
        }
    }
}
