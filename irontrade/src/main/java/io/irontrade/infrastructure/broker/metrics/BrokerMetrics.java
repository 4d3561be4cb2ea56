package io.irontrade.infrastructure.broker.metrics;

import io.irontrade.domain.order.OrderType;

import java.time.Duration;
import java.util.Map;

/**
 * Broker metrics interface for monitoring.
 *
 * Shared by the simulated broker and the live Alpaca client so a backtest and
 * a live session report the same series.
 *
 * Key metrics:
 * - Order acceptance/rejection counts
 * - Fills by order type
 * - Price updates fed to the simulated broker
 * - API request latency and retries (live)
 */
public interface BrokerMetrics {

    /**
     * Record an accepted order.
     *
     * @param brokerCode Broker code (SIMULATED, ALPACA)
     * @param orderType Market or limit
     * @param latency Placement latency
     */
    void recordOrderSuccess(String brokerCode, OrderType orderType, Duration latency);

    /**
     * Record a rejected order.
     *
     * @param brokerCode Broker code
     * @param errorType Error code of the failure (INSUFFICIENT_BUYING_POWER, NO_NOTIONAL_PER_UNIT, ...)
     * @param latency Time to failure
     */
    void recordOrderFailure(String brokerCode, String errorType, Duration latency);

    /**
     * Record an order fill.
     *
     * @param brokerCode Broker code
     * @param orderType Market or limit
     */
    void recordOrderFill(String brokerCode, OrderType orderType);

    /**
     * Record a price update for a pair.
     *
     * @param brokerCode Broker code
     * @param assetSymbol Pair symbol, e.g. BTC/USD
     */
    void recordPriceUpdate(String brokerCode, String assetSymbol);

    /**
     * Record an API request.
     *
     * @param brokerCode Broker code
     * @param operation Operation name (PLACE_ORDER, GET_ACCOUNT, ...)
     * @param success Whether the request succeeded
     * @param latency Request latency including retries
     */
    void recordRequest(String brokerCode, String operation, boolean success, Duration latency);

    /**
     * Record retry attempt.
     *
     * @param brokerCode Broker code
     * @param attemptNumber Retry attempt number (1, 2, 3...)
     * @param retryReason Reason for retry
     */
    void recordRetry(String brokerCode, int attemptNumber, String retryReason);

    /**
     * Get current metrics snapshot.
     *
     * @param brokerCode Broker code
     * @return Map of metric names to values
     */
    Map<String, Object> getMetrics(String brokerCode);

    /**
     * Reset metrics for a broker.
     */
    void reset(String brokerCode);
}
