package io.irontrade.infrastructure.live;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.irontrade.broker.Client;
import io.irontrade.broker.exception.AlpacaApiException;
import io.irontrade.broker.exception.OrderNotFoundException;
import io.irontrade.domain.account.Account;
import io.irontrade.domain.order.Order;
import io.irontrade.domain.order.OrderRequest;
import io.irontrade.infrastructure.broker.metrics.BrokerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Alpaca trading API client.
 *
 * API Docs: https://docs.alpaca.markets/reference/postorder
 *
 * Endpoints:
 * - POST /v2/orders
 * - GET  /v2/orders?status=all
 * - GET  /v2/orders/{order_id}
 * - GET  /v2/account
 * - GET  /v2/positions
 */
public class AlpacaClient implements Client {
    private static final Logger log = LoggerFactory.getLogger(AlpacaClient.class);

    private final AlpacaHttp http;
    private final String baseUrl;
    private final BrokerMetrics metrics;

    /**
     * @param metrics Metrics collector (nullable)
     */
    public AlpacaClient(AlpacaHttp http, BrokerMetrics metrics) {
        this.http = http;
        this.baseUrl = http.getCredentials().tradingUrl();
        this.metrics = metrics;
        log.info("[ALPACA] Client created: url={}, apiKey={}", baseUrl, http.getCredentials().maskedKey());
    }

    @Override
    public CompletableFuture<String> placeOrder(OrderRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            Instant startTime = Instant.now();
            log.info("[ALPACA] Placing order: {} {} {} limit={}",
                request.side(), request.amount(), request.assetPair(), request.limitPrice());

            ObjectNode body = http.createObjectNode();
            AlpacaConverters.writeOrderRequest(request, body);
            try {
                JsonNode response = http.post("placeOrder", baseUrl + "/v2/orders", body);
                String orderId = response.path("id").asText();

                log.info("[ALPACA] Order placed: id={}", orderId);
                if (metrics != null) {
                    metrics.recordOrderSuccess(AlpacaHttp.BROKER_CODE, request.type(),
                        Duration.between(startTime, Instant.now()));
                }
                return orderId;
            } catch (AlpacaApiException e) {
                if (metrics != null) {
                    metrics.recordOrderFailure(AlpacaHttp.BROKER_CODE, e.getErrorCode(),
                        Duration.between(startTime, Instant.now()));
                }
                throw e;
            }
        });
    }

    @Override
    public CompletableFuture<List<Order>> getOrders() {
        return CompletableFuture.supplyAsync(() -> {
            JsonNode response = http.get("getOrders", baseUrl + "/v2/orders?status=all");
            List<Order> orders = new ArrayList<>();
            for (JsonNode order : response) {
                orders.add(AlpacaConverters.toOrder(order));
            }
            log.debug("[ALPACA] Fetched {} orders", orders.size());
            return orders;
        });
    }

    @Override
    public CompletableFuture<Order> getOrder(String orderId) {
        return CompletableFuture.supplyAsync(() -> {
            String url = baseUrl + "/v2/orders/" + URLEncoder.encode(orderId, StandardCharsets.UTF_8);
            try {
                return AlpacaConverters.toOrder(http.get("getOrder", url));
            } catch (AlpacaApiException e) {
                if (e.getStatusCode() == 404) {
                    throw new OrderNotFoundException(orderId);
                }
                throw e;
            }
        });
    }

    @Override
    public CompletableFuture<Account> getAccount() {
        return CompletableFuture.supplyAsync(() -> {
            JsonNode account = http.get("getAccount", baseUrl + "/v2/account");
            JsonNode positions = http.get("getPositions", baseUrl + "/v2/positions");
            return AlpacaConverters.toAccount(account, positions);
        });
    }
}
