package io.irontrade.infrastructure.live;

import io.irontrade.broker.Client;
import io.irontrade.broker.Environment;
import io.irontrade.broker.Market;
import io.irontrade.domain.account.Account;
import io.irontrade.domain.data.Bar;
import io.irontrade.domain.model.AssetPair;
import io.irontrade.domain.order.Order;
import io.irontrade.domain.order.OrderRequest;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Environment backed by a live venue: trading through one Client, market data
 * through one Market.
 */
public class LiveEnvironment implements Environment {

    private final Client client;
    private final Market market;

    public LiveEnvironment(Client client, Market market) {
        if (client == null || market == null) {
            throw new IllegalArgumentException("Client and market are required");
        }
        this.client = client;
        this.market = market;
    }

    @Override
    public CompletableFuture<String> placeOrder(OrderRequest request) {
        return client.placeOrder(request);
    }

    @Override
    public CompletableFuture<List<Order>> getOrders() {
        return client.getOrders();
    }

    @Override
    public CompletableFuture<Order> getOrder(String orderId) {
        return client.getOrder(orderId);
    }

    @Override
    public CompletableFuture<Account> getAccount() {
        return client.getAccount();
    }

    @Override
    public CompletableFuture<Optional<Bar>> getLatestBar(AssetPair assetPair, Duration barDuration) {
        return market.getLatestBar(assetPair, barDuration);
    }
}
