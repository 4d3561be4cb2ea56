package io.irontrade.broker;

import io.irontrade.domain.account.Account;
import io.irontrade.domain.order.Order;
import io.irontrade.domain.order.OrderRequest;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Trading client for order execution and account state.
 *
 * Implemented by the live Alpaca backend and by the simulated broker.
 *
 * Error Handling:
 * - All operations return CompletableFuture
 * - Failures complete the future exceptionally with a BrokerException
 */
public interface Client {

    /**
     * Place an order.
     *
     * @param request Order details (pair, amount, optional limit price, side)
     * @return CompletableFuture with the new order ID
     */
    CompletableFuture<String> placeOrder(OrderRequest request);

    /**
     * Get all orders known to the client.
     */
    CompletableFuture<List<Order>> getOrders();

    /**
     * Get a single order.
     *
     * @param orderId Order ID returned by placeOrder
     * @return CompletableFuture with the order, failing with OrderNotFoundException if unknown
     */
    CompletableFuture<Order> getOrder(String orderId);

    /**
     * Get cash, buying power and open positions.
     */
    CompletableFuture<Account> getAccount();
}
