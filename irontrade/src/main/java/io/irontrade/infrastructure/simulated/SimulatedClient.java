package io.irontrade.infrastructure.simulated;

import io.irontrade.broker.Client;
import io.irontrade.broker.exception.NoNotionalPerUnitException;
import io.irontrade.domain.account.Account;
import io.irontrade.domain.account.OpenPosition;
import io.irontrade.domain.model.AssetPair;
import io.irontrade.domain.order.Order;
import io.irontrade.domain.order.OrderRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Client backed by a SimulatedBroker.
 *
 * Every call runs synchronously; the returned futures are already complete,
 * failed with the broker's exception when the call is rejected.
 *
 * getAccount() reports a held asset without an {asset}/{currency} price
 * with a null marketValue, and never sets averageEntryPrice.
 */
public class SimulatedClient implements Client {
    private static final Logger log = LoggerFactory.getLogger(SimulatedClient.class);

    private final SimulatedBroker broker;

    public SimulatedClient(SimulatedBroker broker) {
        this.broker = broker;
    }

    public SimulatedBroker getBroker() {
        return broker;
    }

    public void setNotionalPerUnit(AssetPair assetPair, BigDecimal notionalPerUnit) {
        broker.setNotionalPerUnit(assetPair, notionalPerUnit);
    }

    @Override
    public CompletableFuture<String> placeOrder(OrderRequest request) {
        return complete(() -> broker.placeOrder(request));
    }

    @Override
    public CompletableFuture<List<Order>> getOrders() {
        return complete(broker::getOrders);
    }

    @Override
    public CompletableFuture<Order> getOrder(String orderId) {
        return complete(() -> broker.getOrder(orderId));
    }

    @Override
    public CompletableFuture<Account> getAccount() {
        return complete(this::buildAccount);
    }

    private Account buildAccount() {
        String currency = broker.getCurrency();
        Map<String, OpenPosition> openPositions = new HashMap<>();
        for (String asset : broker.getHeldAssets()) {
            openPositions.put(asset, getOpenPosition(asset, currency));
        }
        return new Account(
            openPositions,
            broker.getBalance(currency),
            currency,
            broker.getBuyingPower(currency)
        );
    }

    private OpenPosition getOpenPosition(String asset, String currency) {
        BigDecimal quantity = broker.getBalance(asset);
        BigDecimal marketValue = null;
        try {
            BigDecimal price = broker.getNotionalPerUnit(new AssetPair(asset, currency));
            marketValue = quantity.multiply(price);
        } catch (NoNotionalPerUnitException e) {
            log.debug("[SIMULATED] No {}/{} price, position reported without market value", asset, currency);
        }
        return new OpenPosition(asset, null, quantity, marketValue);
    }

    private static <T> CompletableFuture<T> complete(Supplier<T> call) {
        try {
            return CompletableFuture.completedFuture(call.get());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
