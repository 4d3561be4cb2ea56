package io.irontrade.infrastructure.simulated;

import io.irontrade.broker.exception.BrokerException;
import io.irontrade.broker.exception.InsufficientBuyingPowerException;
import io.irontrade.broker.exception.InvalidNotionalAssetException;
import io.irontrade.broker.exception.MissingCurrencyNotionalAssetException;
import io.irontrade.broker.exception.NoNotionalPerUnitException;
import io.irontrade.broker.exception.OrderNotFoundException;
import io.irontrade.domain.model.Amount;
import io.irontrade.domain.model.AssetPair;
import io.irontrade.domain.order.Order;
import io.irontrade.domain.order.OrderRequest;
import io.irontrade.domain.order.OrderSide;
import io.irontrade.domain.order.OrderType;
import io.irontrade.infrastructure.broker.metrics.BrokerMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Simulated Broker - in-process matching and bookkeeping engine.
 *
 * Features:
 * - Market orders fill immediately at the current price
 * - Limit orders fill once the price reaches the limit (buy at or below, sell at or above)
 * - Buying power is reserved at placement and released/adjusted at fill
 * - Balances only move when an order fills
 *
 * Prices are pushed in through setNotionalPerUnit(); every push re-evaluates
 * the pending limit orders of that pair. There is no order book, no partial
 * fill and no cancellation.
 *
 * Mutating operations are synchronized: a placement (check, reserve, insert,
 * maybe fill) or a price update runs as one step.
 */
public class SimulatedBroker {
    private static final Logger log = LoggerFactory.getLogger(SimulatedBroker.class);

    public static final String BROKER_CODE = "SIMULATED";

    private static final MathContext MC = MathContext.DECIMAL128;

    private final String currency;
    private final Set<String> notionalAssets;
    private final Ledger ledger;
    private final Map<AssetPair, BigDecimal> notionalPerUnit = new HashMap<>();
    private final Map<String, Order> orders = new HashMap<>();
    private final BrokerMetrics metrics;

    /**
     * @param currency Settlement currency, must be one of notionalAssets
     * @param notionalAssets Assets allowed as the notional leg of a pair
     * @param startingBalances Initial balances, also used as initial buying power
     * @throws MissingCurrencyNotionalAssetException if currency is not a notional asset
     */
    public SimulatedBroker(String currency, Set<String> notionalAssets, Map<String, BigDecimal> startingBalances) {
        this(currency, notionalAssets, startingBalances, null);
    }

    /**
     * @param metrics Metrics collector (nullable)
     */
    public SimulatedBroker(
        String currency,
        Set<String> notionalAssets,
        Map<String, BigDecimal> startingBalances,
        BrokerMetrics metrics
    ) {
        if (!notionalAssets.contains(currency)) {
            throw new MissingCurrencyNotionalAssetException(currency);
        }
        this.currency = currency;
        this.notionalAssets = Set.copyOf(notionalAssets);
        this.ledger = new Ledger(startingBalances);
        this.metrics = metrics;

        log.info("[SIMULATED] Broker created: currency={}, notionalAssets={}, balances={}",
            currency, this.notionalAssets, startingBalances);
    }

    public static Builder builder(String currency) {
        return new Builder(currency);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ORDERS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Place an order.
     *
     * On failure nothing is reserved and no order is created.
     *
     * @return the new order ID
     * @throws NoNotionalPerUnitException if the pair has no price yet
     * @throws InvalidNotionalAssetException if the pair's notional asset is not accepted
     * @throws InsufficientBuyingPowerException if the reservation cannot be covered
     */
    public synchronized String placeOrder(OrderRequest request) {
        Instant startTime = Instant.now();
        try {
            Order order = Order.accepted(UUID.randomUUID().toString(), request);

            queueOrder(order);

            if (order.type() == OrderType.MARKET) {
                fillOrder(order.orderId());
            } else {
                maybeFillOrder(order.orderId());
            }

            if (metrics != null) {
                metrics.recordOrderSuccess(BROKER_CODE, order.type(), Duration.between(startTime, Instant.now()));
            }
            return order.orderId();
        } catch (BrokerException e) {
            log.warn("[SIMULATED] Order rejected: {} {} {} - {}",
                request.side(), request.amount(), request.assetPair(), e.getMessage());
            if (metrics != null) {
                metrics.recordOrderFailure(BROKER_CODE, e.getErrorCode(), Duration.between(startTime, Instant.now()));
            }
            throw e;
        }
    }

    public synchronized Order getOrder(String orderId) {
        Order order = orders.get(orderId);
        if (order == null) {
            throw new OrderNotFoundException(orderId);
        }
        return order;
    }

    /**
     * Snapshot of all orders, in no particular order.
     */
    public synchronized List<Order> getOrders() {
        return new ArrayList<>(orders.values());
    }

    private void queueOrder(Order order) {
        Reservation reservation = getReservation(order);
        BigDecimal available = ledger.getBuyingPower(reservation.asset());
        if (available.compareTo(reservation.amount()) < 0) {
            throw new InsufficientBuyingPowerException(reservation.asset(), reservation.amount(), available);
        }

        ledger.updateBuyingPower(reservation.asset(), reservation.amount().negate());
        orders.put(order.orderId(), order);

        log.info("[SIMULATED] Order accepted: id={} {} {} {} {} limit={} reserved {} {}",
            order.orderId(), order.type(), order.side(), order.amount(), order.assetSymbol(),
            order.limitPrice(), reservation.amount(), reservation.asset());
    }

    /**
     * Buy orders reserve the notional asset (worst-case cost for limits),
     * sell orders reserve the quantity being sold.
     */
    private Reservation getReservation(Order order) {
        AssetPair assetPair = order.assetPair();
        QuantityAndNotional current = getCurrentQuantityAndNotional(assetPair, order.amount());

        if (order.side() == OrderSide.BUY) {
            BigDecimal needed = order.limitPrice() != null
                ? order.limitPrice().multiply(current.quantity())
                : current.notional();
            return new Reservation(assetPair.notionalAsset(), needed);
        }
        return new Reservation(assetPair.quantityAsset(), current.quantity());
    }

    private void maybeFillOrder(String orderId) {
        Order order = orders.get(orderId);
        if (!order.isPendingLimit()) {
            return;
        }

        BigDecimal currentPrice = getNotionalPerUnit(order.assetPair());
        int comparison = currentPrice.compareTo(order.limitPrice());

        boolean reached = comparison == 0
            || (order.side() == OrderSide.BUY && comparison < 0)
            || (order.side() == OrderSide.SELL && comparison > 0);

        if (reached) {
            fillOrder(orderId);
        }
    }

    /**
     * Settle an order at the current price.
     */
    private void fillOrder(String orderId) {
        Order order = orders.get(orderId);
        AssetPair assetPair = order.assetPair();
        QuantityAndNotional fill = getCurrentQuantityAndNotional(assetPair, order.amount());
        BigDecimal quantity = fill.quantity();
        BigDecimal notional = fill.notional();
        String notionalAsset = assetPair.notionalAsset();
        String quantityAsset = assetPair.quantityAsset();

        if (order.side() == OrderSide.BUY) {
            ledger.updateBalance(notionalAsset, notional.negate());
            ledger.updateBalance(quantityAsset, quantity);
            ledger.updateBuyingPower(quantityAsset, quantity);
            if (order.limitPrice() != null) {
                // Give back what the fill saved against the reserved limit cost
                ledger.updateBuyingPower(notionalAsset, order.limitPrice().multiply(quantity).subtract(notional));
            }
        } else {
            ledger.updateBalance(notionalAsset, notional);
            ledger.updateBuyingPower(notionalAsset, notional);
            ledger.updateBalance(quantityAsset, quantity.negate());
        }

        Order filled = order.filled(quantity, notional.divide(quantity, MC));
        orders.put(orderId, filled);

        log.info("[SIMULATED] Order filled: id={} {} {} {} @ {}",
            orderId, filled.side(), quantity, filled.assetSymbol(), filled.averageFillPrice());
        if (metrics != null) {
            metrics.recordOrderFill(BROKER_CODE, filled.type());
        }
    }

    private QuantityAndNotional getCurrentQuantityAndNotional(AssetPair assetPair, Amount amount) {
        BigDecimal price = getNotionalPerUnit(assetPair);
        if (amount instanceof Amount.Notional) {
            BigDecimal notional = amount.value();
            return new QuantityAndNotional(notional.divide(price, MC), notional);
        }
        BigDecimal quantity = amount.value();
        return new QuantityAndNotional(quantity, quantity.multiply(price));
    }

    // ═══════════════════════════════════════════════════════════════════════
    // PRICES
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Current price of one unit of the quantity asset, in the notional asset.
     *
     * @throws InvalidNotionalAssetException if the pair's notional asset is not accepted
     * @throws NoNotionalPerUnitException if no price was set for the pair
     */
    public synchronized BigDecimal getNotionalPerUnit(AssetPair assetPair) {
        checkNotional(assetPair);
        BigDecimal price = notionalPerUnit.get(assetPair);
        if (price == null) {
            throw new NoNotionalPerUnitException(assetPair);
        }
        return price;
    }

    /**
     * Set the price of a pair and run the fill check on its pending limit orders.
     * The pair is priced as given; its inverse is not derived.
     *
     * @throws InvalidNotionalAssetException if the pair's notional asset is not accepted
     */
    public synchronized void setNotionalPerUnit(AssetPair assetPair, BigDecimal price) {
        checkNotional(assetPair);
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Notional per unit must be positive, got " + price);
        }

        notionalPerUnit.put(assetPair, price);
        log.debug("[SIMULATED] {} notional per unit = {}", assetPair, price);
        if (metrics != null) {
            metrics.recordPriceUpdate(BROKER_CODE, assetPair.toString());
        }

        String symbol = assetPair.toString();
        List<String> pending = orders.values().stream()
            .filter(Order::isPendingLimit)
            .filter(order -> order.assetSymbol().equals(symbol))
            .map(Order::orderId)
            .toList();
        for (String orderId : pending) {
            maybeFillOrder(orderId);
        }
    }

    private void checkNotional(AssetPair assetPair) {
        if (!notionalAssets.contains(assetPair.notionalAsset())) {
            throw new InvalidNotionalAssetException(assetPair.notionalAsset());
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ACCOUNT
    // ═══════════════════════════════════════════════════════════════════════

    public String getCurrency() {
        return currency;
    }

    public Set<String> getNotionalAssets() {
        return notionalAssets;
    }

    public synchronized BigDecimal getBalance(String asset) {
        return ledger.getBalance(asset);
    }

    public synchronized BigDecimal getBuyingPower(String asset) {
        return ledger.getBuyingPower(asset);
    }

    /**
     * Assets other than the currency that hold a non-zero balance.
     */
    public synchronized Set<String> getHeldAssets() {
        Set<String> held = new HashSet<>();
        for (String asset : ledger.assets()) {
            if (!asset.equals(currency) && ledger.getBalance(asset).signum() != 0) {
                held.add(asset);
            }
        }
        return held;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // VALUE OBJECTS
    // ═══════════════════════════════════════════════════════════════════════

    private record QuantityAndNotional(BigDecimal quantity, BigDecimal notional) {}

    private record Reservation(String asset, BigDecimal amount) {}

    /**
     * Builder for SimulatedBroker. The currency is always a notional asset.
     */
    public static class Builder {
        private final String currency;
        private final Set<String> notionalAssets = new HashSet<>();
        private final Map<String, BigDecimal> balances = new HashMap<>();
        private BrokerMetrics metrics;

        private Builder(String currency) {
            if (currency == null || currency.isBlank()) {
                throw new IllegalArgumentException("Currency cannot be null or empty");
            }
            this.currency = currency;
            this.notionalAssets.add(currency);
            this.balances.put(currency, BigDecimal.ZERO);
        }

        /**
         * Starting balance in the currency.
         */
        public Builder balance(BigDecimal balance) {
            balances.put(currency, balance);
            return this;
        }

        public Builder notionalAsset(String asset) {
            notionalAssets.add(asset);
            return this;
        }

        public Builder notionalAsset(String asset, BigDecimal balance) {
            notionalAssets.add(asset);
            balances.put(asset, balance);
            return this;
        }

        /**
         * Starting balance of any asset, e.g. a holding to sell.
         */
        public Builder startingBalance(String asset, BigDecimal balance) {
            balances.put(asset, balance);
            return this;
        }

        public Builder metrics(BrokerMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public SimulatedBroker build() {
            return new SimulatedBroker(currency, notionalAssets, balances, metrics);
        }
    }
}
