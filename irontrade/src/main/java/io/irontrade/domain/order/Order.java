package io.irontrade.domain.order;

import io.irontrade.domain.model.Amount;
import io.irontrade.domain.model.AssetPair;

import java.math.BigDecimal;

/**
 * Order as tracked by a Client.
 *
 * Immutable: state changes produce a new Order value.
 */
public record Order(
    String orderId,
    String assetSymbol,
    Amount amount,
    BigDecimal limitPrice,        // null for market orders
    BigDecimal filledQuantity,
    BigDecimal averageFillPrice,  // null until filled
    OrderStatus status,
    OrderType type,
    OrderSide side
) {
    /**
     * New, unfilled order for the given request.
     */
    public static Order accepted(String orderId, OrderRequest request) {
        return new Order(
            orderId,
            request.assetPair().toString(),
            request.amount(),
            request.limitPrice(),
            BigDecimal.ZERO,
            null,
            OrderStatus.NEW,
            request.type(),
            request.side()
        );
    }

    public Order filled(BigDecimal quantity, BigDecimal averagePrice) {
        return new Order(orderId, assetSymbol, amount, limitPrice,
            quantity, averagePrice, OrderStatus.FILLED, type, side);
    }

    public AssetPair assetPair() {
        return AssetPair.parse(assetSymbol);
    }

    public boolean isPendingLimit() {
        return status == OrderStatus.NEW && type == OrderType.LIMIT;
    }
}
