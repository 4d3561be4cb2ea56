package io.irontrade.domain.order;

import io.irontrade.domain.model.Amount;
import io.irontrade.domain.model.AssetPair;

import java.math.BigDecimal;

/**
 * Order request for placing orders with a Client.
 * A null limitPrice means a market order.
 */
public record OrderRequest(
    AssetPair assetPair,
    Amount amount,
    BigDecimal limitPrice,
    OrderSide side
) {
    public OrderRequest {
        if (assetPair == null) {
            throw new IllegalArgumentException("Asset pair cannot be null");
        }
        if (amount == null) {
            throw new IllegalArgumentException("Amount cannot be null");
        }
        if (side == null) {
            throw new IllegalArgumentException("Side cannot be null");
        }
        if (limitPrice != null && limitPrice.signum() <= 0) {
            throw new IllegalArgumentException("Limit price must be positive");
        }
    }

    public static OrderRequest marketBuy(AssetPair assetPair, Amount amount) {
        return new OrderRequest(assetPair, amount, null, OrderSide.BUY);
    }

    public static OrderRequest marketSell(AssetPair assetPair, Amount amount) {
        return new OrderRequest(assetPair, amount, null, OrderSide.SELL);
    }

    public static OrderRequest limitBuy(AssetPair assetPair, Amount amount, BigDecimal limitPrice) {
        return new OrderRequest(assetPair, amount, requireLimit(limitPrice), OrderSide.BUY);
    }

    public static OrderRequest limitSell(AssetPair assetPair, Amount amount, BigDecimal limitPrice) {
        return new OrderRequest(assetPair, amount, requireLimit(limitPrice), OrderSide.SELL);
    }

    public OrderType type() {
        return limitPrice == null ? OrderType.MARKET : OrderType.LIMIT;
    }

    private static BigDecimal requireLimit(BigDecimal limitPrice) {
        if (limitPrice == null) {
            throw new IllegalArgumentException("Limit orders require a limit price");
        }
        return limitPrice;
    }
}
