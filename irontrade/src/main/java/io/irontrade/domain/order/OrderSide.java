package io.irontrade.domain.order;

/**
 * Order side enum.
 */
public enum OrderSide {
    BUY,
    SELL
}
