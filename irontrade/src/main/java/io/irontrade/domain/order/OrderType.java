package io.irontrade.domain.order;

/**
 * Order type enum.
 */
public enum OrderType {
    MARKET,  // Fills immediately at the current price
    LIMIT    // Fills once the price reaches the limit
}
