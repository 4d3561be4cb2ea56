package io.irontrade.domain.order;

/**
 * Order status enum.
 */
public enum OrderStatus {
    NEW,               // Accepted, not yet filled
    PARTIALLY_FILLED,  // Reported by live venues only
    FILLED,            // Completely filled
    EXPIRED,           // Reported by live venues only
    UNIMPLEMENTED      // Venue status with no mapping
}
