package io.irontrade.domain.account;

import java.math.BigDecimal;

/**
 * Holding of a single asset.
 */
public record OpenPosition(
    String assetSymbol,
    BigDecimal averageEntryPrice,  // null when unknown
    BigDecimal quantity,
    BigDecimal marketValue         // null when no price is available
) {}
