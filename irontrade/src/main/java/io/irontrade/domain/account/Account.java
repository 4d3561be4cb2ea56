package io.irontrade.domain.account;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Account snapshot: settled cash and buying power in the account currency,
 * plus one open position per held asset.
 */
public record Account(
    Map<String, OpenPosition> openPositions,
    BigDecimal cash,
    String currency,
    BigDecimal buyingPower
) {
    public Account {
        openPositions = Map.copyOf(openPositions);
    }
}
