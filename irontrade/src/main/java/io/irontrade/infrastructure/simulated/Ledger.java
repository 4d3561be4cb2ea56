package io.irontrade.infrastructure.simulated;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Per-asset settled balances and buying power.
 *
 * Unseen assets read as zero. Updates are additive and create the entry on
 * first write. Not thread-safe: the owning broker serializes access.
 */
public final class Ledger {

    private final Map<String, BigDecimal> balances;
    private final Map<String, BigDecimal> buyingPower;

    public Ledger() {
        this(Map.of());
    }

    /**
     * Ledger whose buying power starts equal to the given balances.
     */
    public Ledger(Map<String, BigDecimal> startingBalances) {
        this.balances = new HashMap<>(startingBalances);
        this.buyingPower = new HashMap<>(startingBalances);
    }

    public BigDecimal getBalance(String asset) {
        return balances.getOrDefault(asset, BigDecimal.ZERO);
    }

    public BigDecimal getBuyingPower(String asset) {
        return buyingPower.getOrDefault(asset, BigDecimal.ZERO);
    }

    public void updateBalance(String asset, BigDecimal delta) {
        balances.merge(asset, delta, BigDecimal::add);
    }

    public void updateBuyingPower(String asset, BigDecimal delta) {
        buyingPower.merge(asset, delta, BigDecimal::add);
    }

    /**
     * Assets with a balance entry, including ones that went back to zero.
     */
    public Set<String> assets() {
        return Set.copyOf(balances.keySet());
    }
}
