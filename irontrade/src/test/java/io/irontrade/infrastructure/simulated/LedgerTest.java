package io.irontrade.infrastructure.simulated;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LedgerTest {

    @Test
    void testUnknownAssetsReadAsZero() {
        Ledger ledger = new Ledger();

        assertEquals(0, ledger.getBalance("BTC").signum());
        assertEquals(0, ledger.getBuyingPower("BTC").signum());
    }

    @Test
    void testBuyingPowerSeededFromBalances() {
        Ledger ledger = new Ledger(Map.of("USD", new BigDecimal("100")));

        assertEquals(0, ledger.getBalance("USD").compareTo(new BigDecimal("100")));
        assertEquals(0, ledger.getBuyingPower("USD").compareTo(new BigDecimal("100")));

        ledger.updateBuyingPower("USD", new BigDecimal("-40"));
        assertEquals(0, ledger.getBalance("USD").compareTo(new BigDecimal("100")));
        assertEquals(0, ledger.getBuyingPower("USD").compareTo(new BigDecimal("60")));
    }

    @Test
    void testUpdatesAreAdditive() {
        Ledger ledger = new Ledger();

        ledger.updateBalance("GBP", BigDecimal.TEN);
        ledger.updateBalance("GBP", new BigDecimal("-2.5"));

        assertEquals(0, ledger.getBalance("GBP").compareTo(new BigDecimal("7.5")));
        assertEquals(Set.of("GBP"), ledger.assets());
    }
}
