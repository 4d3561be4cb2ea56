package io.irontrade.infrastructure.data;

import io.irontrade.domain.data.Bar;
import io.irontrade.domain.model.AssetPair;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryBarDataSourceTest {

    private static final AssetPair BTC_USD = AssetPair.parse("BTC/USD");
    private static final Instant T0 = Instant.parse("2025-12-17T18:00:00Z");
    private static final Duration MINUTE = Duration.ofMinutes(1);

    private static Bar bar(Instant at, String price) {
        BigDecimal p = new BigDecimal(price);
        return new Bar(p, p, p, p, at);
    }

    @Test
    void testReturnsLatestBarAtOrBeforeInstant() {
        Bar first = bar(T0, "1");
        Bar second = bar(T0.plusSeconds(60), "2");
        InMemoryBarDataSource source = new InMemoryBarDataSource(BTC_USD, List.of(second, first));

        assertEquals(Optional.empty(), source.getBar(BTC_USD, T0.minusSeconds(1), MINUTE));
        assertEquals(Optional.of(first), source.getBar(BTC_USD, T0, MINUTE));
        assertEquals(Optional.of(first), source.getBar(BTC_USD, T0.plusSeconds(59), MINUTE));
        assertEquals(Optional.of(second), source.getBar(BTC_USD, T0.plusSeconds(60), MINUTE));
        assertEquals(Optional.of(second), source.getBar(BTC_USD, T0.plusSeconds(3600), MINUTE));
        assertEquals(List.of(first, second), source.getBars(BTC_USD));
    }

    @Test
    void testPairsAreIndependent() {
        InMemoryBarDataSource source = new InMemoryBarDataSource();
        source.addBar(BTC_USD, bar(T0, "100"));

        assertTrue(source.getBar(AssetPair.parse("ETH/USD"), T0, MINUTE).isEmpty());
        assertTrue(source.getBars(AssetPair.parse("ETH/USD")).isEmpty());
    }

    @Test
    void testSameStartReplacesBar() {
        InMemoryBarDataSource source = new InMemoryBarDataSource();
        source.addBar(BTC_USD, bar(T0, "100"));
        source.addBar(BTC_USD, bar(T0, "101"));

        assertEquals(0, source.getBar(BTC_USD, T0, MINUTE).orElseThrow().close().compareTo(new BigDecimal("101")));
    }
}
