package io.irontrade.infrastructure.live;

import io.irontrade.domain.data.Bar;
import io.irontrade.domain.model.AssetPair;
import io.irontrade.infrastructure.broker.common.RetryPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

public class AlpacaMarketTest {

    private static final int TEST_PORT = 19182;
    private static final String LATEST_BARS = "/v1beta3/crypto/us/latest/bars";

    private AlpacaStubServer server;
    private AlpacaMarket market;

    @BeforeEach
    public void setUp() {
        server = new AlpacaStubServer(TEST_PORT);
        server.start();
        AlpacaCredentials credentials = new AlpacaCredentials("PKTEST1234", "secret", server.url(), server.url());
        market = new AlpacaMarket(new AlpacaHttp(credentials, () -> RetryPolicy.builder().maxRetries(0).build(), null), null);
    }

    @AfterEach
    public void tearDown() {
        server.stop();
    }

    @Test
    public void testLatestMinuteBar() {
        server.respond("GET", LATEST_BARS, 200,
            "{\"bars\":{\"BTC/USD\":{\"t\":\"2025-12-17T18:29:00Z\",\"o\":66001.5,\"h\":66010,"
                + "\"l\":65990.25,\"c\":66005,\"v\":0.42}}}");

        Optional<Bar> bar = market.getLatestMinuteBar(AssetPair.parse("BTC/USD")).join();

        assertTrue(bar.isPresent());
        assertEquals(Instant.parse("2025-12-17T18:29:00Z"), bar.get().dateTime());
        assertEquals(0, bar.get().open().compareTo(new BigDecimal("66001.5")));
        assertEquals(0, bar.get().low().compareTo(new BigDecimal("65990.25")));
        assertEquals(0, bar.get().high().compareTo(new BigDecimal("66010")));
        assertEquals("symbols=BTC%2FUSD", server.requests().get(0).query());
        assertEquals("PKTEST1234", server.requests().get(0).apiKey());
    }

    @Test
    public void testNoBarForSymbol() {
        server.respond("GET", LATEST_BARS, 200, "{\"bars\":{}}");

        assertEquals(Optional.empty(), market.getLatestMinuteBar(AssetPair.parse("DOGE/USD")).join());
    }

    @Test
    public void testOnlyMinuteBarsSupported() {
        CompletionException e = assertThrows(CompletionException.class,
            () -> market.getLatestBar(AssetPair.parse("BTC/USD"), Duration.ofMinutes(5)).join());

        assertInstanceOf(IllegalArgumentException.class, e.getCause());
        assertTrue(server.requests().isEmpty());
    }
}
