package io.irontrade.domain.order;

import io.irontrade.domain.model.Amount;
import io.irontrade.domain.model.AssetPair;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class OrderRequestTest {

    private static final AssetPair PAIR = AssetPair.parse("BTC/USD");
    private static final Amount TEN = Amount.quantity(BigDecimal.TEN);

    @Test
    void testMarketFactories() {
        OrderRequest buy = OrderRequest.marketBuy(PAIR, TEN);
        OrderRequest sell = OrderRequest.marketSell(PAIR, TEN);

        assertEquals(OrderType.MARKET, buy.type());
        assertEquals(OrderSide.BUY, buy.side());
        assertNull(buy.limitPrice());
        assertEquals(OrderSide.SELL, sell.side());
    }

    @Test
    void testLimitFactories() {
        OrderRequest buy = OrderRequest.limitBuy(PAIR, TEN, new BigDecimal("1.30"));
        OrderRequest sell = OrderRequest.limitSell(PAIR, TEN, new BigDecimal("1.40"));

        assertEquals(OrderType.LIMIT, buy.type());
        assertEquals(0, buy.limitPrice().compareTo(new BigDecimal("1.3")));
        assertEquals(OrderSide.SELL, sell.side());
    }

    @Test
    void testInvalidRequestsRejected() {
        assertThrows(IllegalArgumentException.class, () -> OrderRequest.limitBuy(PAIR, TEN, null));
        assertThrows(IllegalArgumentException.class, () -> OrderRequest.limitSell(PAIR, TEN, BigDecimal.ZERO));
        assertThrows(IllegalArgumentException.class, () -> OrderRequest.marketBuy(null, TEN));
        assertThrows(IllegalArgumentException.class, () -> OrderRequest.marketBuy(PAIR, null));
    }

    @Test
    void testAcceptedOrderStartsNew() {
        Order order = Order.accepted("id-1", OrderRequest.limitBuy(PAIR, TEN, BigDecimal.ONE));

        assertEquals("id-1", order.orderId());
        assertEquals("BTC/USD", order.assetSymbol());
        assertEquals(OrderStatus.NEW, order.status());
        assertEquals(0, order.filledQuantity().signum());
        assertNull(order.averageFillPrice());
        assertTrue(order.isPendingLimit());

        Order filled = order.filled(BigDecimal.TEN, BigDecimal.ONE);
        assertEquals(OrderStatus.FILLED, filled.status());
        assertFalse(filled.isPendingLimit());
        assertEquals(PAIR, filled.assetPair());
    }
}
