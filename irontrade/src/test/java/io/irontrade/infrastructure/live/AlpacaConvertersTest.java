package io.irontrade.infrastructure.live;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.irontrade.domain.account.OpenPosition;
import io.irontrade.domain.model.Amount;
import io.irontrade.domain.order.Order;
import io.irontrade.domain.order.OrderSide;
import io.irontrade.domain.order.OrderStatus;
import io.irontrade.domain.order.OrderType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class AlpacaConvertersTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testOrderStatusMapping() {
        assertEquals(OrderStatus.NEW, AlpacaConverters.toOrderStatus("new"));
        assertEquals(OrderStatus.PARTIALLY_FILLED, AlpacaConverters.toOrderStatus("partially_filled"));
        assertEquals(OrderStatus.FILLED, AlpacaConverters.toOrderStatus("filled"));
        assertEquals(OrderStatus.EXPIRED, AlpacaConverters.toOrderStatus("expired"));
        assertEquals(OrderStatus.UNIMPLEMENTED, AlpacaConverters.toOrderStatus("pending_cancel"));
        assertEquals(OrderStatus.UNIMPLEMENTED, AlpacaConverters.toOrderStatus(""));
    }

    @Test
    void testTypeAndSideMapping() {
        assertEquals(OrderType.MARKET, AlpacaConverters.toOrderType("market"));
        assertEquals(OrderType.LIMIT, AlpacaConverters.toOrderType("limit"));
        assertThrows(IllegalArgumentException.class, () -> AlpacaConverters.toOrderType("stop"));
        assertEquals(OrderSide.SELL, AlpacaConverters.toOrderSide("sell"));
    }

    @Test
    void testPendingLimitOrder() throws Exception {
        JsonNode json = mapper.readTree("{\"id\":\"abc\",\"symbol\":\"ETH/USD\",\"qty\":\"2\",\"notional\":null,"
            + "\"filled_qty\":\"0\",\"filled_avg_price\":null,\"limit_price\":\"1800.5\","
            + "\"status\":\"new\",\"order_type\":\"limit\",\"side\":\"buy\"}");

        Order order = AlpacaConverters.toOrder(json);

        assertEquals("abc", order.orderId());
        assertInstanceOf(Amount.Quantity.class, order.amount());
        assertEquals(0, order.amount().value().compareTo(new BigDecimal("2")));
        assertEquals(0, order.limitPrice().compareTo(new BigDecimal("1800.5")));
        assertEquals(0, order.filledQuantity().signum());
        assertNull(order.averageFillPrice());
        assertEquals(OrderType.LIMIT, order.type());
        assertTrue(order.isPendingLimit());
    }

    @Test
    void testPositionWithoutMarketValue() throws Exception {
        OpenPosition position = AlpacaConverters.toOpenPosition(
            mapper.readTree("{\"symbol\":\"BTCUSD\",\"qty\":\"0.25\",\"avg_entry_price\":\"60000\"}"));

        assertEquals("BTCUSD", position.assetSymbol());
        assertEquals(0, position.quantity().compareTo(new BigDecimal("0.25")));
        assertNull(position.marketValue());
    }

    @Test
    void testDecimalFromNumberOrString() throws Exception {
        JsonNode json = mapper.readTree("{\"a\":\"1.10\",\"b\":2,\"c\":\"\",\"d\":null}");

        assertEquals(0, AlpacaConverters.decimal(json, "a").compareTo(new BigDecimal("1.1")));
        assertEquals(0, AlpacaConverters.decimal(json, "b").compareTo(new BigDecimal("2")));
        assertNull(AlpacaConverters.decimal(json, "c"));
        assertNull(AlpacaConverters.decimal(json, "d"));
        assertNull(AlpacaConverters.decimal(json, "missing"));
    }
}
