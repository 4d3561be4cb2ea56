package io.irontrade.infrastructure.live;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.irontrade.domain.account.Account;
import io.irontrade.domain.account.OpenPosition;
import io.irontrade.domain.data.Bar;
import io.irontrade.domain.model.Amount;
import io.irontrade.domain.order.Order;
import io.irontrade.domain.order.OrderRequest;
import io.irontrade.domain.order.OrderSide;
import io.irontrade.domain.order.OrderStatus;
import io.irontrade.domain.order.OrderType;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Mapping between Alpaca REST JSON and domain types.
 */
public final class AlpacaConverters {

    /**
     * Body for POST /v2/orders. Orders are good-till-cancelled.
     */
    public static void writeOrderRequest(OrderRequest request, ObjectNode body) {
        body.put("symbol", request.assetPair().toString());
        body.put("side", request.side() == OrderSide.BUY ? "buy" : "sell");
        body.put("type", request.type() == OrderType.LIMIT ? "limit" : "market");
        body.put("time_in_force", "gtc");
        if (request.amount() instanceof Amount.Notional) {
            body.put("notional", request.amount().value().toPlainString());
        } else {
            body.put("qty", request.amount().value().toPlainString());
        }
        if (request.limitPrice() != null) {
            body.put("limit_price", request.limitPrice().toPlainString());
        }
    }

    public static Order toOrder(JsonNode json) {
        BigDecimal notional = decimal(json, "notional");
        Amount amount = notional != null
            ? Amount.notional(notional)
            : Amount.quantity(decimal(json, "qty"));
        BigDecimal filledQuantity = decimal(json, "filled_qty");

        return new Order(
            json.path("id").asText(),
            json.path("symbol").asText(),
            amount,
            decimal(json, "limit_price"),
            filledQuantity != null ? filledQuantity : BigDecimal.ZERO,
            decimal(json, "filled_avg_price"),
            toOrderStatus(json.path("status").asText()),
            toOrderType(json.path("type").asText(json.path("order_type").asText())),
            toOrderSide(json.path("side").asText())
        );
    }

    public static OrderStatus toOrderStatus(String status) {
        return switch (status) {
            case "new" -> OrderStatus.NEW;
            case "partially_filled" -> OrderStatus.PARTIALLY_FILLED;
            case "filled" -> OrderStatus.FILLED;
            case "expired" -> OrderStatus.EXPIRED;
            default -> OrderStatus.UNIMPLEMENTED;
        };
    }

    /**
     * @throws IllegalArgumentException for order types other than market and limit
     */
    public static OrderType toOrderType(String type) {
        return switch (type) {
            case "market" -> OrderType.MARKET;
            case "limit" -> OrderType.LIMIT;
            default -> throw new IllegalArgumentException("Unsupported order type: " + type);
        };
    }

    public static OrderSide toOrderSide(String side) {
        return switch (side) {
            case "buy" -> OrderSide.BUY;
            case "sell" -> OrderSide.SELL;
            default -> throw new IllegalArgumentException("Unsupported order side: " + side);
        };
    }

    public static OpenPosition toOpenPosition(JsonNode json) {
        return new OpenPosition(
            json.path("symbol").asText(),
            decimal(json, "avg_entry_price"),
            decimal(json, "qty"),
            decimal(json, "market_value")
        );
    }

    /**
     * Combine GET /v2/account and GET /v2/positions into an Account.
     */
    public static Account toAccount(JsonNode account, JsonNode positions) {
        Map<String, OpenPosition> openPositions = new HashMap<>();
        for (JsonNode position : positions) {
            OpenPosition openPosition = toOpenPosition(position);
            openPositions.put(openPosition.assetSymbol(), openPosition);
        }
        return new Account(
            openPositions,
            decimal(account, "cash"),
            account.path("currency").asText(),
            decimal(account, "buying_power")
        );
    }

    /**
     * Bar from the compact latest-bars format: t, o, h, l, c.
     */
    public static Bar toBar(JsonNode json) {
        return new Bar(
            decimal(json, "o"),
            decimal(json, "h"),
            decimal(json, "l"),
            decimal(json, "c"),
            Instant.parse(json.path("t").asText())
        );
    }

    // Alpaca sends decimals as strings in trading responses and as numbers in market data
    static BigDecimal decimal(JsonNode json, String field) {
        JsonNode node = json.get(field);
        if (node == null || node.isNull() || node.asText().isEmpty()) {
            return null;
        }
        return node.isNumber() ? node.decimalValue() : new BigDecimal(node.asText());
    }

    private AlpacaConverters() {}
}
