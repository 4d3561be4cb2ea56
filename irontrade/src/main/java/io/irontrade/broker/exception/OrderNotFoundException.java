package io.irontrade.broker.exception;

/**
 * Exception thrown when an order ID is unknown.
 */
public class OrderNotFoundException extends BrokerException {

    private final String orderId;

    public OrderNotFoundException(String orderId) {
        super("ORDER_NOT_FOUND", String.format("Order with id %s doesn't exist", orderId));
        this.orderId = orderId;
    }

    public String getOrderId() {
        return orderId;
    }
}
