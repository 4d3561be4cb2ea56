package io.irontrade.broker.exception;

import java.math.BigDecimal;

/**
 * Exception thrown when an order needs more buying power than is available.
 */
public class InsufficientBuyingPowerException extends BrokerException {

    private final String asset;
    private final BigDecimal required;
    private final BigDecimal available;

    public InsufficientBuyingPowerException(String asset, BigDecimal required, BigDecimal available) {
        super("INSUFFICIENT_BUYING_POWER", String.format("Not enough %s buying power", asset));
        this.asset = asset;
        this.required = required;
        this.available = available;
    }

    public String getAsset() {
        return asset;
    }

    public BigDecimal getRequired() {
        return required;
    }

    public BigDecimal getAvailable() {
        return available;
    }
}
