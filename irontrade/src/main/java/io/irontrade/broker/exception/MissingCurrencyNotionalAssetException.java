package io.irontrade.broker.exception;

/**
 * Exception thrown when a broker's currency is not one of its notional assets.
 */
public class MissingCurrencyNotionalAssetException extends BrokerException {

    private final String currency;

    public MissingCurrencyNotionalAssetException(String currency) {
        super("MISSING_CURRENCY_NOTIONAL_ASSET",
            String.format("Missing currency notional asset %s", currency));
        this.currency = currency;
    }

    public String getCurrency() {
        return currency;
    }
}
