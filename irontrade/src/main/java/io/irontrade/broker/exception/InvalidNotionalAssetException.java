package io.irontrade.broker.exception;

/**
 * Exception thrown when a pair's notional asset is not accepted by the broker.
 */
public class InvalidNotionalAssetException extends BrokerException {

    private final String asset;

    public InvalidNotionalAssetException(String asset) {
        super("INVALID_NOTIONAL_ASSET", String.format("%s is not a valid notional asset", asset));
        this.asset = asset;
    }

    public String getAsset() {
        return asset;
    }
}
