package io.irontrade.broker.exception;

import io.irontrade.domain.model.AssetPair;

/**
 * Exception thrown when a BarDataSource cannot serve a query.
 */
public class BarDataSourceException extends BrokerException {

    private final AssetPair assetPair;

    public BarDataSourceException(AssetPair assetPair, String message) {
        super("BAR_DATA_UNAVAILABLE", String.format("[%s] %s", assetPair, message));
        this.assetPair = assetPair;
    }

    public BarDataSourceException(AssetPair assetPair, String message, Throwable cause) {
        super("BAR_DATA_UNAVAILABLE", String.format("[%s] %s", assetPair, message), cause);
        this.assetPair = assetPair;
    }

    public AssetPair getAssetPair() {
        return assetPair;
    }
}
