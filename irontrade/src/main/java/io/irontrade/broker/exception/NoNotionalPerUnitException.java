package io.irontrade.broker.exception;

import io.irontrade.domain.model.AssetPair;

/**
 * Exception thrown when no price has been set for a pair yet.
 */
public class NoNotionalPerUnitException extends BrokerException {

    private final AssetPair assetPair;

    public NoNotionalPerUnitException(AssetPair assetPair) {
        super("NO_NOTIONAL_PER_UNIT", String.format("%s does not have notional per unit", assetPair));
        this.assetPair = assetPair;
    }

    public AssetPair getAssetPair() {
        return assetPair;
    }
}
