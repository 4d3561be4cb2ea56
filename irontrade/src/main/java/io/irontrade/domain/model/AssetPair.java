package io.irontrade.domain.model;

/**
 * A tradeable pair of assets.
 *
 * quantityAsset is the base (traded) asset, notionalAsset the quote
 * (settlement) asset. GBP/USD => quantity=GBP, notional=USD.
 */
public record AssetPair(
    String quantityAsset,
    String notionalAsset
) {
    private static final String SEPARATOR = "/";

    public AssetPair {
        if (quantityAsset == null || quantityAsset.isBlank()) {
            throw new IllegalArgumentException("Quantity asset cannot be null or empty");
        }
        if (notionalAsset == null || notionalAsset.isBlank()) {
            throw new IllegalArgumentException("Notional asset cannot be null or empty");
        }
        if (quantityAsset.contains(SEPARATOR) || notionalAsset.contains(SEPARATOR)) {
            throw new IllegalArgumentException("Assets cannot contain '" + SEPARATOR + "'");
        }
    }

    /**
     * Parse a pair from its "QUANTITY/NOTIONAL" form.
     */
    public static AssetPair parse(String symbol) {
        if (symbol == null) {
            throw new IllegalArgumentException("Asset pair cannot be null");
        }
        String[] parts = symbol.split(SEPARATOR, -1);
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid asset pair '" + symbol + "', expected QUANTITY/NOTIONAL");
        }
        return new AssetPair(parts[0], parts[1]);
    }

    @Override
    public String toString() {
        return quantityAsset + SEPARATOR + notionalAsset;
    }
}
