package io.irontrade.infrastructure.live;

import io.irontrade.util.Env;

/**
 * Alpaca API credentials and endpoints.
 */
public record AlpacaCredentials(
    String apiKey,
    String apiSecret,
    String tradingUrl,
    String dataUrl
) {
    public static final String PAPER_TRADING_URL = "https://paper-api.alpaca.markets";
    public static final String DATA_URL = "https://data.alpaca.markets";

    public AlpacaCredentials {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("API key cannot be null or empty");
        }
        if (apiSecret == null || apiSecret.isBlank()) {
            throw new IllegalArgumentException("API secret cannot be null or empty");
        }
        tradingUrl = stripTrailingSlash(tradingUrl == null ? PAPER_TRADING_URL : tradingUrl);
        dataUrl = stripTrailingSlash(dataUrl == null ? DATA_URL : dataUrl);
    }

    /**
     * Load from APCA_API_KEY_ID, APCA_API_SECRET_KEY, APCA_API_BASE_URL and
     * APCA_API_DATA_URL. Endpoints default to the paper trading account.
     *
     * @throws IllegalStateException if the key or secret is missing
     */
    public static AlpacaCredentials fromEnv() {
        return new AlpacaCredentials(
            Env.require("APCA_API_KEY_ID"),
            Env.require("APCA_API_SECRET_KEY"),
            Env.get("APCA_API_BASE_URL", PAPER_TRADING_URL),
            Env.get("APCA_API_DATA_URL", DATA_URL)
        );
    }

    public boolean isPaper() {
        return tradingUrl.contains("paper");
    }

    /**
     * Key with all but the first four characters masked, for logging.
     */
    public String maskedKey() {
        return apiKey.length() <= 4 ? "****" : apiKey.substring(0, 4) + "****";
    }

    @Override
    public String toString() {
        return "AlpacaCredentials[apiKey=" + maskedKey() + ", tradingUrl=" + tradingUrl + ", dataUrl=" + dataUrl + "]";
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
