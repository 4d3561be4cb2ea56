package io.irontrade.broker.exception;

/**
 * Exception thrown when the Alpaca API rejects a request or cannot be reached.
 */
public class AlpacaApiException extends BrokerException {

    private final String operation;
    private final int statusCode;

    public AlpacaApiException(String operation, int statusCode, String responseBody) {
        super("ALPACA_HTTP_" + statusCode,
            String.format("[ALPACA:%s] HTTP %d: %s", operation, statusCode, responseBody));
        this.operation = operation;
        this.statusCode = statusCode;
    }

    public AlpacaApiException(String operation, String message, Throwable cause) {
        super("ALPACA_IO", String.format("[ALPACA:%s] %s", operation, message), cause);
        this.operation = operation;
        this.statusCode = -1;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * HTTP status code, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
