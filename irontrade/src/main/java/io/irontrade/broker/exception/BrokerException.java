package io.irontrade.broker.exception;

/**
 * Base class for failures reported by a Client, Market or broker.
 */
public abstract class BrokerException extends RuntimeException {

    private final String errorCode;

    protected BrokerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected BrokerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Stable code for the failure, e.g. INSUFFICIENT_BUYING_POWER.
     */
    public String getErrorCode() {
        return errorCode;
    }
}
