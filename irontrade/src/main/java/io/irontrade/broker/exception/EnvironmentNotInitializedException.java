package io.irontrade.broker.exception;

/**
 * Exception thrown when a simulated environment is used before init().
 */
public class EnvironmentNotInitializedException extends BrokerException {

    public EnvironmentNotInitializedException() {
        super("NOT_INITIALIZED", "Environment has not been initialized");
    }
}
