package io.irontrade.broker.exception;

/**
 * Exception thrown when init() is called on an environment more than once.
 */
public class EnvironmentAlreadyInitializedException extends BrokerException {

    public EnvironmentAlreadyInitializedException() {
        super("ALREADY_INITIALIZED", "Environment has already been initialized");
    }
}
