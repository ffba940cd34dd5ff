package com.meltwater.rabbitlifecycle.exception;

/**
 * A failure on the connection level, for example the broker refusing the connection.
 */
public class ConnectionException extends RabbitLifecycleException {

    public ConnectionException(String message) {
        super(Level.CONNECTION, message, null);
    }

    public ConnectionException(String message, Throwable cause) {
        super(Level.CONNECTION, message, cause);
    }
}
