package com.meltwater.rabbitlifecycle.exception;

/**
 * The connection was closed by the broker or by the network, not by the application.
 */
public class ConnectionClosedException extends ConnectionException {

    private final boolean hadError;

    public ConnectionClosedException(boolean hadError) {
        super("Connection closed by peer (hadError=" + hadError + ")");
        this.hadError = hadError;
    }

    public boolean hadError() {
        return hadError;
    }
}
