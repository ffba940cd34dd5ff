package com.meltwater.rabbitlifecycle.exception;

public class ConnectionCloseTimeoutException extends ConnectionException {

    public ConnectionCloseTimeoutException(long timeoutMillis) {
        super("Connection did not close within " + timeoutMillis + " ms");
    }
}
