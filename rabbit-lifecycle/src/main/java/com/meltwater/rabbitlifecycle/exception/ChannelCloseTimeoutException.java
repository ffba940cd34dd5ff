package com.meltwater.rabbitlifecycle.exception;

public class ChannelCloseTimeoutException extends ChannelException {

    public ChannelCloseTimeoutException(long timeoutMillis) {
        super("Channel did not close within " + timeoutMillis + " ms");
    }
}
