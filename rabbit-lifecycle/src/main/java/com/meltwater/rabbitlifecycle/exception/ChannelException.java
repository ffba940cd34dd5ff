package com.meltwater.rabbitlifecycle.exception;

/**
 * A failure on the channel level, for example a publish or an ack that the transport rejected.
 */
public class ChannelException extends RabbitLifecycleException {

    public ChannelException(String message) {
        super(Level.CHANNEL, message, null);
    }

    public ChannelException(String message, Throwable cause) {
        super(Level.CHANNEL, message, cause);
    }
}
