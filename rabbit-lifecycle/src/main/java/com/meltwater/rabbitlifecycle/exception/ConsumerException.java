package com.meltwater.rabbitlifecycle.exception;

/**
 * A failure on the consumer level, for example the broker refusing the subscription.
 */
public class ConsumerException extends RabbitLifecycleException {

    public ConsumerException(String message) {
        super(Level.CONSUMER, message, null);
    }

    public ConsumerException(String message, Throwable cause) {
        super(Level.CONSUMER, message, cause);
    }
}
