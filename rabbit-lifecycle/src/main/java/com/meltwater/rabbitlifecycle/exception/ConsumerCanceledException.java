package com.meltwater.rabbitlifecycle.exception;

/**
 * The broker cancelled the subscription, for example because the queue was deleted.
 */
public class ConsumerCanceledException extends ConsumerException {

    public ConsumerCanceledException(String queue, String consumerTag) {
        super("Consumer cancelled by broker (queue=" + queue + ", consumerTag=" + consumerTag + ")");
    }
}
