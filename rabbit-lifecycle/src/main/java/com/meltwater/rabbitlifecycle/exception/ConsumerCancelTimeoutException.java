package com.meltwater.rabbitlifecycle.exception;

public class ConsumerCancelTimeoutException extends ConsumerException {

    public ConsumerCancelTimeoutException(String consumerTag, long timeoutMillis) {
        super("Broker did not confirm cancel of consumer " + consumerTag + " within " + timeoutMillis + " ms");
    }
}
