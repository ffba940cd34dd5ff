package com.meltwater.rabbitlifecycle.exception;

import com.meltwater.rabbitlifecycle.Message;

/**
 * A status changing operation was attempted on a {@link Message} that already left the non-acked status.
 */
public class InvalidStateException extends RabbitLifecycleException {

    private final String operation;
    private final Message.Status status;

    public InvalidStateException(String operation, Message.Status status) {
        super(Level.MESSAGE, "Cannot " + operation + " message, it is already " + status, null);
        this.operation = operation;
        this.status = status;
    }

    public String getOperation() {
        return operation;
    }

    public Message.Status getStatus() {
        return status;
    }
}
