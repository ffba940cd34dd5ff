package com.meltwater.rabbitlifecycle;

/**
 * The states a {@link RabbitConsumer} moves through. Transitions only go forward.
 */
public enum ConsumerState {
    OPEN,
    CANCELLING,
    CLOSED
}
