package com.meltwater.rabbitlifecycle;

import rx.Completable;

/**
 * Processes the messages delivered to a {@link RabbitConsumer}.
 *
 * The handler is expected to settle each message itself, typically by calling {@link Message#ack()} once it is done.
 * If the returned completable errors the consumer dequeues the message and cancels itself.
 *
 * @see RetryingMessageHandler
 */
@FunctionalInterface
public interface MessageHandler {

    Completable handle(Message message);
}
