package com.meltwater.rabbitlifecycle;

import com.meltwater.rabbitlifecycle.util.Logger;
import rx.Completable;

/**
 * Wraps a {@link MessageHandler} and retries the messages it fails on a bounded number of times.
 *
 * When the wrapped handler fails and the message was redelivered fewer than maxRedeliveredCount times, a copy with
 * an incremented {@link Message#REDELIVERED_COUNT_HEADER} is published and the original is acked. Otherwise the
 * message is dequeued. The consumer is only cancelled if one of those steps fails.
 */
public class RetryingMessageHandler implements MessageHandler {

    private static final Logger log = new Logger(RetryingMessageHandler.class);

    private final MessageHandler delegate;
    private final int maxRedeliveredCount;

    public RetryingMessageHandler(MessageHandler delegate, int maxRedeliveredCount) {
        this.delegate = delegate;
        this.maxRedeliveredCount = maxRedeliveredCount;
    }

    public RetryingMessageHandler(MessageHandler delegate, ConsumerSettings settings) {
        this(delegate, settings.getMax_redelivered_count());
    }

    @Override
    public Completable handle(Message message) {
        return Completable.defer(() -> delegate.handle(message))
                .onErrorResumeNext(error -> {
                    int redeliveredCount = message.getRedeliveredCount();
                    if (redeliveredCount < maxRedeliveredCount) {
                        log.warnWithParams("Message handling failed, redelivering.", error,
                                "message", message,
                                "redeliveredCount", redeliveredCount,
                                "maxRedeliveredCount", maxRedeliveredCount);
                        return message.redeliver().andThen(Completable.fromAction(message::ack));
                    }
                    log.errorWithParams("Message handling failed too many times, dequeueing.", error,
                            "message", message,
                            "redeliveredCount", redeliveredCount,
                            "maxRedeliveredCount", maxRedeliveredCount);
                    return Completable.fromAction(message::dequeue);
                });
    }
}
