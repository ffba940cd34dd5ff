package com.meltwater.rabbitlifecycle;

/**
 * Listener that get notified about consume and ack/reject events
 *
 * @see RabbitChannel#setConsumeEventListener(ConsumeEventListener)
 */
public interface ConsumeEventListener {

    default void received(Message message, long pendingMessages){}

    default void beforeAck(Message message){}

    default void beforeReject(Message message, boolean requeue){}

    default void afterFailedAck(Message message, Exception error, boolean channelIsOpen){}

    default void done(Message message, long processingStartTimestamp){}

    default void handlerFailed(Message message, Throwable error){}
}
