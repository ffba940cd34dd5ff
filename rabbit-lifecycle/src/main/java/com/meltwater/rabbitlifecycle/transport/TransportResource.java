package com.meltwater.rabbitlifecycle.transport;

/**
 * A connection or channel of the underlying AMQP client that emits close and error notifications.
 */
public interface TransportResource {

    void addListener(TransportListener listener);

    void removeListener(TransportListener listener);

    /**
     * Checking this method should be only for information,
     * because of the race conditions - state can change after the call.
     *
     * @return true when the resource is open, false otherwise
     */
    boolean isOpen();
}
