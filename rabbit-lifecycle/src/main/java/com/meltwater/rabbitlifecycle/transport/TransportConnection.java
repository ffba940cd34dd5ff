package com.meltwater.rabbitlifecycle.transport;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Interface wrapping a {@link com.rabbitmq.client.Connection}
 *
 * @see com.rabbitmq.client.Connection
 */
public interface TransportConnection extends TransportResource {

    /**
     * @return a new channel that is not in confirm mode
     * @throws IOException if the channel could not be created
     */
    TransportChannel createChannel() throws IOException;

    /**
     * @return a new channel with publisher confirms enabled
     * @throws IOException if the channel could not be created or confirm mode could not be selected
     */
    TransportChannel createConfirmChannel() throws IOException;

    /**
     * Close the connection and all its channels with the {@link com.rabbitmq.client.AMQP#REPLY_SUCCESS} close code.
     * Blocks until the broker has confirmed the close.
     */
    void close() throws IOException, TimeoutException;
}
