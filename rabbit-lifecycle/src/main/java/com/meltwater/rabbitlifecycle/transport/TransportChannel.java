package com.meltwater.rabbitlifecycle.transport;

import com.rabbitmq.client.AMQP;
import rx.Completable;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Interface wrapping a {@link com.rabbitmq.client.Channel}
 *
 * Apart from {@link #publish(String, String, AMQP.BasicProperties, byte[])} all methods are blocking.
 *
 * @see com.rabbitmq.client.Channel
 */
public interface TransportChannel extends TransportResource {

    /**
     * @return true if publisher confirms were enabled when the channel was created
     */
    boolean isConfirmMode();

    /**
     * Retrieve this channel's channel number.
     * @return the channel number
     */
    int getChannelNumber();

    /**
     * Publish a message.
     *
     * @return a completable that completes when the message is written (or, in confirm mode, when the broker
     * confirmed it) and errors if the write fails or the broker nacks the message
     */
    Completable publish(String exchange, String routingKey, AMQP.BasicProperties props, byte[] body);

    /**
     * Wait until all messages published so far have been either ack'd or nack'd by the broker, or until the timeout elapses.
     *
     * @return whether all the messages were ack'd (and none were nack'd)
     */
    boolean waitForConfirms(long timeoutMillis) throws InterruptedException, TimeoutException;

    /**
     * Start a non-nolocal consumer with manual acknowledgements.
     *
     * @param consumerTag a client-generated consumer tag, or an empty string to let the broker generate one
     * @return the consumer tag the broker registered the subscription under
     * @see com.rabbitmq.client.Channel#basicConsume(String, boolean, String, boolean, boolean, java.util.Map, com.rabbitmq.client.Consumer)
     */
    String basicConsume(String queue, String consumerTag, boolean exclusive, DeliveryListener listener) throws IOException;

    void basicCancel(String consumerTag) throws IOException;

    void basicAck(long deliveryTag) throws IOException;

    void basicReject(long deliveryTag, boolean requeue) throws IOException;

    /**
     * Request a specific prefetchCount "quality of service" settings for this channel.
     *
     * @param prefetchCount maximum number of messages that the server will deliver, 0 if unlimited
     */
    void basicQos(int prefetchCount) throws IOException;

    /**
     * Declares a non-durable queue.
     *
     * @param queue the queue name, or an empty string for a server-named queue
     * @return the name of the declared queue
     */
    String queueDeclare(String queue, boolean exclusive, boolean autoDelete) throws IOException;

    void queueBind(String queue, String exchange, String routingKey) throws IOException;

    void queueDelete(String queue) throws IOException;

    /**
     * Close this channel with the {@link com.rabbitmq.client.AMQP#REPLY_SUCCESS} close code.
     */
    void close() throws IOException, TimeoutException;
}
