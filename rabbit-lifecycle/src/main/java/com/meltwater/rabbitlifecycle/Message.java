package com.meltwater.rabbitlifecycle;

import com.google.common.primitives.Ints;
import com.meltwater.rabbitlifecycle.exception.ChannelException;
import com.meltwater.rabbitlifecycle.exception.InvalidStateException;
import com.meltwater.rabbitlifecycle.transport.TransportChannel;
import com.meltwater.rabbitlifecycle.util.Logger;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;
import rx.Completable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * This class wraps all the data delivered by the rabbitmq broker for a given message, together with the
 * {@link RabbitConsumer} it was delivered to.
 *
 * A message starts out {@link Status#NON_ACKED} and must be settled exactly once with {@link #ack()},
 * {@link #dequeue()} or {@link #requeue()}. Any further attempt fails with an {@link InvalidStateException}.
 *
 * NOTE:
 * The consuming code is expected to settle the message as soon as it can. Failure in doing so will in most cases
 * make the message stream pause as rabbitmq will be waiting for acks before delivering more messages.
 */
public class Message {

    private static final Logger log = new Logger(Message.class);

    /**
     * Header counting how many times a message was put back on its queue by {@link #redeliver()}.
     * The value is an integer formatted as a string.
     */
    public static final String REDELIVERED_COUNT_HEADER = "x-redelivered-count";

    public enum Status {
        NON_ACKED("non-acked"),
        ACKED("acked"),
        DEQUEUED("dequeued"),
        REQUEUED("requeued");

        private final String label;

        Status(String label) {
            this.label = label;
        }

        @Override
        public String toString() {
            return label;
        }
    }

    private final RabbitConsumer consumer;
    private final Envelope envelope;
    private final AMQP.BasicProperties properties;
    private final byte[] body;
    private final long receivedAt;
    private final AtomicReference<Status> status = new AtomicReference<>(Status.NON_ACKED);

    Message(RabbitConsumer consumer, Delivery delivery) {
        this.consumer = consumer;
        this.envelope = delivery.getEnvelope();
        this.properties = delivery.getProperties() == null ? new AMQP.BasicProperties() : delivery.getProperties();
        this.body = delivery.getBody();
        this.receivedAt = System.currentTimeMillis();
    }

    /**
     * Acknowledges the message.
     *
     * @throws InvalidStateException if the message is already settled
     * @throws ChannelException if the acknowledgement could not be sent
     */
    public void ack() {
        transition("ack", Status.ACKED);
        ConsumeEventListener listener = consumer.getEventListener();
        listener.beforeAck(this);
        TransportChannel transport = consumer.getChannel().transport();
        try {
            transport.basicAck(getDeliveryTag());
        } catch (IOException | RuntimeException e) {
            listener.afterFailedAck(this, e, transport.isOpen());
            throw new ChannelException("Could not ack message with delivery tag " + getDeliveryTag(), e);
        }
        listener.done(this, receivedAt);
    }

    /**
     * Rejects the message without requeueing it, the broker drops it (or dead letters it if the queue is set up for that).
     *
     * @throws InvalidStateException if the message is already settled
     * @throws ChannelException if the rejection could not be sent
     */
    public void dequeue() {
        transition("dequeue", Status.DEQUEUED);
        reject(false);
    }

    /**
     * Rejects the message and puts it back on its queue.
     *
     * @throws InvalidStateException if the message is already settled
     * @throws ChannelException if the rejection could not be sent
     */
    public void requeue() {
        transition("requeue", Status.REQUEUED);
        reject(true);
    }

    /**
     * Requeues the message unless it is already settled, in which case nothing happens.
     */
    public void tryRequeue() {
        if (status.compareAndSet(Status.NON_ACKED, Status.REQUEUED)) {
            reject(true);
        }
    }

    /**
     * Publishes a copy of this message to the exchange and routing key it was delivered with, with the
     * {@link #REDELIVERED_COUNT_HEADER} incremented. On a confirm mode channel the returned completable completes
     * when the broker confirmed the copy.
     *
     * The status of this message is left as it is, so the caller still has to settle it, normally with {@link #ack()}.
     */
    public Completable redeliver() {
        return Completable.defer(() -> {
            Map<String, Object> headers = new HashMap<>(getHeaders());
            int redeliveredCount = getRedeliveredCount() + 1;
            headers.put(REDELIVERED_COUNT_HEADER, Integer.toString(redeliveredCount));
            log.debugWithParams("Redelivering message.",
                    "exchange", envelope.getExchange(),
                    "routingKey", envelope.getRoutingKey(),
                    "deliveryTag", getDeliveryTag(),
                    "redeliveredCount", redeliveredCount);
            AMQP.BasicProperties copy = properties.builder()
                    .headers(headers)
                    .deliveryMode(RabbitChannel.PERSISTENT)
                    .build();
            return consumer.getChannel().publish(envelope.getExchange(), envelope.getRoutingKey(), copy, body);
        });
    }

    private void transition(String operation, Status target) {
        if (!status.compareAndSet(Status.NON_ACKED, target)) {
            throw new InvalidStateException(operation, status.get());
        }
    }

    private void reject(boolean requeue) {
        ConsumeEventListener listener = consumer.getEventListener();
        listener.beforeReject(this, requeue);
        try {
            consumer.getChannel().transport().basicReject(getDeliveryTag(), requeue);
        } catch (IOException | RuntimeException e) {
            throw new ChannelException("Could not reject message with delivery tag " + getDeliveryTag(), e);
        }
        listener.done(this, receivedAt);
    }

    /**
     * @return the value of the {@link #REDELIVERED_COUNT_HEADER}, 0 if it is missing or not a number
     */
    public int getRedeliveredCount() {
        Object value = getHeaders().get(REDELIVERED_COUNT_HEADER);
        if (value == null) {
            return 0;
        }
        Integer count = Ints.tryParse(value.toString().trim());
        return count == null ? 0 : count;
    }

    public Status getStatus() {
        return status.get();
    }

    public RabbitConsumer getConsumer() {
        return consumer;
    }

    public String getExchange() {
        return envelope.getExchange();
    }

    public String getRoutingKey() {
        return envelope.getRoutingKey();
    }

    public long getDeliveryTag() {
        return envelope.getDeliveryTag();
    }

    /**
     * @return true if the broker delivered this message before, this is the broker's own flag
     * and unrelated to {@link #getRedeliveredCount()}
     */
    public boolean isRedelivered() {
        return envelope.isRedeliver();
    }

    public Map<String, Object> getHeaders() {
        return properties.getHeaders() == null ? Collections.emptyMap() : properties.getHeaders();
    }

    public AMQP.BasicProperties getProperties() {
        return properties;
    }

    public byte[] getBody() {
        return body;
    }

    public String getBodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "Message{" +
                "exchange='" + envelope.getExchange() + '\'' +
                ", routingKey='" + envelope.getRoutingKey() + '\'' +
                ", deliveryTag=" + envelope.getDeliveryTag() +
                ", status=" + status.get() +
                '}';
    }
}
