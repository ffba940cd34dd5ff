package com.meltwater.rabbitlifecycle.transport.impl;

import com.meltwater.rabbitlifecycle.Outcome;
import com.meltwater.rabbitlifecycle.transport.DeliveryListener;
import com.meltwater.rabbitlifecycle.transport.TransportChannel;
import com.meltwater.rabbitlifecycle.transport.TransportListener;
import com.meltwater.rabbitlifecycle.util.Logger;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ConfirmListener;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import rx.Completable;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.TimeoutException;

/**
 * A {@link TransportChannel} over an amqp-client {@link Channel}.
 *
 * In confirm mode every publish gets an {@link Outcome} keyed by its publish sequence number, settled by the
 * broker's ack or nack. Outstanding outcomes fail when the channel shuts down.
 */
public class RabbitTransportChannel implements TransportChannel {

    private static final Logger log = new Logger(RabbitTransportChannel.class);

    private final Channel channel;
    private final boolean confirmMode;
    private final TransportListeners listeners;
    private final ConcurrentNavigableMap<Long, Outcome> unconfirmed = new ConcurrentSkipListMap<>();

    RabbitTransportChannel(Channel channel, boolean confirmMode) throws IOException {
        this.channel = channel;
        this.confirmMode = confirmMode;
        this.listeners = new TransportListeners("channel-" + channel.getChannelNumber());
        if (confirmMode) {
            channel.confirmSelect();
            channel.addConfirmListener(new Confirms());
        }
        channel.addShutdownListener(this::failUnconfirmed);
        channel.addShutdownListener(listeners);
    }

    @Override
    public Completable publish(String exchange, String routingKey, AMQP.BasicProperties props, byte[] body) {
        return Completable.defer(() -> {
            Outcome confirmed = new Outcome();
            try {
                synchronized (this) {
                    long seqNo = channel.getNextPublishSeqNo();
                    if (confirmMode) {
                        unconfirmed.put(seqNo, confirmed);
                    }
                    try {
                        channel.basicPublish(exchange, routingKey, props, body);
                    } catch (IOException | RuntimeException e) {
                        unconfirmed.remove(seqNo);
                        throw e;
                    }
                }
            } catch (IOException | RuntimeException e) {
                return Completable.error(e);
            }
            if (!confirmMode) {
                return Completable.complete();
            }
            return confirmed.toCompletable();
        });
    }

    private class Confirms implements ConfirmListener {

        @Override
        public void handleAck(long deliveryTag, boolean multiple) {
            for (Outcome outcome : take(deliveryTag, multiple)) {
                outcome.succeed();
            }
        }

        @Override
        public void handleNack(long deliveryTag, boolean multiple) {
            log.warnWithParams("Broker nacked published message(s).",
                    "channelNr", channel.getChannelNumber(),
                    "deliveryTag", deliveryTag,
                    "multiple", multiple);
            for (Outcome outcome : take(deliveryTag, multiple)) {
                outcome.fail(new IOException("Message with publish sequence number " + deliveryTag + " was nacked by the broker"));
            }
        }

        private Iterable<Outcome> take(long deliveryTag, boolean multiple) {
            if (multiple) {
                ConcurrentNavigableMap<Long, Outcome> confirmed = unconfirmed.headMap(deliveryTag, true);
                Iterable<Outcome> outcomes = new ArrayList<>(confirmed.values());
                confirmed.clear();
                return outcomes;
            }
            Outcome outcome = unconfirmed.remove(deliveryTag);
            return outcome == null ? Collections.emptyList() : Collections.singletonList(outcome);
        }
    }

    private void failUnconfirmed(ShutdownSignalException cause) {
        for (Map.Entry<Long, Outcome> entry : unconfirmed.entrySet()) {
            entry.getValue().fail(cause);
        }
        unconfirmed.clear();
    }

    @Override
    public boolean waitForConfirms(long timeoutMillis) throws InterruptedException, TimeoutException {
        return channel.waitForConfirms(timeoutMillis);
    }

    @Override
    public String basicConsume(String queue, String consumerTag, boolean exclusive, DeliveryListener listener) throws IOException {
        return channel.basicConsume(queue, false, consumerTag, false, exclusive, null, new DefaultConsumer(channel) {
            @Override
            public void handleDelivery(String tag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
                listener.onDelivery(new Delivery(envelope, properties, body));
            }

            @Override
            public void handleCancel(String tag) {
                listener.onDelivery(null);
            }
        });
    }

    @Override
    public void basicCancel(String consumerTag) throws IOException {
        channel.basicCancel(consumerTag);
    }

    @Override
    public void basicAck(long deliveryTag) throws IOException {
        channel.basicAck(deliveryTag, false);
    }

    @Override
    public void basicReject(long deliveryTag, boolean requeue) throws IOException {
        channel.basicReject(deliveryTag, requeue);
    }

    @Override
    public void basicQos(int prefetchCount) throws IOException {
        channel.basicQos(prefetchCount);
    }

    @Override
    public String queueDeclare(String queue, boolean exclusive, boolean autoDelete) throws IOException {
        return channel.queueDeclare(queue, false, exclusive, autoDelete, null).getQueue();
    }

    @Override
    public void queueBind(String queue, String exchange, String routingKey) throws IOException {
        channel.queueBind(queue, exchange, routingKey);
    }

    @Override
    public void queueDelete(String queue) throws IOException {
        channel.queueDelete(queue);
    }

    @Override
    public void close() throws IOException, TimeoutException {
        channel.close();
    }

    @Override
    public boolean isConfirmMode() {
        return confirmMode;
    }

    @Override
    public int getChannelNumber() {
        return channel.getChannelNumber();
    }

    @Override
    public void addListener(TransportListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(TransportListener listener) {
        listeners.remove(listener);
    }

    @Override
    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public String toString() {
        return "RabbitTransportChannel{" + channel.getChannelNumber() + '}';
    }
}
