package com.meltwater.rabbitlifecycle;

import com.meltwater.rabbitlifecycle.exception.ChannelCloseTimeoutException;
import com.meltwater.rabbitlifecycle.exception.ChannelClosedException;
import com.meltwater.rabbitlifecycle.exception.ChannelException;
import com.meltwater.rabbitlifecycle.exception.ConsumerException;
import com.meltwater.rabbitlifecycle.transport.TransportChannel;
import com.meltwater.rabbitlifecycle.transport.TransportListener;
import com.meltwater.rabbitlifecycle.util.Logger;
import com.rabbitmq.client.AMQP;
import rx.Completable;
import rx.Single;
import rx.Subscription;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * A channel of a {@link RabbitConnection}, used to publish messages and to start consumers.
 *
 * Closing a channel first cancels all its consumers concurrently, then waits for their reply queues to be deleted
 * and for outstanding publisher confirms (in confirm mode) and finally closes the transport channel. The close is bounded by
 * {@link ConnectionSettings#channel_close_timeout_millis}.
 */
public class RabbitChannel extends LifecycleResource {

    private static final Logger log = new Logger(RabbitChannel.class);

    static final int PERSISTENT = 2;

    private final static AtomicInteger consumerCount = new AtomicInteger();

    private final RabbitConnection connection;
    private final TransportChannel transport;
    private final ConnectionSettings settings;
    private final List<RabbitConsumer> consumers = new CopyOnWriteArrayList<>();
    private final List<Outcome> replyQueueCleanups = new CopyOnWriteArrayList<>();
    private volatile ConsumeEventListener consumeEventListener = new ConsumeEventListener() {};

    RabbitChannel(RabbitConnection connection, TransportChannel transport) {
        super(connection.ioScheduler(), connection.timerScheduler());
        this.connection = connection;
        this.transport = transport;
        this.settings = connection.getSettings();
        transport.addListener(new TransportEvents());
    }

    public Completable close() {
        return close(null);
    }

    /**
     * Cancels all consumers and then closes the channel. The returned completable completes when the channel is
     * closed or the close deadline passed, it never errors.
     *
     * Only the first call does any work, later calls just wait for the same result.
     *
     * @param reason the failure that {@link #completion()} should error with, or null for a normal close
     */
    public Completable close(Throwable reason) {
        if (!beginDying()) {
            return completion.awaitQuietly();
        }
        log.infoWithParams("Closing channel.",
                "channelNr", transport.getChannelNumber(),
                "consumers", consumers.size(),
                "reason", reason == null ? null : reason.getMessage());
        long timeout = settings.channel_close_timeout_millis;
        Subscription deadline = armDeadline(timeout, () -> new ChannelCloseTimeoutException(timeout));
        List<Completable> cancels = consumers.stream()
                .map(consumer -> consumer.cancel(reason))
                .collect(Collectors.toList());
        Completable.merge(cancels)
                .andThen(Completable.defer(() -> Completable.merge(replyQueueCleanups.stream()
                        .map(Outcome::awaitQuietly)
                        .collect(Collectors.toList()))))
                .andThen(waitForConfirms())
                .andThen(bestEffort("close the transport channel", () -> {
                    if (transport.isOpen()) {
                        transport.close();
                    }
                    return null;
                }))
                .subscribe(() -> {
                    deadline.unsubscribe();
                    finish(reason);
                });
        return completion.awaitQuietly();
    }

    private Completable waitForConfirms() {
        if (!transport.isConfirmMode()) {
            return Completable.complete();
        }
        return bestEffort("wait for publisher confirms", () -> {
            if (transport.isOpen() && !transport.waitForConfirms(settings.channel_close_timeout_millis)) {
                log.warnWithParams("Some published messages were nacked by the broker.",
                        "channelNr", transport.getChannelNumber());
            }
            return null;
        });
    }

    /**
     * Limits the number of unacknowledged messages the broker delivers on this channel.
     *
     * @param count the maximum number of unacknowledged messages, 0 for unlimited
     */
    public Completable prefetch(int count) {
        return blocking(() -> {
            transport.basicQos(count);
            return null;
        }).onErrorResumeNext(e -> Completable.error(new ChannelException("Could not set prefetch count " + count, e)));
    }

    /**
     * Publishes a persistent message. On a confirm mode channel the returned completable completes when the
     * broker confirmed the message, otherwise as soon as it is written.
     *
     * The publish fails with a {@link ChannelException} if the broker nacks the message or if the channel reports an
     * error before it was confirmed, whichever comes first.
     *
     * @param headers the message headers, may be null
     */
    public Completable publish(String exchange, String routingKey, byte[] body, Map<String, Object> headers) {
        AMQP.BasicProperties props = new AMQP.BasicProperties.Builder()
                .deliveryMode(PERSISTENT)
                .headers(headers)
                .build();
        return publish(exchange, routingKey, props, body);
    }

    Completable publish(String exchange, String routingKey, AMQP.BasicProperties props, byte[] body) {
        return Completable.defer(() -> {
            // handlers draining during a close may still publish
            if (completion.isSettled()) {
                return Completable.error(new ChannelException("Cannot publish, channel " + transport.getChannelNumber() + " is closed"));
            }
            Outcome published = new Outcome();
            TransportListener errorObserver = new TransportListener() {
                @Override
                public void onError(Throwable error) {
                    published.fail(new ChannelException("Channel failed during publish", error));
                }
            };
            transport.addListener(errorObserver);
            published.awaitQuietly().subscribe(() -> transport.removeListener(errorObserver));
            transport.publish(exchange, routingKey, props, body)
                    .subscribeOn(ioScheduler)
                    .subscribe(
                            published::succeed,
                            e -> published.fail(new ChannelException("Publish to exchange '" + exchange + "' with routing key '" + routingKey + "' failed", e)));
            return published.toCompletable();
        });
    }

    /**
     * Starts a consumer on the queue. Every delivered message is handed to the handler.
     *
     * @return the started consumer, or a {@link ConsumerException} if the broker refused the subscription
     */
    public Single<RabbitConsumer> consume(String queue, MessageHandler handler, ConsumerSettings consumerSettings) {
        return Single.defer(() -> {
            if (!isOpen()) {
                return Single.<RabbitConsumer>error(new ConsumerException("Cannot consume from " + queue + ", channel " + transport.getChannelNumber() + " is not open"));
            }
            RabbitConsumer consumer = new RabbitConsumer(this, queue, handler, consumeEventListener);
            String prefix = consumerSettings.getConsumer_tag_prefix();
            String requestedTag = prefix.isEmpty() ? "" : prefix + "-" + consumerCount.incrementAndGet();
            return Single.fromCallable(() -> transport.basicConsume(queue, requestedTag, consumerSettings.isExclusive(), consumer::deliver))
                    .subscribeOn(ioScheduler)
                    .onErrorResumeNext(e -> {
                        ConsumerException error = new ConsumerException("Could not start consuming from " + queue, e);
                        consumer.abandon(error);
                        return Single.<String>error(error);
                    })
                    .flatMap(consumerTag -> {
                        consumer.assignTag(consumerTag);
                        consumers.add(consumer);
                        if (isDying()) {
                            // close started while subscribing and may have missed this consumer
                            ConsumerException error = new ConsumerException("Channel " + transport.getChannelNumber() + " closed while consuming from " + queue);
                            return consumer.cancel(error).andThen(Single.<RabbitConsumer>error(error));
                        }
                        log.infoWithParams("Consumer registered and ready to receive messages.",
                                "channelNr", transport.getChannelNumber(),
                                "queue", queue,
                                "consumerTag", consumerTag);
                        return Single.just(consumer);
                    });
        });
    }

    /**
     * Consumes from a private reply queue bound to the exchange with the routing key. The queue is exclusive and
     * auto-delete and exists exactly as long as the returned consumer: it is deleted when the consumer completes,
     * whatever the outcome, or right away if the consumer could not be started.
     *
     * @param queue the name of the reply queue, or an empty string for a server-named queue
     */
    public Single<RabbitConsumer> handleRpc(String exchange, String queue, String routingKey, MessageHandler handler) {
        return Single.defer(() -> {
            AtomicBoolean deleted = new AtomicBoolean(false);
            String[] declared = {queue};
            return Single.fromCallable(() -> {
                        declared[0] = transport.queueDeclare(queue, true, true);
                        transport.queueBind(declared[0], exchange, routingKey);
                        return declared[0];
                    })
                    .subscribeOn(ioScheduler)
                    .onErrorResumeNext(e -> Single.<String>error(new ChannelException("Could not set up reply queue '" + queue + "' bound to " + exchange + "/" + routingKey, e)))
                    .flatMap(replyQueue -> consume(replyQueue, handler, new ConsumerSettings().withExclusive(true)))
                    .doOnSuccess(consumer -> {
                        Outcome cleanup = new Outcome();
                        replyQueueCleanups.add(cleanup);
                        consumer.completion()
                                .onErrorComplete()
                                .andThen(deleteReplyQueue(declared[0], deleted))
                                .subscribe(() -> {
                                    replyQueueCleanups.remove(cleanup);
                                    cleanup.succeed();
                                });
                    })
                    .onErrorResumeNext(error -> deleteReplyQueue(declared[0], deleted)
                            .andThen(Single.<RabbitConsumer>error(error)));
        });
    }

    private Completable deleteReplyQueue(String queue, AtomicBoolean deleted) {
        return Completable.defer(() -> {
            if (queue.isEmpty() || !deleted.compareAndSet(false, true)) {
                return Completable.complete();
            }
            log.infoWithParams("Deleting reply queue.",
                    "queue", queue,
                    "channelNr", transport.getChannelNumber());
            return bestEffort("delete reply queue " + queue, () -> {
                transport.queueDelete(queue);
                return null;
            });
        });
    }

    private class TransportEvents implements TransportListener {

        @Override
        public void onError(Throwable error) {
            ChannelException wrapped = new ChannelException("Channel " + transport.getChannelNumber() + " failed", error);
            log.errorWithParams("Channel error reported by the transport.", error,
                    "channelNr", transport.getChannelNumber());
            close(wrapped);
            completion.fail(wrapped);
        }

        @Override
        public void onClose(boolean hadError) {
            if (isDying()) {
                return;
            }
            ChannelClosedException closed = new ChannelClosedException(hadError);
            log.warnWithParams("Channel closed by peer.",
                    "channelNr", transport.getChannelNumber(),
                    "hadError", hadError);
            close(closed);
            completion.fail(closed);
        }
    }

    /**
     * Sets the listener that gets notified about the messages of consumers started after this call.
     */
    public void setConsumeEventListener(ConsumeEventListener consumeEventListener) {
        this.consumeEventListener = consumeEventListener;
    }

    TransportChannel transport() {
        return transport;
    }

    ConnectionSettings getSettings() {
        return settings;
    }

    public RabbitConnection getConnection() {
        return connection;
    }

    public List<RabbitConsumer> getConsumers() {
        return Collections.unmodifiableList(consumers);
    }

    public boolean isConfirmMode() {
        return transport.isConfirmMode();
    }

    public int getChannelNumber() {
        return transport.getChannelNumber();
    }

    @Override
    public String toString() {
        return "RabbitChannel{" + transport.getChannelNumber() + '}';
    }
}
