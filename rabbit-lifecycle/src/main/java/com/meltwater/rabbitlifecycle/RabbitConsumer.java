package com.meltwater.rabbitlifecycle;

import com.meltwater.rabbitlifecycle.exception.ConsumerCancelTimeoutException;
import com.meltwater.rabbitlifecycle.exception.ConsumerCanceledException;
import com.meltwater.rabbitlifecycle.util.Logger;
import com.rabbitmq.client.Delivery;
import rx.Completable;
import rx.Scheduler;
import rx.Subscription;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * A subscription to one queue on one {@link RabbitChannel}.
 *
 * The deliveries from the broker are handed over to a single delivery worker, wrapped into {@link Message}s and
 * dispatched to the {@link MessageHandler} on the handler scheduler. The handler invocations that are still running
 * are tracked so that {@link #cancel()} can wait for them before the subscription is cancelled on the broker.
 *
 * Messages delivered while the consumer is cancelling are still dispatched, until the broker stops the delivery.
 * A message that arrives after the consumer closed is rejected back to the queue.
 *
 * A failing handler cancels the consumer (fail fast). Other consumers of the channel are not affected.
 */
public class RabbitConsumer extends LifecycleResource {

    private static final Logger log = new Logger(RabbitConsumer.class);

    private final RabbitChannel channel;
    private final String queue;
    private final MessageHandler handler;
    private final ConsumeEventListener eventListener;
    private final ConnectionSettings settings;
    private final Scheduler handlerScheduler;
    private final Scheduler.Worker deliveryWorker;
    private final Set<Outcome> pending = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean canceledByBroker = new AtomicBoolean(false);

    private volatile String consumerTag;

    RabbitConsumer(RabbitChannel channel, String queue, MessageHandler handler, ConsumeEventListener eventListener) {
        super(channel.ioScheduler, channel.timerScheduler);
        this.channel = channel;
        this.queue = queue;
        this.handler = handler;
        this.eventListener = eventListener;
        this.settings = channel.getSettings();
        this.handlerScheduler = channel.ioScheduler;
        this.deliveryWorker = channel.ioScheduler.createWorker();
    }

    void assignTag(String consumerTag) {
        this.consumerTag = consumerTag;
    }

    /**
     * Discards a consumer whose subscription could not be started.
     */
    void abandon(Throwable error) {
        beginDying();
        deliveryWorker.unsubscribe();
        completion.fail(error);
    }

    /**
     * Entry point for the transport, called for every delivery of the subscription.
     *
     * @param delivery the delivered message, or null if the broker cancelled the subscription
     */
    void deliver(Delivery delivery) {
        if (delivery != null && completion.isSettled()) {
            requeueLateDelivery(delivery.getEnvelope().getDeliveryTag());
            return;
        }
        deliveryWorker.schedule(() -> onDelivery(delivery));
    }

    private void onDelivery(Delivery delivery) {
        if (consumerTag == null) {
            // subscribe-ok not processed yet
            deliveryWorker.schedule(() -> onDelivery(delivery), 1, TimeUnit.MILLISECONDS);
            return;
        }
        if (delivery == null) {
            log.warnWithParams("Consumer stopped unexpectedly. It will not receive any more messages.",
                    "queue", queue,
                    "consumerTag", consumerTag);
            canceledByBroker.set(true);
            cancel(new ConsumerCanceledException(queue, consumerTag));
            return;
        }
        if (completion.isSettled()) {
            requeueLateDelivery(delivery.getEnvelope().getDeliveryTag());
            return;
        }
        Message message = new Message(this, delivery);
        log.traceWithParams("Consumer received message",
                "queue", queue,
                "consumerTag", consumerTag,
                "deliveryTag", message.getDeliveryTag(),
                "messageHeaders", message.getHeaders());
        eventListener.received(message, pending.size());
        Outcome invocation = new Outcome();
        pending.add(invocation);
        Completable.defer(() -> handler.handle(message))
                .subscribeOn(handlerScheduler)
                .subscribe(
                        () -> {
                            pending.remove(invocation);
                            invocation.succeed();
                        },
                        error -> {
                            pending.remove(invocation);
                            invocation.fail(error);
                            onHandlerFailed(message, error);
                        });
    }

    private void requeueLateDelivery(long deliveryTag) {
        log.debugWithParams("Requeueing message received after the consumer closed.",
                "queue", queue,
                "consumerTag", consumerTag,
                "deliveryTag", deliveryTag);
        bestEffort("requeue message " + deliveryTag, () -> {
            channel.transport().basicReject(deliveryTag, true);
            return null;
        }).subscribe();
    }

    private void onHandlerFailed(Message message, Throwable error) {
        log.errorWithParams("Message handler failed, cancelling the consumer.", error,
                "queue", queue,
                "consumerTag", consumerTag,
                "message", message);
        eventListener.handlerFailed(message, error);
        try {
            message.dequeue();
        } catch (RuntimeException e) {
            log.warnWithParams("Could not dequeue the message of the failed handler.", e,
                    "queue", queue,
                    "consumerTag", consumerTag,
                    "deliveryTag", message.getDeliveryTag());
        }
        cancel(error);
    }

    public Completable cancel() {
        return cancel(null);
    }

    /**
     * Stops the consumer. Waits for running handlers (bounded by
     * {@link ConnectionSettings#consumer_drain_timeout_millis}) and then cancels the subscription on the broker
     * (bounded by {@link ConnectionSettings#consumer_cancel_timeout_millis}). The returned completable completes
     * when the consumer is closed or the cancel deadline passed, it never errors.
     *
     * Only the first call does any work, later calls just wait for the same result.
     *
     * @param reason the failure that {@link #completion()} should error with, or null for a normal cancel
     */
    public Completable cancel(Throwable reason) {
        if (!beginDying()) {
            return completion.awaitQuietly();
        }
        log.infoWithParams("Cancelling consumer. Waiting for running handlers before cancelling the subscription.",
                "queue", queue,
                "consumerTag", consumerTag,
                "pendingHandlers", pending.size(),
                "reason", reason == null ? null : reason.getMessage());
        drainPending()
                .andThen(cancelSubscription())
                .subscribe(() -> {
                    finish(reason);
                    deliveryWorker.unsubscribe();
                });
        return completion.awaitQuietly();
    }

    private Completable drainPending() {
        long timeout = settings.consumer_drain_timeout_millis;
        return awaitPending()
                .timeout(timeout, TimeUnit.MILLISECONDS, timerScheduler, Completable.fromAction(() ->
                        log.warnWithParams("Handlers still running after the drain timeout, cancelling anyway.",
                                "queue", queue,
                                "consumerTag", consumerTag,
                                "pendingHandlers", pending.size(),
                                "timeoutMillis", timeout)));
    }

    // handlers dispatched while waiting are waited for as well
    private Completable awaitPending() {
        return Completable.defer(() -> {
            List<Completable> running = pending.stream()
                    .map(Outcome::awaitQuietly)
                    .collect(Collectors.toList());
            if (running.isEmpty()) {
                return Completable.complete();
            }
            return Completable.merge(running).andThen(awaitPending());
        });
    }

    private Completable cancelSubscription() {
        return Completable.defer(() -> {
            if (canceledByBroker.get() || consumerTag == null || !channel.transport().isOpen()) {
                return Completable.complete();
            }
            long timeout = settings.consumer_cancel_timeout_millis;
            Subscription deadline = armDeadline(timeout, () -> new ConsumerCancelTimeoutException(consumerTag, timeout));
            return bestEffort("cancel consumer " + consumerTag, () -> {
                channel.transport().basicCancel(consumerTag);
                log.infoWithParams("Consumer successfully stopped. It will not receive any more messages.",
                        "queue", queue,
                        "consumerTag", consumerTag);
                return null;
            }).doOnCompleted(deadline::unsubscribe);
        });
    }

    /**
     * @return {@link ConsumerState#OPEN} until cancelled, {@link ConsumerState#CANCELLING} while it shuts down and
     * {@link ConsumerState#CLOSED} once {@link #completion()} is settled
     */
    public ConsumerState getState() {
        if (completion.isSettled()) {
            return ConsumerState.CLOSED;
        }
        return isDying() ? ConsumerState.CANCELLING : ConsumerState.OPEN;
    }

    ConsumeEventListener getEventListener() {
        return eventListener;
    }

    public RabbitChannel getChannel() {
        return channel;
    }

    public String getQueue() {
        return queue;
    }

    /**
     * @return the tag the broker registered this consumer under, null until the subscription is acknowledged
     */
    public String getConsumerTag() {
        return consumerTag;
    }

    public int getPendingCount() {
        return pending.size();
    }

    @Override
    public String toString() {
        return "RabbitConsumer{" + queue + ", " + consumerTag + '}';
    }
}
