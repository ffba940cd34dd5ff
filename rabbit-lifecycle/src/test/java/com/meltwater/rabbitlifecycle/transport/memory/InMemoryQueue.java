package com.meltwater.rabbitlifecycle.transport.memory;

import com.meltwater.rabbitlifecycle.transport.DeliveryListener;
import com.rabbitmq.client.AMQP;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

class InMemoryQueue {

    final String name;
    final boolean exclusive;
    final boolean autoDelete;

    private final Deque<QueuedMessage> backlog = new ArrayDeque<>();
    private final List<Subscription> subscriptions = new ArrayList<>();
    private int next = 0;

    InMemoryQueue(String name, boolean exclusive, boolean autoDelete) {
        this.name = name;
        this.exclusive = exclusive;
        this.autoDelete = autoDelete;
    }

    synchronized void offer(String exchange, String routingKey, AMQP.BasicProperties props, byte[] body, boolean redelivered) {
        QueuedMessage message = new QueuedMessage(exchange, routingKey, props, body, redelivered);
        if (subscriptions.isEmpty()) {
            backlog.add(message);
            return;
        }
        Subscription subscription = subscriptions.get(next++ % subscriptions.size());
        subscription.channel.dispatch(subscription, message);
    }

    synchronized void subscribe(Subscription subscription) {
        subscriptions.add(subscription);
        while (!backlog.isEmpty()) {
            subscription.channel.dispatch(subscription, backlog.poll());
        }
    }

    synchronized void unsubscribe(Subscription subscription) {
        subscriptions.remove(subscription);
    }

    synchronized void requeue(QueuedMessage message) {
        backlog.addFirst(message.redelivered());
    }

    void cancelAll() {
        List<Subscription> cancelled;
        synchronized (this) {
            cancelled = new ArrayList<>(subscriptions);
            subscriptions.clear();
        }
        for (Subscription subscription : cancelled) {
            subscription.channel.forget(subscription);
            subscription.listener.onDelivery(null);
        }
    }

    synchronized int backlogSize() {
        return backlog.size();
    }

    static class Subscription {
        final InMemoryChannel channel;
        final InMemoryQueue queue;
        final String consumerTag;
        final DeliveryListener listener;

        Subscription(InMemoryChannel channel, InMemoryQueue queue, String consumerTag, DeliveryListener listener) {
            this.channel = channel;
            this.queue = queue;
            this.consumerTag = consumerTag;
            this.listener = listener;
        }
    }

    static class QueuedMessage {
        final String exchange;
        final String routingKey;
        final AMQP.BasicProperties props;
        final byte[] body;
        final boolean redelivered;

        QueuedMessage(String exchange, String routingKey, AMQP.BasicProperties props, byte[] body, boolean redelivered) {
            this.exchange = exchange;
            this.routingKey = routingKey;
            this.props = props;
            this.body = body;
            this.redelivered = redelivered;
        }

        QueuedMessage redelivered() {
            return new QueuedMessage(exchange, routingKey, props, body, true);
        }
    }
}
