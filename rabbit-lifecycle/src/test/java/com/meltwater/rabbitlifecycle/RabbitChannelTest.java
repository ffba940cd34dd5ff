package com.meltwater.rabbitlifecycle;

import com.google.common.collect.ImmutableMap;
import com.meltwater.rabbitlifecycle.exception.ChannelCloseTimeoutException;
import com.meltwater.rabbitlifecycle.exception.ChannelClosedException;
import com.meltwater.rabbitlifecycle.exception.ChannelException;
import com.meltwater.rabbitlifecycle.exception.ConsumerException;
import com.meltwater.rabbitlifecycle.transport.memory.InMemoryChannel;
import com.meltwater.rabbitlifecycle.transport.memory.InMemoryTransport;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.Timeout;
import rx.Completable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.jayway.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class RabbitChannelTest {

    @Rule
    public Timeout globalTimeout = new Timeout(30_000, TimeUnit.MILLISECONDS);

    private static final BrokerAddress address = BrokerAddress.fromUri("amqp://localhost");
    private static final byte[] body = "hello".getBytes(StandardCharsets.UTF_8);
    private static final MessageHandler ackingHandler = message -> Completable.fromAction(message::ack);

    private InMemoryTransport transport;
    private ConnectionSettings settings;
    private RabbitConnection connection;

    @Before
    public void setup() {
        transport = new InMemoryTransport();
        settings = new ConnectionSettings.Builder()
                .withChannelCloseTimeoutMillis(500)
                .withConsumerDrainTimeoutMillis(200)
                .withConsumerCancelTimeoutMillis(300)
                .build();
        connection = RabbitConnection.open(address, settings, transport);
    }

    @After
    public void teardown() {
        transport.releaseAll();
        connection.close().await(5, TimeUnit.SECONDS);
    }

    private InMemoryChannel lastTransportChannel() {
        return transport.lastConnection().lastChannel();
    }

    @Test
    public void publishes_persistent_messages_with_headers() {
        RabbitChannel channel = connection.openChannel(false);

        channel.publish("events", "created", body, ImmutableMap.of("source", "test")).await();

        List<InMemoryTransport.PublishedMessage> published = transport.getPublished();
        assertThat(published, hasSize(1));
        assertThat(published.get(0).exchange, is("events"));
        assertThat(published.get(0).routingKey, is("created"));
        assertThat(published.get(0).properties.getDeliveryMode(), is(2));
        assertThat(published.get(0).header("source"), is("test"));
    }

    @Test
    public void confirm_mode_publish_completes_on_broker_confirm() throws Exception {
        transport.holdConfirms();
        RabbitChannel channel = connection.openChannel(true);
        AtomicBoolean confirmed = new AtomicBoolean(false);

        channel.publish("events", "created", body, null).subscribe(() -> confirmed.set(true));
        await().atMost(2, TimeUnit.SECONDS).until(() -> lastTransportChannel().unconfirmedCount() == 1);
        Thread.sleep(100);
        assertFalse(confirmed.get());

        lastTransportChannel().confirmAll();
        await().atMost(2, TimeUnit.SECONDS).untilTrue(confirmed);
    }

    @Test
    public void broker_nack_fails_the_publish() {
        transport.holdConfirms();
        RabbitChannel channel = connection.openChannel(true);
        AtomicReference<Throwable> error = new AtomicReference<>();

        channel.publish("events", "created", body, null).subscribe(() -> {}, error::set);
        await().atMost(2, TimeUnit.SECONDS).until(() -> lastTransportChannel().unconfirmedCount() == 1);
        lastTransportChannel().nackAll();

        await().atMost(2, TimeUnit.SECONDS).until(() -> error.get() != null);
        assertThat(error.get(), instanceOf(ChannelException.class));
    }

    @Test
    public void channel_error_during_publish_fails_the_publish_and_removes_the_observer() {
        transport.holdConfirms();
        RabbitChannel channel = connection.openChannel(true);
        int listenersBefore = lastTransportChannel().listenerCount();
        AtomicReference<Throwable> error = new AtomicReference<>();

        channel.publish("events", "created", body, null).subscribe(() -> {}, error::set);
        await().atMost(2, TimeUnit.SECONDS).until(() -> lastTransportChannel().unconfirmedCount() == 1);
        lastTransportChannel().emitError(new IOException("PRECONDITION_FAILED - unknown exchange"));

        await().atMost(2, TimeUnit.SECONDS).until(() -> error.get() != null);
        assertThat(error.get(), instanceOf(ChannelException.class));
        assertThat(error.get().getMessage(), is("Channel failed during publish"));
        await().atMost(2, TimeUnit.SECONDS).until(() -> lastTransportChannel().listenerCount() == listenersBefore);
        assertThat(channel.completion().get(2, TimeUnit.SECONDS), instanceOf(ChannelException.class));
    }

    @Test
    public void publish_on_a_closed_channel_fails() {
        RabbitChannel channel = connection.openChannel(false);
        channel.close().await();

        Throwable error = channel.publish("events", "created", body, null).get();

        assertThat(error, instanceOf(ChannelException.class));
        assertThat(transport.getPublished(), hasSize(0));
    }

    @Test
    public void close_gives_up_after_the_deadline_when_the_transport_never_closes() {
        RabbitChannel channel = connection.openChannel(false);
        transport.hold("channel.close");

        long start = System.currentTimeMillis();
        assertTrue(channel.close().await(5, TimeUnit.SECONDS));
        long elapsed = System.currentTimeMillis() - start;

        assertThat(elapsed, greaterThanOrEqualTo(settings.channel_close_timeout_millis - 50));
        assertThat(elapsed, lessThan(settings.channel_close_timeout_millis + 1_000));
        assertThat(channel.completion().get(), instanceOf(ChannelCloseTimeoutException.class));
        assertTrue(lastTransportChannel().isOpen());
    }

    @Test
    public void close_waits_for_outstanding_confirms_before_closing() throws Exception {
        transport.holdConfirms();
        RabbitChannel channel = connection.openChannel(true);
        String name = lastTransportChannel().getName();
        channel.publish("events", "created", body, null).subscribe(() -> {}, e -> {});
        await().atMost(2, TimeUnit.SECONDS).until(() -> lastTransportChannel().unconfirmedCount() == 1);

        Completable closed = channel.close();
        await().atMost(2, TimeUnit.SECONDS).until(() -> transport.getEvents().contains(name + ".waitForConfirms"));
        Thread.sleep(100);
        assertFalse(transport.getEvents().contains(name + ".close"));

        lastTransportChannel().confirmAll();
        assertTrue(closed.await(2, TimeUnit.SECONDS));
        assertThat(transport.indexOf(name + ".waitForConfirms"), lessThan(transport.indexOf(name + ".close")));
        assertThat(channel.completion().get(), is(nullValue()));
    }

    @Test
    public void concurrent_closes_settle_once() {
        RabbitChannel channel = connection.openChannel(false);
        String closeEvent = lastTransportChannel().getName() + ".close";

        List<Completable> closes = IntStream.range(0, 10)
                .parallel()
                .mapToObj(i -> channel.close())
                .collect(Collectors.toList());

        assertTrue(Completable.merge(closes).await(5, TimeUnit.SECONDS));
        assertThat(Collections.frequency(transport.getEvents(), closeEvent), is(1));
        assertTrue(connection.isOpen());
    }

    @Test
    public void peer_close_settles_with_channel_closed_exception() {
        RabbitChannel channel = connection.openChannel(false);

        lastTransportChannel().emitClose();

        Throwable reason = channel.completion().get(2, TimeUnit.SECONDS);
        assertThat(reason, instanceOf(ChannelClosedException.class));
        assertFalse(((ChannelClosedException) reason).hadError());
        assertTrue(connection.isOpen());
    }

    @Test
    public void prefetch_is_forwarded_to_the_transport() {
        RabbitChannel channel = connection.openChannel(false);

        channel.prefetch(25).await();

        assertThat(lastTransportChannel().getPrefetchCount(), is(25));
    }

    @Test
    public void consumer_tags_use_the_configured_prefix() {
        transport.declareQueue("work");
        RabbitChannel channel = connection.openChannel(false);

        RabbitConsumer prefixed = channel.consume("work", ackingHandler, new ConsumerSettings().withConsumerTagPrefix("indexer"))
                .toBlocking().value();
        RabbitConsumer brokerNamed = channel.consume("work", ackingHandler, new ConsumerSettings())
                .toBlocking().value();

        assertThat(prefixed.getConsumerTag(), startsWith("indexer-"));
        assertThat(brokerNamed.getConsumerTag(), startsWith("amq.ctag-"));
        assertThat(channel.getConsumers(), hasSize(2));
        assertThat(prefixed.getState(), is(ConsumerState.OPEN));
    }

    @Test
    public void consume_failure_is_a_consumer_exception() {
        RabbitChannel channel = connection.openChannel(false);

        Throwable error = channel.consume("missing", ackingHandler, new ConsumerSettings())
                .toCompletable().get();

        assertThat(error, instanceOf(ConsumerException.class));
        assertThat(channel.getConsumers(), hasSize(0));
        assertTrue(channel.isOpen());
    }

    @Test
    public void consumer_started_while_the_channel_closes_is_closed_too() {
        RabbitChannel channel = connection.openChannel(false);
        transport.declareQueue("work");
        transport.hold("channel.basicConsume");
        AtomicReference<Throwable> consumeError = new AtomicReference<>();
        channel.consume("work", ackingHandler, new ConsumerSettings())
                .subscribe(consumer -> fail("consumer started on a closing channel"), consumeError::set);
        String consumeEvent = lastTransportChannel().getName() + ".basicConsume:work";
        await().atMost(2, TimeUnit.SECONDS).until(() -> transport.getEvents().contains(consumeEvent));

        assertTrue(channel.close().await(5, TimeUnit.SECONDS));
        transport.release("channel.basicConsume");

        await().atMost(2, TimeUnit.SECONDS).until(() -> consumeError.get() != null);
        assertThat(consumeError.get(), instanceOf(ConsumerException.class));
        assertThat(channel.getConsumers(), hasSize(1));
        RabbitConsumer straggler = channel.getConsumers().get(0);
        assertThat(straggler.getState(), is(ConsumerState.CLOSED));
        assertThat(straggler.completion().get(), instanceOf(ConsumerException.class));
    }

    @Test
    public void rpc_reply_queue_is_deleted_once_when_the_consumer_is_cancelled() {
        RabbitChannel channel = connection.openChannel(false);

        RabbitConsumer consumer = channel.handleRpc("rpc", "", "replies", ackingHandler).toBlocking().value();
        String queue = consumer.getQueue();
        assertThat(queue, startsWith("amq.gen-"));
        assertTrue(transport.queueExists(queue));

        consumer.cancel().await();
        await().atMost(2, TimeUnit.SECONDS).until(() -> transport.deleteCount(queue) == 1);

        channel.close().await();
        assertThat(transport.deleteCount(queue), is(1));
        assertFalse(transport.queueExists(queue));
    }

    @Test
    public void channel_close_deletes_reply_queues_before_closing_the_transport_channel() {
        RabbitChannel channel = connection.openChannel(false);
        RabbitConsumer consumer = channel.handleRpc("rpc", "", "replies", ackingHandler).toBlocking().value();
        String queue = consumer.getQueue();
        String name = lastTransportChannel().getName();

        assertTrue(channel.close().await(5, TimeUnit.SECONDS));

        assertThat(transport.deleteCount(queue), is(1));
        int deleted = transport.indexOf(name + ".queueDelete:" + queue);
        assertThat(deleted, greaterThanOrEqualTo(0));
        assertThat(deleted, lessThan(transport.indexOf(name + ".close")));
        assertThat(channel.completion().get(), is(nullValue()));
    }

    @Test
    public void rpc_reply_queue_is_deleted_once_when_the_consumer_fails() throws Exception {
        RabbitChannel channel = connection.openChannel(false);
        AtomicInteger handled = new AtomicInteger();
        RabbitConsumer consumer = channel.handleRpc("rpc", "client-replies", "replies",
                message -> Completable.defer(() -> {
                    handled.incrementAndGet();
                    return Completable.error(new IllegalStateException("cannot parse reply"));
                }))
                .toBlocking().value();

        channel.publish("rpc", "replies", body, null).await();

        assertThat(consumer.completion().get(2, TimeUnit.SECONDS), instanceOf(IllegalStateException.class));
        await().atMost(2, TimeUnit.SECONDS).until(() -> transport.deleteCount("client-replies") == 1);
        assertThat(handled.get(), is(1));

        connection.close().await();
        assertThat(transport.deleteCount("client-replies"), is(1));
    }

    @Test
    public void rpc_reply_queue_is_rolled_back_when_binding_fails() {
        RabbitChannel channel = connection.openChannel(false);
        transport.failOn("channel.queueBind", new IOException("NOT_FOUND - no exchange 'rpc'"));

        Throwable error = channel.handleRpc("rpc", "client-replies", "replies", ackingHandler).toCompletable().get();

        assertThat(error, instanceOf(ChannelException.class));
        assertThat(transport.deleteCount("client-replies"), is(1));
        assertFalse(transport.queueExists("client-replies"));
    }

    @Test
    public void rpc_reply_queue_is_rolled_back_when_declaration_fails() {
        RabbitChannel channel = connection.openChannel(false);
        transport.failOn("channel.queueDeclare", new IOException("RESOURCE_LOCKED"));

        Throwable error = channel.handleRpc("rpc", "client-replies", "replies", ackingHandler).toCompletable().get();

        assertThat(error, instanceOf(ChannelException.class));
        assertThat(transport.deleteCount("client-replies"), is(1));
    }

    @Test
    public void rpc_reply_queue_is_rolled_back_when_the_consumer_cannot_start() {
        RabbitChannel channel = connection.openChannel(false);
        transport.failOn("channel.basicConsume", new IOException("ACCESS_REFUSED"));

        Throwable error = channel.handleRpc("rpc", "client-replies", "replies", ackingHandler).toCompletable().get();

        assertThat(error, instanceOf(ConsumerException.class));
        assertThat(transport.deleteCount("client-replies"), is(1));
        assertThat(channel.getConsumers(), hasSize(0));
    }

    @Test
    public void rpc_replies_reach_the_handler() {
        RabbitChannel channel = connection.openChannel(true);
        AtomicReference<String> reply = new AtomicReference<>();
        channel.handleRpc("rpc", "", "replies", message -> Completable.fromAction(() -> {
            reply.set(message.getBodyAsString());
            message.ack();
        })).toBlocking().value();

        channel.publish("rpc", "replies", body, null).await();

        await().atMost(2, TimeUnit.SECONDS).until(() -> "hello".equals(reply.get()));
        assertThat(lastTransportChannel().getAcks(), hasSize(1));
    }
}
