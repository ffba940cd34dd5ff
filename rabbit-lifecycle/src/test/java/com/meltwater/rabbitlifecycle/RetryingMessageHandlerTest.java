package com.meltwater.rabbitlifecycle;

import com.meltwater.rabbitlifecycle.transport.memory.InMemoryChannel;
import com.meltwater.rabbitlifecycle.transport.memory.InMemoryTransport;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.Timeout;
import rx.Completable;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static com.jayway.awaitility.Awaitility.await;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.is;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThat;

public class RetryingMessageHandlerTest {

    @Rule
    public Timeout globalTimeout = new Timeout(30_000, TimeUnit.MILLISECONDS);

    private static final BrokerAddress address = BrokerAddress.fromUri("amqp://localhost");
    private static final byte[] body = "flaky".getBytes(StandardCharsets.UTF_8);

    private InMemoryTransport transport;
    private RabbitConnection connection;
    private RabbitChannel channel;

    @Before
    public void setup() {
        transport = new InMemoryTransport();
        connection = RabbitConnection.open(address, ConnectionSettings.defaults(), transport);
        channel = connection.openChannel(true);
        transport.declareQueue("work");
    }

    @After
    public void teardown() {
        transport.releaseAll();
        connection.close().await(5, TimeUnit.SECONDS);
    }

    private InMemoryChannel transportChannel() {
        return transport.lastConnection().lastChannel();
    }

    @Test
    public void failing_message_is_redelivered_until_the_limit_then_dequeued() {
        List<Integer> seenCounts = new CopyOnWriteArrayList<>();
        MessageHandler alwaysFailing = message -> {
            seenCounts.add(message.getRedeliveredCount());
            return Completable.error(new IllegalStateException("downstream unavailable"));
        };
        RabbitConsumer consumer = channel.consume("work", new RetryingMessageHandler(alwaysFailing, 3), new ConsumerSettings())
                .toBlocking().value();

        transport.enqueue("work", null, body);

        await().atMost(5, TimeUnit.SECONDS).until(() ->
                transportChannel().getRejections().size() == 1 && transportChannel().getAcks().size() == 3);
        assertThat(seenCounts, is(Arrays.asList(0, 1, 2, 3)));

        List<Object> publishedCounts = transport.getPublished().stream()
                .map(published -> published.header(Message.REDELIVERED_COUNT_HEADER))
                .collect(Collectors.toList());
        assertThat(publishedCounts, is(Arrays.<Object>asList("1", "2", "3")));
        assertThat(transportChannel().getAcks(), hasSize(3));
        assertFalse(transportChannel().getRejections().get(0).requeue);
        assertThat(consumer.getState(), is(ConsumerState.OPEN));
    }

    @Test
    public void limit_is_taken_from_consumer_settings() {
        List<Integer> seenCounts = new CopyOnWriteArrayList<>();
        MessageHandler alwaysFailing = message -> {
            seenCounts.add(message.getRedeliveredCount());
            return Completable.error(new IllegalStateException("downstream unavailable"));
        };
        ConsumerSettings settings = new ConsumerSettings().withMaxRedeliveredCount(0);
        channel.consume("work", new RetryingMessageHandler(alwaysFailing, settings), settings).toBlocking().value();

        transport.enqueue("work", null, body);

        await().atMost(5, TimeUnit.SECONDS).until(() -> transportChannel().getRejections().size() == 1);
        assertThat(seenCounts, is(Arrays.asList(0)));
        assertThat(transport.getPublished(), hasSize(0));
        assertThat(transportChannel().getAcks(), hasSize(0));
    }

    @Test
    public void successful_handling_passes_through() {
        RabbitConsumer consumer = channel.consume("work",
                new RetryingMessageHandler(message -> Completable.fromAction(message::ack), 3), new ConsumerSettings())
                .toBlocking().value();

        transport.enqueue("work", null, body);

        await().atMost(2, TimeUnit.SECONDS).until(() -> transportChannel().getAcks().size() == 1);
        assertThat(transport.getPublished(), hasSize(0));
        assertThat(transportChannel().getRejections(), hasSize(0));
        assertThat(consumer.getState(), is(ConsumerState.OPEN));
    }
}
