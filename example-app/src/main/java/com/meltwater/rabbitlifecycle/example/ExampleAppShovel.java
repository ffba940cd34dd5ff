package com.meltwater.rabbitlifecycle.example;

import com.meltwater.rabbitlifecycle.BrokerAddress;
import com.meltwater.rabbitlifecycle.ConnectionSettings;
import com.meltwater.rabbitlifecycle.ConsumerSettings;
import com.meltwater.rabbitlifecycle.Message;
import com.meltwater.rabbitlifecycle.RabbitChannel;
import com.meltwater.rabbitlifecycle.RabbitConnection;
import com.meltwater.rabbitlifecycle.RabbitConsumer;
import com.meltwater.rabbitlifecycle.RetryingMessageHandler;
import com.meltwater.rabbitlifecycle.util.Logger;
import rx.Completable;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * An example app which moves every message of a queue to an exchange, retrying failed messages a bounded number
 * of times. Optionally it also listens on a server named reply queue bound to the output exchange.
 */
public class ExampleAppShovel {

    private static final Logger log = new Logger(ExampleAppShovel.class);

    public static void main(String[] args) throws IOException {
        Properties prop = new Properties();
        try (InputStream in = ExampleAppShovel.class.getResourceAsStream("/example_app.properties")) {
            prop.load(in);
        }
        prop.putAll(System.getProperties());

        RabbitConnection connection = RabbitConnection.open(
                BrokerAddress.fromUri(prop.getProperty("rabbit.broker.uri")),
                new ConnectionSettings.Builder(prop.getProperty("rabbit.connection.settings", "")).build());

        //Create and start the app
        final ExampleAppShovel exampleAppShovel = new ExampleAppShovel(
                connection,
                prop.getProperty("rabbit.input.queue"),
                prop.getProperty("rabbit.output.exchange"),
                prop.getProperty("rabbit.reply.routing.key"),
                Boolean.parseBoolean(prop.getProperty("rabbit.reply.queue.enabled", "false")),
                new ConsumerSettings()
                        .withPreFetchCount(Integer.parseInt(prop.getProperty("rabbit.prefetch.count")))
                        .withMaxRedeliveredCount(Integer.parseInt(prop.getProperty("rabbit.max.redelivered.count")))
                        .withConsumerTagPrefix("example-shovel"));

        exampleAppShovel.start();

        //On shutdown close the connection, which cancels the consumers and waits for the in flight messages
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.infoWithParams("Closing app ...");
            exampleAppShovel.stop().await();
        }));

        Throwable reason = connection.completion().get();
        if (reason != null) {
            log.errorWithParams("Connection closed with an error. Closing down application.", reason);
            System.exit(1);
        }
    }

    private final RabbitConnection connection;
    private final String inputQueue;
    private final String outputExchange;
    private final String replyRoutingKey;
    private final boolean replyQueueEnabled;
    private final ConsumerSettings consumerSettings;

    private volatile RabbitChannel publishChannel;
    private volatile RabbitConsumer shovel;
    private volatile RabbitConsumer replies;

    public ExampleAppShovel(RabbitConnection connection,
                            String inputQueue,
                            String outputExchange,
                            String replyRoutingKey,
                            boolean replyQueueEnabled,
                            ConsumerSettings consumerSettings) {
        this.connection = connection;
        this.inputQueue = inputQueue;
        this.outputExchange = outputExchange;
        this.replyRoutingKey = replyRoutingKey;
        this.replyQueueEnabled = replyQueueEnabled;
        this.consumerSettings = consumerSettings;
    }

    void start() {
        publishChannel = connection.openChannel(true);
        RabbitChannel consumeChannel = connection.openChannel(false);
        consumeChannel.prefetch(consumerSettings.getPre_fetch_count()).await();

        shovel = consumeChannel
                .consume(inputQueue, new RetryingMessageHandler(this::shovelMessage, consumerSettings), consumerSettings)
                .toBlocking().value();
        shovel.completion().subscribe(
                () -> log.infoWithParams("Shovel stopped.", "queue", inputQueue),
                e -> log.errorWithParams("Shovel failed.", e, "queue", inputQueue));

        if (replyQueueEnabled) {
            replies = connection.openChannel(false)
                    .handleRpc(outputExchange, "", replyRoutingKey, this::logReply)
                    .toBlocking().value();
        }
        log.infoWithParams("Example shovel started.",
                "inputQueue", inputQueue,
                "outputExchange", outputExchange,
                "replyQueue", replies == null ? null : replies.getQueue());
    }

    private Completable shovelMessage(Message message) {
        //change in logback.xml to DEBUG level to see every message payload logged
        log.debugWithParams("Received message.",
                "payload", message.getBodyAsString(),
                "redeliveredCount", message.getRedeliveredCount());
        return publishChannel.publish(outputExchange, message.getRoutingKey(), message.getBody(), message.getHeaders())
                .andThen(Completable.fromAction(message::ack));
    }

    private Completable logReply(Message message) {
        return Completable.fromAction(() -> {
            log.infoWithParams("Reply received.",
                    "routingKey", message.getRoutingKey(),
                    "payload", message.getBodyAsString());
            message.ack();
        });
    }

    Completable stop() {
        return connection.close();
    }

    RabbitConsumer getShovel() {
        return shovel;
    }

    RabbitConsumer getReplies() {
        return replies;
    }
}
