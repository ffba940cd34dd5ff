package com.meltwater.rabbitlifecycle;

import com.meltwater.rabbitlifecycle.exception.ConnectionCloseTimeoutException;
import com.meltwater.rabbitlifecycle.exception.ConnectionClosedException;
import com.meltwater.rabbitlifecycle.exception.ConnectionException;
import com.meltwater.rabbitlifecycle.transport.TransportChannel;
import com.meltwater.rabbitlifecycle.transport.TransportConnection;
import com.meltwater.rabbitlifecycle.transport.TransportFactory;
import com.meltwater.rabbitlifecycle.transport.TransportListener;
import com.meltwater.rabbitlifecycle.transport.impl.RabbitTransportFactory;
import com.meltwater.rabbitlifecycle.util.Logger;
import rx.Completable;
import rx.Scheduler;
import rx.Subscription;
import rx.schedulers.Schedulers;

import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * The root of the connection, channel and consumer hierarchy.
 *
 * Closing a connection first closes all its channels concurrently (which in turn cancel their consumers) and only
 * when they are all done closes the underlying transport connection. The close is bounded by
 * {@link ConnectionSettings#connection_close_timeout_millis}.
 *
 * If the broker or the network closes the connection it is closed the same way, and the {@link #completion()}
 * errors with a {@link ConnectionClosedException} or a {@link ConnectionException}.
 */
public class RabbitConnection extends LifecycleResource {

    private static final Logger log = new Logger(RabbitConnection.class);

    private final BrokerAddress address;
    private final ConnectionSettings settings;
    private final TransportConnection transport;
    private final List<RabbitChannel> channels = new CopyOnWriteArrayList<>();

    private RabbitConnection(BrokerAddress address,
                             ConnectionSettings settings,
                             TransportConnection transport,
                             Scheduler ioScheduler,
                             Scheduler timerScheduler) {
        super(ioScheduler, timerScheduler);
        this.address = address;
        this.settings = settings;
        this.transport = transport;
    }

    /**
     * Connects to the broker using the amqp-client.
     *
     * @throws ConnectionException if the connection could not be established
     */
    public static RabbitConnection open(BrokerAddress address, ConnectionSettings settings) {
        return open(address, settings, new RabbitTransportFactory());
    }

    /**
     * @throws ConnectionException if the connection could not be established
     */
    public static RabbitConnection open(BrokerAddress address, ConnectionSettings settings, TransportFactory transportFactory) {
        return open(address, settings, transportFactory, Schedulers.io(), Schedulers.computation());
    }

    /**
     * @param ioScheduler the scheduler that blocking transport calls and message handlers run on
     * @param timerScheduler the scheduler that deadlines run on
     * @throws ConnectionException if the connection could not be established
     */
    public static RabbitConnection open(BrokerAddress address,
                                        ConnectionSettings settings,
                                        TransportFactory transportFactory,
                                        Scheduler ioScheduler,
                                        Scheduler timerScheduler) {
        final TransportConnection transport;
        try {
            transport = transportFactory.connect(address, settings);
        } catch (IOException | TimeoutException | RuntimeException e) {
            log.errorWithParams("Could not connect to the broker.", e,
                    "address", address);
            throw new ConnectionException("Could not connect to " + address, e);
        }
        RabbitConnection connection = new RabbitConnection(address, settings, transport, ioScheduler, timerScheduler);
        transport.addListener(connection.new TransportEvents());
        log.infoWithParams("Connected to the broker.",
                "address", address,
                "appId", settings.app_id);
        return connection;
    }

    /**
     * Opens a new channel on this connection.
     *
     * @param confirmMode true to enable publisher confirms on the channel
     * @throws ConnectionException if the connection is not open or the channel could not be created
     */
    public RabbitChannel openChannel(boolean confirmMode) {
        if (!isOpen()) {
            throw new ConnectionException("Cannot open a channel, the connection to " + address + " is not open");
        }
        final TransportChannel transportChannel;
        try {
            transportChannel = confirmMode ? transport.createConfirmChannel() : transport.createChannel();
        } catch (IOException | RuntimeException e) {
            throw new ConnectionException("Could not open a channel on " + address, e);
        }
        RabbitChannel channel = new RabbitChannel(this, transportChannel);
        channels.add(channel);
        log.infoWithParams("Successfully created channel.",
                "channelNr", transportChannel.getChannelNumber(),
                "confirmMode", confirmMode,
                "address", address);
        return channel;
    }

    public Completable close() {
        return close(null);
    }

    /**
     * Closes all channels and then the connection itself. The returned completable completes when the
     * connection is closed or the close deadline passed, it never errors.
     *
     * Only the first call does any work, later calls just wait for the same result.
     *
     * @param reason the failure that {@link #completion()} should error with, or null for a normal close
     */
    public Completable close(Throwable reason) {
        if (!beginDying()) {
            return completion.awaitQuietly();
        }
        log.infoWithParams("Closing connection.",
                "address", address,
                "channels", channels.size(),
                "reason", reason == null ? null : reason.getMessage());
        long timeout = settings.connection_close_timeout_millis;
        Subscription deadline = armDeadline(timeout, () -> new ConnectionCloseTimeoutException(timeout));
        List<Completable> channelCloses = channels.stream()
                .map(channel -> channel.close(reason))
                .collect(Collectors.toList());
        Completable.merge(channelCloses)
                .andThen(bestEffort("close the transport connection", () -> {
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

    private class TransportEvents implements TransportListener {

        @Override
        public void onError(Throwable error) {
            ConnectionException wrapped = new ConnectionException("Connection to " + address + " failed", error);
            log.errorWithParams("Connection error reported by the transport.", error,
                    "address", address);
            close(wrapped);
            completion.fail(wrapped);
        }

        @Override
        public void onClose(boolean hadError) {
            if (isDying()) {
                return;
            }
            ConnectionClosedException closed = new ConnectionClosedException(hadError);
            log.warnWithParams("Connection closed by peer.",
                    "address", address,
                    "hadError", hadError);
            close(closed);
            completion.fail(closed);
        }
    }

    ConnectionSettings getSettings() {
        return settings;
    }

    Scheduler ioScheduler() {
        return ioScheduler;
    }

    Scheduler timerScheduler() {
        return timerScheduler;
    }

    public List<RabbitChannel> getChannels() {
        return Collections.unmodifiableList(channels);
    }

    public BrokerAddress getAddress() {
        return address;
    }

    @Override
    public String toString() {
        return "RabbitConnection{" + address + '}';
    }
}
