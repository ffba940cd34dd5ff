package com.meltwater.rabbitlifecycle.transport.memory;

import com.google.common.collect.ImmutableList;
import com.meltwater.rabbitlifecycle.transport.TransportChannel;
import com.meltwater.rabbitlifecycle.transport.TransportConnection;
import com.meltwater.rabbitlifecycle.transport.TransportListener;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

public class InMemoryConnection implements TransportConnection {

    private static final AtomicInteger channelCount = new AtomicInteger();

    private final InMemoryTransport transport;
    private final String name;
    private final List<TransportListener> listeners = new CopyOnWriteArrayList<>();
    private final List<InMemoryChannel> channels = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;

    InMemoryConnection(InMemoryTransport transport, String name) {
        this.transport = transport;
        this.name = name;
    }

    @Override
    public TransportChannel createChannel() throws IOException {
        return newChannel(false);
    }

    @Override
    public TransportChannel createConfirmChannel() throws IOException {
        return newChannel(true);
    }

    private InMemoryChannel newChannel(boolean confirmMode) throws IOException {
        transport.enter("connection.createChannel", name + ".createChannel");
        if (!open) {
            throw new IOException("connection is already closed");
        }
        InMemoryChannel channel = new InMemoryChannel(transport, channelCount.incrementAndGet(), confirmMode);
        channels.add(channel);
        return channel;
    }

    @Override
    public void close() throws IOException {
        transport.enter("connection.close", name + ".close");
        for (InMemoryChannel channel : channels) {
            channel.shutdown(null);
        }
        shutdown(null);
    }

    /**
     * Simulates the broker or the network failing the connection, all its channels fail with it.
     */
    public void emitError(Throwable error) {
        for (InMemoryChannel channel : channels) {
            channel.shutdown(error);
        }
        shutdown(error);
    }

    /**
     * Simulates the broker closing the connection without an error.
     */
    public void emitClose() {
        for (InMemoryChannel channel : channels) {
            channel.shutdown(null);
        }
        if (!open) {
            return;
        }
        open = false;
        for (TransportListener listener : listeners) {
            listener.onClose(false);
        }
    }

    private void shutdown(Throwable error) {
        if (!open) {
            return;
        }
        open = false;
        if (error != null) {
            for (TransportListener listener : listeners) {
                listener.onError(error);
            }
        }
        for (TransportListener listener : listeners) {
            listener.onClose(error != null);
        }
    }

    public List<InMemoryChannel> getChannels() {
        return ImmutableList.copyOf(channels);
    }

    public InMemoryChannel lastChannel() {
        return channels.get(channels.size() - 1);
    }

    public String getName() {
        return name;
    }

    @Override
    public void addListener(TransportListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(TransportListener listener) {
        listeners.remove(listener);
    }

    public int listenerCount() {
        return listeners.size();
    }

    @Override
    public boolean isOpen() {
        return open;
    }
}
