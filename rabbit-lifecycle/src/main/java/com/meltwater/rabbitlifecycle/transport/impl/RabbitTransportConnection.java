package com.meltwater.rabbitlifecycle.transport.impl;

import com.meltwater.rabbitlifecycle.transport.TransportChannel;
import com.meltwater.rabbitlifecycle.transport.TransportConnection;
import com.meltwater.rabbitlifecycle.transport.TransportListener;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

public class RabbitTransportConnection implements TransportConnection {

    private final Connection connection;
    private final TransportListeners listeners;

    RabbitTransportConnection(Connection connection) {
        this.connection = connection;
        this.listeners = new TransportListeners(connection.getClientProvidedName());
        connection.addShutdownListener(listeners);
    }

    @Override
    public TransportChannel createChannel() throws IOException {
        return new RabbitTransportChannel(newChannel(), false);
    }

    @Override
    public TransportChannel createConfirmChannel() throws IOException {
        return new RabbitTransportChannel(newChannel(), true);
    }

    private Channel newChannel() throws IOException {
        Channel channel = connection.createChannel();
        if (channel == null) {
            throw new IOException("No channel available on connection " + connection.getClientProvidedName());
        }
        return channel;
    }

    @Override
    public void close() throws IOException {
        connection.close();
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
        return connection.isOpen();
    }

    @Override
    public String toString() {
        return "RabbitTransportConnection{" + connection.getClientProvidedName() + '}';
    }
}
