package com.meltwater.rabbitlifecycle.transport;

import com.meltwater.rabbitlifecycle.BrokerAddress;
import com.meltwater.rabbitlifecycle.ConnectionSettings;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Opens connections to a broker.
 *
 * @see com.meltwater.rabbitlifecycle.transport.impl.RabbitTransportFactory
 */
public interface TransportFactory {

    TransportConnection connect(BrokerAddress address, ConnectionSettings settings) throws IOException, TimeoutException;
}
