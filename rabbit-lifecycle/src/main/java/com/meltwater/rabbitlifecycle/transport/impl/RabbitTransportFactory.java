package com.meltwater.rabbitlifecycle.transport.impl;

import com.meltwater.rabbitlifecycle.BrokerAddress;
import com.meltwater.rabbitlifecycle.ConnectionSettings;
import com.meltwater.rabbitlifecycle.transport.TransportConnection;
import com.meltwater.rabbitlifecycle.transport.TransportFactory;
import com.meltwater.rabbitlifecycle.util.Logger;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import org.joda.time.DateTime;
import org.joda.time.DateTimeZone;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Opens connections with the amqp-client. Automatic recovery is disabled, the lifecycle of the connection is
 * owned by {@link com.meltwater.rabbitlifecycle.RabbitConnection}.
 */
public class RabbitTransportFactory implements TransportFactory {

    private static final Logger log = new Logger(RabbitTransportFactory.class);

    private final static AtomicInteger connectionCount = new AtomicInteger();

    @Override
    public TransportConnection connect(BrokerAddress address, ConnectionSettings settings) throws IOException, TimeoutException {
        String connectionName = settings.app_id + "-" + connectionCount.incrementAndGet();
        DateTime startTime = new DateTime(DateTimeZone.UTC);

        ConnectionFactory cf = new ConnectionFactory();
        Map<String, Object> clientProperties = new HashMap<>(cf.getClientProperties());
        clientProperties.putAll(settings.client_properties);
        clientProperties.put("app_id", settings.app_id);
        clientProperties.put("name", connectionName);
        clientProperties.put("connect_time", startTime.toString());

        cf.setPassword(address.password);
        cf.setUsername(address.username);
        cf.setPort(address.port);
        cf.setHost(address.host);
        cf.setVirtualHost(address.virtualHost);
        cf.setRequestedHeartbeat(settings.heartbeat);
        cf.setConnectionTimeout(settings.connection_timeout_millis);
        cf.setShutdownTimeout(settings.shutdown_timeout_millis);
        cf.setRequestedFrameMax(settings.frame_max);
        cf.setHandshakeTimeout(settings.handshake_timeout_millis);
        cf.setClientProperties(clientProperties);
        cf.setRequestedChannelMax(0);//Hard coded ..
        cf.setAutomaticRecoveryEnabled(false);//Hard coded ..
        cf.setTopologyRecoveryEnabled(false);//Hard coded ..

        Connection connection = cf.newConnection(connectionName);
        log.infoWithParams("Successfully opened connection.",
                "address", address,
                "name", connectionName,
                "connectTime", startTime);
        return new RabbitTransportConnection(connection);
    }
}
