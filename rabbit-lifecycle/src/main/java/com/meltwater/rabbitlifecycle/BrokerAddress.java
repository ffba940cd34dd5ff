package com.meltwater.rabbitlifecycle;

import com.rabbitmq.client.ConnectionFactory;

import java.net.URISyntaxException;
import java.security.KeyManagementException;
import java.security.NoSuchAlgorithmException;

import static com.rabbitmq.client.ConnectionFactory.USE_DEFAULT_PORT;

/**
 * The address and credentials of a broker, as given by an AMQP URI.
 *
 * @see <a href="https://www.rabbitmq.com/uri-spec.html">AMQP URI spec</a>
 */
public class BrokerAddress {

    public final String username;
    public final String password;
    public final String virtualHost;
    public final String host;
    public final int port;

    private BrokerAddress(String username, String password, String virtualHost, String host, int port) {
        this.username = username;
        this.password = password;
        this.virtualHost = virtualHost;
        this.host = host;
        this.port = port;
    }

    /**
     * Parses an amqp or amqps URI, the parts it leaves out get the client defaults.
     *
     * @throws IllegalArgumentException if the string is not a valid amqp or amqps URI
     */
    public static BrokerAddress fromUri(String amqpUri) {
        ConnectionFactory parsed = new ConnectionFactory();
        try {
            parsed.setUri(amqpUri);
        } catch (URISyntaxException | NoSuchAlgorithmException | KeyManagementException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid broker uri: " + amqpUri, e);
        }
        return new BrokerAddress(parsed.getUsername(), parsed.getPassword(), parsed.getVirtualHost(), parsed.getHost(), parsed.getPort());
    }

    @Override
    public String toString() {
        return "amqp://" + host + ":" + (port == USE_DEFAULT_PORT ? ConnectionFactory.DEFAULT_AMQP_PORT : port) + "/" + (virtualHost.equals("/") ? "" : virtualHost);
    }
}
