package com.meltwater.rabbitlifecycle;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import com.meltwater.rabbitlifecycle.util.Logger;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * This class contains the settings of a {@link RabbitConnection} and everything it owns. Some settings are used to
 * configure the {@link com.rabbitmq.client.ConnectionFactory}, the rest are the deadlines of the graceful shutdown of
 * connections, channels and consumers.
 *
 * This object can be built programmatically by using the various {@link ConnectionSettings.Builder}
 * withXX methods or by supplying a JSON formatted String to the {@link ConnectionSettings.Builder#Builder(String)} constructor.
 *
 * The available JSON parameter names are included as String constants and directly correspond to the names of the
 * fields in this class. The {@link #toString()} method shows the JSON representation of this class and can be used
 * as input to the builder.
 *
 * @see <a href="https://www.rabbitmq.com/uri-query-parameters.html">AMQP uri-query-parameters</a>
 */
public class ConnectionSettings {

    private final static Logger log = new Logger(ConnectionSettings.class);
    private final static ObjectMapper mapper = new ObjectMapper()
            .configure(JsonParser.Feature.ALLOW_UNQUOTED_FIELD_NAMES, true)
            .configure(JsonParser.Feature.STRICT_DUPLICATE_DETECTION, true);

    public static final int DEFAULT_HEARTBEAT                           = 10;
    public static final int DEFAULT_CONNECTION_TIMEOUT_MILLIS           = 30_000;
    public static final int DEFAULT_HANDSHAKE_TIMEOUT_MILLIS            = 10_000;
    public static final int DEFAULT_SHUTDOWN_TIMEOUT_MILLIS             = 10_000;
    public static final int DEFAULT_FRAME_MAX                           = 0; //no limit
    public static final long DEFAULT_CONNECTION_CLOSE_TIMEOUT_MILLIS    = 10_000;
    public static final long DEFAULT_CHANNEL_CLOSE_TIMEOUT_MILLIS       = 5_000;
    public static final long DEFAULT_CONSUMER_DRAIN_TIMEOUT_MILLIS      = 2_000;
    public static final long DEFAULT_CONSUMER_CANCEL_TIMEOUT_MILLIS     = 3_000;
    public static final String DEFAULT_APP_ID                           = "unknown";

    public final static String heartbeat_param                          = "heartbeat";
    public final static String connection_timeout_millis_param          = "connection_timeout_millis";
    public final static String handshake_timeout_millis_param           = "handshake_timeout_millis";
    public final static String shutdown_timeout_millis_param            = "shutdown_timeout_millis";
    public final static String frame_max_param                          = "frame_max";
    public final static String connection_close_timeout_millis_param    = "connection_close_timeout_millis";
    public final static String channel_close_timeout_millis_param       = "channel_close_timeout_millis";
    public final static String consumer_drain_timeout_millis_param      = "consumer_drain_timeout_millis";
    public final static String consumer_cancel_timeout_millis_param     = "consumer_cancel_timeout_millis";
    public final static String app_id_param                             = "app_id";
    public final static String client_properties_param                  = "client_properties";

    public final int heartbeat; //in seconds
    public final int connection_timeout_millis;
    public final int handshake_timeout_millis;
    public final int shutdown_timeout_millis;
    public final int frame_max;
    public final long connection_close_timeout_millis;
    public final long channel_close_timeout_millis;
    public final long consumer_drain_timeout_millis;
    public final long consumer_cancel_timeout_millis;
    public final String app_id;
    public final Map<String, String> client_properties;

    private ConnectionSettings(Builder builder) {
        this.heartbeat = builder.heartbeat;
        this.connection_timeout_millis = builder.connectionTimeout;
        this.handshake_timeout_millis = builder.handshakeTimeout;
        this.shutdown_timeout_millis = builder.shutdownTimeout;
        this.frame_max = builder.frameMax;
        this.connection_close_timeout_millis = builder.connectionCloseTimeout;
        this.channel_close_timeout_millis = builder.channelCloseTimeout;
        this.consumer_drain_timeout_millis = builder.consumerDrainTimeout;
        this.consumer_cancel_timeout_millis = builder.consumerCancelTimeout;
        this.app_id = builder.appId;
        this.client_properties = ImmutableMap.copyOf(builder.clientProperties);
    }

    public static ConnectionSettings defaults() {
        return new Builder().build();
    }

    @Override
    public String toString() {
        try {
            return mapper.writeValueAsString(this);
        } catch (IOException e) {
            return e.toString();
        }
    }

    public static class Builder {

        private int heartbeat;
        private int connectionTimeout;
        private int handshakeTimeout;
        private int shutdownTimeout;
        private int frameMax;
        private long connectionCloseTimeout;
        private long channelCloseTimeout;
        private long consumerDrainTimeout;
        private long consumerCancelTimeout;
        private String appId;
        private Map<String, String> clientProperties;

        public Builder() {
            setDefaults(new HashMap<>());
        }

        /**
         * Fills in the values supplied in the JSON formatted string, the rest get their default values.
         * Field names do not have to be quoted and the surrounding braces can be left out.
         *
         * @throws IllegalArgumentException if the string can not be parsed
         */
        public Builder(String settingsJSONString) {
            String json = settingsJSONString.trim();
            if (!json.startsWith("{")) {
                json = "{" + json + "}";
            }
            try {
                setDefaults(mapper.readValue(json, new TypeReference<Map<String, Object>>() {}));
            } catch (IOException | ClassCastException | IllegalArgumentException e) {
                log.errorWithParams("Could not parse settings string.", e, "settings", settingsJSONString);
                throw new IllegalArgumentException("Could not parse connection settings: " + settingsJSONString, e);
            }
        }

        private void setDefaults(Map<String, Object> map) {
            heartbeat = intValue(map, heartbeat_param, DEFAULT_HEARTBEAT);
            connectionTimeout = intValue(map, connection_timeout_millis_param, DEFAULT_CONNECTION_TIMEOUT_MILLIS);
            handshakeTimeout = intValue(map, handshake_timeout_millis_param, DEFAULT_HANDSHAKE_TIMEOUT_MILLIS);
            shutdownTimeout = intValue(map, shutdown_timeout_millis_param, DEFAULT_SHUTDOWN_TIMEOUT_MILLIS);
            frameMax = intValue(map, frame_max_param, DEFAULT_FRAME_MAX);
            connectionCloseTimeout = longValue(map, connection_close_timeout_millis_param, DEFAULT_CONNECTION_CLOSE_TIMEOUT_MILLIS);
            channelCloseTimeout = longValue(map, channel_close_timeout_millis_param, DEFAULT_CHANNEL_CLOSE_TIMEOUT_MILLIS);
            consumerDrainTimeout = longValue(map, consumer_drain_timeout_millis_param, DEFAULT_CONSUMER_DRAIN_TIMEOUT_MILLIS);
            consumerCancelTimeout = longValue(map, consumer_cancel_timeout_millis_param, DEFAULT_CONSUMER_CANCEL_TIMEOUT_MILLIS);
            appId = (String) map.getOrDefault(app_id_param, DEFAULT_APP_ID);
            clientProperties = new HashMap<>(mapper.convertValue(map.getOrDefault(client_properties_param, new HashMap<>()),
                    new TypeReference<Map<String, String>>() {}));
        }

        private static int intValue(Map<String, Object> map, String param, int defaultValue) {
            return ((Number) map.getOrDefault(param, defaultValue)).intValue();
        }

        private static long longValue(Map<String, Object> map, String param, long defaultValue) {
            return ((Number) map.getOrDefault(param, defaultValue)).longValue();
        }

        /**
         * @throws IllegalArgumentException if any of the values is out of range
         */
        public ConnectionSettings build() {
            checkArgument(heartbeat >= 0, "heartbeat must be >= 0 but was %s", heartbeat);
            checkArgument(connectionTimeout >= 0, "connection_timeout_millis must be >= 0 but was %s", connectionTimeout);
            checkArgument(handshakeTimeout >= 0, "handshake_timeout_millis must be >= 0 but was %s", handshakeTimeout);
            checkArgument(shutdownTimeout >= 0, "shutdown_timeout_millis must be >= 0 but was %s", shutdownTimeout);
            checkArgument(frameMax >= 0, "frame_max must be >= 0 but was %s", frameMax);
            checkArgument(connectionCloseTimeout > 0, "connection_close_timeout_millis must be > 0 but was %s", connectionCloseTimeout);
            checkArgument(channelCloseTimeout > 0, "channel_close_timeout_millis must be > 0 but was %s", channelCloseTimeout);
            checkArgument(consumerDrainTimeout > 0, "consumer_drain_timeout_millis must be > 0 but was %s", consumerDrainTimeout);
            checkArgument(consumerCancelTimeout > 0, "consumer_cancel_timeout_millis must be > 0 but was %s", consumerCancelTimeout);
            checkNotNull(appId, "app_id");
            return new ConnectionSettings(this);
        }

        public Builder withHeartbeatSecs(int heartbeat) {
            this.heartbeat = heartbeat;
            return this;
        }

        public Builder withConnectionTimeoutMillis(int connectionTimeout) {
            this.connectionTimeout = connectionTimeout;
            return this;
        }

        public Builder withHandshakeTimeoutMillis(int handshakeTimeout) {
            this.handshakeTimeout = handshakeTimeout;
            return this;
        }

        public Builder withShutdownTimeoutMillis(int shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public Builder withFrameMax(int frameMax) {
            this.frameMax = frameMax;
            return this;
        }

        public Builder withConnectionCloseTimeoutMillis(long connectionCloseTimeout) {
            this.connectionCloseTimeout = connectionCloseTimeout;
            return this;
        }

        public Builder withChannelCloseTimeoutMillis(long channelCloseTimeout) {
            this.channelCloseTimeout = channelCloseTimeout;
            return this;
        }

        public Builder withConsumerDrainTimeoutMillis(long consumerDrainTimeout) {
            this.consumerDrainTimeout = consumerDrainTimeout;
            return this;
        }

        public Builder withConsumerCancelTimeoutMillis(long consumerCancelTimeout) {
            this.consumerCancelTimeout = consumerCancelTimeout;
            return this;
        }

        public Builder withAppId(String appId) {
            this.appId = appId;
            return this;
        }

        public Builder withClientProperty(String key, String value) {
            this.clientProperties.put(key, value);
            return this;
        }
    }
}
