package hle.remote.config;

import hle.remote.client.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;

/**
 * Immutable description of one remote endpoint: address, wire protocol and
 * transport security.
 *
 * <p>Construction validates the descriptor, so a {@code ConnectionInfo} that
 * exists is always well formed:
 * <ul>
 *   <li>host is not blank</li>
 *   <li>port is within 1..65535</li>
 *   <li>protocol is set</li>
 *   <li>timeout, if set, is positive</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>{@code
 * ConnectionInfo info = ConnectionInfo.builder()
 *     .host("models.internal")
 *     .port(8085)
 *     .protocol(Protocol.GRPC)
 *     .tls(TlsConfig.builder().enabled(true).caFile(Paths.get("ca.pem")).build())
 *     .build();
 * }</pre>
 */
public final class ConnectionInfo {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionInfo.class);

    /** gRPC inbound message limit, in bytes. */
    public static final String OPTION_MAX_RECEIVE_MESSAGE_LENGTH = "max_receive_message_length";
    /** gRPC keepalive ping interval, in milliseconds. */
    public static final String OPTION_KEEPALIVE_TIME_MS = "keepalive_time_ms";

    private final String host;
    private final int port;
    private final Protocol protocol;
    private final TlsConfig tls;
    private final Duration timeout;
    private final Integer maxReceiveMessageLength;
    private final Long keepAliveTimeMs;

    private ConnectionInfo(Builder builder) {
        this.host = builder.host.trim();
        this.port = builder.port;
        this.protocol = builder.protocol;
        this.tls = builder.tls;
        this.timeout = builder.timeout;
        this.maxReceiveMessageLength = builder.maxReceiveMessageLength;
        this.keepAliveTimeMs = builder.keepAliveTimeMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parses a connection block such as:
     * <pre>{@code
     * {
     *   "hostname": "localhost",
     *   "port": 8085,
     *   "protocol": "grpc",
     *   "timeout": 30,
     *   "options": {"max_receive_message_length": 8388608},
     *   "tls": {"enabled": true, "ca_file": "ca.pem", "cert_file": "client.pem", "key_file": "client-key.pem"}
     * }
     * }</pre>
     *
     * <p>{@code host} is accepted as an alias of {@code hostname}. {@code timeout} is in seconds.
     * {@code protocol} defaults to grpc when absent.
     *
     * @throws ConfigurationException if the block is malformed
     */
    public static ConnectionInfo fromMap(Map<String, ?> connection) {
        if (connection == null) {
            throw new ConfigurationException("connection block is missing");
        }
        Builder builder = builder();

        Object host = connection.containsKey("hostname") ? connection.get("hostname") : connection.get("host");
        builder.host(host != null ? host.toString() : null);
        builder.port(toInt("port", connection.get("port")));

        Object protocol = connection.get("protocol");
        builder.protocol(protocol != null ? Protocol.fromName(protocol.toString()) : Protocol.GRPC);

        Object timeout = connection.get("timeout");
        if (timeout != null) {
            builder.timeout(Duration.ofMillis(Math.round(toDouble("timeout", timeout) * 1000)));
        }

        Object options = connection.get("options");
        if (options != null) {
            applyOptions(builder, asMap("options", options));
        }

        Object tls = connection.get("tls");
        if (tls != null) {
            builder.tls(parseTls(asMap("tls", tls)));
        }
        return builder.build();
    }

    private static void applyOptions(Builder builder, Map<?, ?> options) {
        for (Map.Entry<?, ?> option : options.entrySet()) {
            String name = String.valueOf(option.getKey());
            switch (name) {
                case OPTION_MAX_RECEIVE_MESSAGE_LENGTH:
                    builder.maxReceiveMessageLength(toInt(name, option.getValue()));
                    break;
                case OPTION_KEEPALIVE_TIME_MS:
                    builder.keepAliveTimeMs(toInt(name, option.getValue()));
                    break;
                default:
                    logger.warn("Ignoring unsupported connection option '{}'", name);
            }
        }
    }

    private static TlsConfig parseTls(Map<?, ?> tls) {
        TlsConfig.Builder builder = TlsConfig.builder()
                .enabled(toBoolean(tls.get("enabled")))
                .mutual(toBoolean(tls.get("mtls")))
                .insecureVerify(toBoolean(tls.get("insecure_verify")));
        toPath(tls.get("ca_file")).ifPresent(builder::caFile);
        toPath(tls.get("cert_file")).ifPresent(builder::certFile);
        toPath(tls.get("key_file")).ifPresent(builder::keyFile);
        return builder.build();
    }

    private static Map<?, ?> asMap(String key, Object value) {
        if (!(value instanceof Map)) {
            throw new ConfigurationException("'" + key + "' must be a mapping but was " + value.getClass().getSimpleName());
        }
        return (Map<?, ?>) value;
    }

    private static int toInt(String key, Object value) {
        if (value == null) {
            throw new ConfigurationException("'" + key + "' must be set");
        }
        if (value instanceof Number) {
            double number = ((Number) value).doubleValue();
            if (number != Math.rint(number) || number > Integer.MAX_VALUE || number < Integer.MIN_VALUE) {
                throw new ConfigurationException("'" + key + "' must be an integer but was " + value);
            }
            return (int) number;
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be an integer but was '" + value + "'", e);
        }
    }

    private static double toDouble(String key, Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("'" + key + "' must be a number but was '" + value + "'", e);
        }
    }

    private static boolean toBoolean(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString().trim());
    }

    private static Optional<Path> toPath(Object value) {
        if (value == null || value.toString().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(Paths.get(value.toString()));
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public Protocol getProtocol() {
        return protocol;
    }

    public TlsConfig getTls() {
        return tls;
    }

    /**
     * Per-call timeout. When absent the client default applies.
     */
    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    public OptionalInt getMaxReceiveMessageLength() {
        return maxReceiveMessageLength != null ? OptionalInt.of(maxReceiveMessageLength) : OptionalInt.empty();
    }

    public OptionalLong getKeepAliveTimeMs() {
        return keepAliveTimeMs != null ? OptionalLong.of(keepAliveTimeMs) : OptionalLong.empty();
    }

    /**
     * Returns {@code host:port}.
     */
    public String getAuthority() {
        if (host.indexOf(':') >= 0) {
            return "[" + host + "]:" + port;
        }
        return host + ":" + port;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConnectionInfo)) {
            return false;
        }
        ConnectionInfo other = (ConnectionInfo) o;
        return port == other.port
                && host.equals(other.host)
                && protocol == other.protocol
                && tls.equals(other.tls)
                && Objects.equals(timeout, other.timeout)
                && Objects.equals(maxReceiveMessageLength, other.maxReceiveMessageLength)
                && Objects.equals(keepAliveTimeMs, other.keepAliveTimeMs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port, protocol, tls, timeout, maxReceiveMessageLength, keepAliveTimeMs);
    }

    @Override
    public String toString() {
        return String.format("ConnectionInfo[%s://%s, %s, timeout=%s]",
                protocol.getConfigName(), getAuthority(), tls, timeout);
    }

    public static class Builder {
        private String host;
        private int port;
        private Protocol protocol = Protocol.GRPC;
        private TlsConfig tls = TlsConfig.disabled();
        private Duration timeout;
        private Integer maxReceiveMessageLength;
        private Long keepAliveTimeMs;

        private Builder() {}

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        /**
         * Default: GRPC
         */
        public Builder protocol(Protocol protocol) {
            this.protocol = protocol;
            return this;
        }

        /**
         * Default: disabled (plaintext)
         */
        public Builder tls(TlsConfig tls) {
            this.tls = tls;
            return this;
        }

        /**
         * Maximum time a single call may take. A gRPC deadline covers a whole stream; over HTTP
         * it covers the wait for the response headers.
         */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder maxReceiveMessageLength(int bytes) {
            this.maxReceiveMessageLength = bytes;
            return this;
        }

        public Builder keepAliveTimeMs(long keepAliveTimeMs) {
            this.keepAliveTimeMs = keepAliveTimeMs;
            return this;
        }

        /**
         * @throws ConfigurationException if the descriptor is malformed
         */
        public ConnectionInfo build() {
            if (host == null || host.isBlank()) {
                throw new ConfigurationException("host must not be empty");
            }
            if (port < 1 || port > 65535) {
                throw new ConfigurationException("port must be within 1..65535 but was " + port);
            }
            if (protocol == null) {
                throw new ConfigurationException("protocol must be set");
            }
            if (tls == null) {
                tls = TlsConfig.disabled();
            }
            if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
                throw new ConfigurationException("timeout must be positive but was " + timeout);
            }
            if (maxReceiveMessageLength != null && maxReceiveMessageLength < 1) {
                throw new ConfigurationException(
                    OPTION_MAX_RECEIVE_MESSAGE_LENGTH + " must be >= 1 but was " + maxReceiveMessageLength);
            }
            if (keepAliveTimeMs != null && keepAliveTimeMs < 1) {
                throw new ConfigurationException(OPTION_KEEPALIVE_TIME_MS + " must be >= 1 but was " + keepAliveTimeMs);
            }
            return new ConnectionInfo(this);
        }
    }
}
