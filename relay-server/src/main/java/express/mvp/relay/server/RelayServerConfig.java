package express.mvp.relay.server;

import express.mvp.relay.transport.TransportConfig;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for a {@link RelayServer} instance.
 *
 * <h2>Configuration Categories</h2>
 *
 * <table border="1">
 *   <caption>Configuration options by category</caption>
 *   <tr><th>Category</th><th>Options</th><th>Environment</th></tr>
 *   <tr><td>Network</td><td>host, port</td><td>HOST, PORT</td></tr>
 *   <tr><td>Logging</td><td>debug</td><td>RELAY_DEBUG=1</td></tr>
 *   <tr><td>Liveness</td><td>heartbeatInterval</td><td>HEARTBEAT_INTERVAL (ms)</td></tr>
 *   <tr><td>Lifecycle</td><td>shutdownTimeout</td><td>-</td></tr>
 *   <tr><td>Transport</td><td>transportConfig</td><td>-</td></tr>
 * </table>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RelayServerConfig config = RelayServerConfig.builder()
 *     .host("127.0.0.1")
 *     .port(0)                      // ephemeral
 *     .shutdownTimeout(Duration.ofSeconds(2))
 *     .build();
 *
 * RelayServerConfig fromEnv = RelayServerConfig.fromEnvironment(System.getenv());
 * }</pre>
 *
 * @see RelayServer
 * @see TransportConfig
 */
public final class RelayServerConfig {

    public static final String DEFAULT_HOST = "0.0.0.0";

    public static final int DEFAULT_PORT = 4000;

    public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofMillis(30_000);

    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

    private final String host;

    private final int port;

    private final boolean debug;

    private final Duration heartbeatInterval;

    private final Duration shutdownTimeout;

    private final TransportConfig transportConfig;

    private RelayServerConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.debug = builder.debug;
        this.heartbeatInterval = builder.heartbeatInterval;
        this.shutdownTimeout = builder.shutdownTimeout;
        this.transportConfig = builder.transportConfig;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads configuration from environment variables, using defaults for unset ones.
     *
     * @param env the environment, usually {@link System#getenv()}
     * @return the configuration
     * @throws IllegalArgumentException if a variable is set to a malformed value
     */
    public static RelayServerConfig fromEnvironment(Map<String, String> env) {
        Builder builder = builder();
        String host = env.get("HOST");
        if (host != null && !host.isBlank()) {
            builder.host(host.trim());
        }
        String port = env.get("PORT");
        if (port != null) {
            builder.port(parseInt("PORT", port));
        }
        builder.debug("1".equals(env.get("RELAY_DEBUG")));
        String heartbeat = env.get("HEARTBEAT_INTERVAL");
        if (heartbeat != null) {
            builder.heartbeatInterval(Duration.ofMillis(parseInt("HEARTBEAT_INTERVAL", heartbeat)));
        }
        return builder.build();
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not an integer: " + value, e);
        }
    }

    public String getHost() {
        return host;
    }

    /**
     * Returns the TCP port to listen on.
     *
     * @return the port, 0 for an ephemeral port
     */
    public int getPort() {
        return port;
    }

    /**
     * Returns whether per-frame debug logging is enabled.
     *
     * @return true if the relay loggers are lowered to FINE
     */
    public boolean isDebug() {
        return debug;
    }

    /**
     * Returns the heartbeat interval advertised to clients in the HELLO reply.
     *
     * @return the interval
     */
    public Duration getHeartbeatInterval() {
        return heartbeatInterval;
    }

    /**
     * Returns how long {@link RelayServer#stop()} waits for connections to close gracefully.
     *
     * @return the drain timeout
     */
    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public TransportConfig getTransportConfig() {
        return transportConfig;
    }

    @Override
    public String toString() {
        return "RelayServerConfig[host=" + host
                + ", port=" + port
                + ", debug=" + debug
                + ", heartbeatInterval=" + heartbeatInterval
                + ", shutdownTimeout=" + shutdownTimeout
                + ", transport=" + transportConfig + "]";
    }

    /**
     * Builder for {@link RelayServerConfig}.
     *
     * <h2>Default Values</h2>
     *
     * <ul>
     *   <li>host: "0.0.0.0" (all interfaces)
     *   <li>port: 4000
     *   <li>debug: false
     *   <li>heartbeatInterval: 30 seconds
     *   <li>shutdownTimeout: 5 seconds
     *   <li>transportConfig: {@link TransportConfig#defaults()}
     * </ul>
     */
    public static final class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private boolean debug = false;
        private Duration heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;
        private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
        private TransportConfig transportConfig = TransportConfig.defaults();

        private Builder() {}

        public Builder host(String host) {
            this.host = Objects.requireNonNull(host, "host");
            return this;
        }

        /**
         * Sets the TCP port.
         *
         * @param port 0-65535, 0 for an ephemeral port
         * @return this builder
         */
        public Builder port(int port) {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("port must be in 0-65535: " + port);
            }
            this.port = port;
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public Builder heartbeatInterval(Duration heartbeatInterval) {
            if (heartbeatInterval.isNegative() || heartbeatInterval.isZero()) {
                throw new IllegalArgumentException(
                        "heartbeatInterval must be positive: " + heartbeatInterval);
            }
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            if (shutdownTimeout.isNegative()) {
                throw new IllegalArgumentException(
                        "shutdownTimeout must not be negative: " + shutdownTimeout);
            }
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public Builder transportConfig(TransportConfig transportConfig) {
            this.transportConfig = Objects.requireNonNull(transportConfig, "transportConfig");
            return this;
        }

        public RelayServerConfig build() {
            return new RelayServerConfig(this);
        }
    }
}
