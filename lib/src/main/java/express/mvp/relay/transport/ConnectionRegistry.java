package express.mvp.relay.transport;

import express.mvp.relay.transport.framing.FrameCodec;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates connections for accepted sockets and tracks the live ones.
 *
 * <p>Ids are {@code conn-1}, {@code conn-2}, ... and are never reused within a registry. A
 * connection is removed as soon as it reaches CLOSED.
 */
public final class ConnectionRegistry {

    private static final Logger LOGGER = Logger.getLogger(ConnectionRegistry.class.getName());

    private static final String ID_PREFIX = "conn-";

    private final TransportConfig config;

    private final Clock clock;

    private final AtomicLong nextId = new AtomicLong(1);

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();

    public ConnectionRegistry(TransportConfig config) {
        this(config, Clock.systemUTC());
    }

    public ConnectionRegistry(TransportConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * Creates, tracks and opens a connection for a new transport.
     *
     * <p>The listener is attached before the connection opens, so it sees {@code onOpened}.
     *
     * @param transport the accepted socket's transport
     * @param listener receives the connection's events, may be null
     * @return the open connection
     */
    public Connection register(ConnectionTransport transport, ConnectionListener listener) {
        String id = ID_PREFIX + nextId.getAndIncrement();
        Connection connection =
                new Connection(id, transport, config, new FrameCodec(config.maxFrameSize()), clock);
        connection.addListener(new ConnectionListener() {
            @Override
            public void onClosed(Connection closed, ConnectionStats stats) {
                connections.remove(closed.id(), closed);
            }
        });
        if (listener != null) {
            connection.addListener(listener);
        }
        connections.put(id, connection);
        connection.open();
        LOGGER.log(Level.FINE, "Registered {0} from {1}",
                new Object[] {id, transport.remoteAddress()});
        return connection;
    }

    /**
     * Looks up a live connection.
     *
     * @param id the connection id
     * @return the connection, or null if unknown or closed
     */
    public Connection get(String id) {
        return connections.get(id);
    }

    /**
     * Returns a snapshot of the live connections.
     *
     * @return live connections, in no particular order
     */
    public Collection<Connection> all() {
        return new ArrayList<>(connections.values());
    }

    public int size() {
        return connections.size();
    }

    /** Requests a graceful close of every live connection. */
    public void closeAll() {
        for (Connection connection : all()) {
            connection.close();
        }
    }

    /**
     * Terminates every live connection immediately.
     *
     * @param cause reported as the close cause, may be null
     * @return the number of connections terminated
     */
    public int terminateAll(Throwable cause) {
        List<Connection> remaining = new ArrayList<>(connections.values());
        for (Connection connection : remaining) {
            connection.terminate(cause);
        }
        return remaining.size();
    }
}
