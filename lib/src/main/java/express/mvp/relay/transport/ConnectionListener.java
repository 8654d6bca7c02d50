package express.mvp.relay.transport;

import express.mvp.relay.transport.error.ErrorCategory;
import express.mvp.relay.transport.framing.ParsedMessage;
import express.mvp.relay.transport.lifecycle.ConnectionState;

/**
 * Callback interface for connection lifecycle and message events.
 *
 * <p>All methods have empty defaults, so implementations override only what they need. Callbacks
 * run on the thread that delivered the underlying event, usually the I/O thread; blocking in a
 * callback stalls every connection served by that thread.
 *
 * <p>A listener that throws is logged and skipped; it does not affect other listeners or the
 * connection.
 */
public interface ConnectionListener {

    /** The connection moved from INIT to OPEN. */
    default void onOpened(Connection connection) {}

    default void onStateChanged(
            Connection connection, ConnectionState previous, ConnectionState current) {}

    /**
     * A complete, decoded non-heartbeat frame arrived.
     *
     * @param connection the receiving connection
     * @param message the decoded message; not retained by the connection
     */
    default void onFrame(Connection connection, ParsedMessage message) {}

    /** A HEARTBEAT frame arrived and {@link Connection#lastHeartbeatAt()} was updated. */
    default void onHeartbeat(Connection connection) {}

    /** A write backlog was flushed and the connection went back from DRAINING to OPEN. */
    default void onDrained(Connection connection) {}

    /**
     * The connection hit an error.
     *
     * @param connection the connection
     * @param category how the error is handled
     * @param detail human readable detail
     */
    default void onError(Connection connection, ErrorCategory category, String detail) {}

    /**
     * The connection reached CLOSED. Fires exactly once per connection, after which listeners are
     * detached.
     *
     * @param connection the closed connection
     * @param stats final counters
     */
    default void onClosed(Connection connection, ConnectionStats stats) {}
}
