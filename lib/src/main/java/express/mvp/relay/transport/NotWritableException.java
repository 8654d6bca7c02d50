package express.mvp.relay.transport;

import express.mvp.relay.transport.lifecycle.ConnectionState;

/**
 * Thrown when {@link Connection#send} is called while the connection cannot accept writes.
 *
 * <p>Sends are accepted only in {@link ConnectionState#OPEN} and {@link
 * ConnectionState#DRAINING}. A rejected send has no observable side effect: nothing is encoded,
 * counted or handed to the transport.
 */
public class NotWritableException extends IllegalStateException {

    private final String connectionId;
    private final ConnectionState state;

    /**
     * Creates a new exception for a rejected send.
     *
     * @param connectionId the connection that rejected the send
     * @param state the state the connection was in
     */
    public NotWritableException(String connectionId, ConnectionState state) {
        super("Connection " + connectionId + " is not writable in state " + state);
        this.connectionId = connectionId;
        this.state = state;
    }

    public String connectionId() {
        return connectionId;
    }

    public ConnectionState state() {
        return state;
    }
}
