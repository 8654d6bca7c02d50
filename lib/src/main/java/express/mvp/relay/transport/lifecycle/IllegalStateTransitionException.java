package express.mvp.relay.transport.lifecycle;

/**
 * Thrown when a transition outside the connection transition table is requested.
 *
 * <p>This is an internal invariant violation, not a peer error: correct code never asks for one.
 */
public class IllegalStateTransitionException extends IllegalStateException {

    private final ConnectionState from;
    private final ConnectionState to;

    public IllegalStateTransitionException(String connectionId, ConnectionState from, ConnectionState to) {
        super("Invalid state transition for " + (connectionId != null ? connectionId : "connection")
                + ": " + from.name() + " -> " + to.name());
        this.from = from;
        this.to = to;
    }

    public ConnectionState from() {
        return from;
    }

    public ConnectionState to() {
        return to;
    }
}
