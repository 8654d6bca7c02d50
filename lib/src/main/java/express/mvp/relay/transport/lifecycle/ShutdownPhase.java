package express.mvp.relay.transport.lifecycle;

/**
 * Phases of a graceful server shutdown.
 *
 * <pre>
 * RUNNING → DRAINING → CLOSING → TERMINATED
 * </pre>
 *
 * <ul>
 *   <li>{@link #RUNNING}: accepting connections
 *   <li>{@link #DRAINING}: no new connections; open ones were asked to close and are flushing
 *   <li>{@link #CLOSING}: stragglers are terminated and resources released
 *   <li>{@link #TERMINATED}: done
 * </ul>
 */
public enum ShutdownPhase {
    RUNNING(0, "Running"),
    DRAINING(1, "Draining"),
    CLOSING(2, "Closing"),
    TERMINATED(3, "Terminated");

    private final int order;
    private final String displayName;

    ShutdownPhase(int order, String displayName) {
        this.order = order;
        this.displayName = displayName;
    }

    public int order() {
        return order;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isAcceptingConnections() {
        return this == RUNNING;
    }

    public boolean isShuttingDown() {
        return order > RUNNING.order;
    }

    public boolean isTerminated() {
        return this == TERMINATED;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
