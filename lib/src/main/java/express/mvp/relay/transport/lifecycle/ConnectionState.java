package express.mvp.relay.transport.lifecycle;

/**
 * Lifecycle states of a relay connection.
 *
 * <h2>State Diagram</h2>
 *
 * <pre>
 * ┌──────┐ open ┌──────┐ write buffered ┌──────────┐
 * │ INIT │─────▶│ OPEN │───────────────▶│ DRAINING │
 * └──────┘      │      │◀───────────────│          │
 *               └──────┘    flushed     └──────────┘
 *                │    │                   │      │
 *                │    └─ close() ─┐ ┌─────┘      │
 *                │                ▼ ▼            │
 *                │            ┌─────────┐        │
 *                │            │ CLOSING │        │
 *                │            └─────────┘        │
 *                │ socket closed   │             │
 *                ▼                 ▼             ▼
 *              ┌─────────────────────────────────────┐
 *              │               CLOSED                │
 *              └─────────────────────────────────────┘
 * </pre>
 *
 * <ul>
 *   <li>{@link #INIT}: constructed, listeners may still be attached
 *   <li>{@link #OPEN}: reading and writing
 *   <li>{@link #DRAINING}: transport is holding unflushed writes; still reading and writing
 *   <li>{@link #CLOSING}: graceful close requested; inbound data is discarded, sends rejected
 *   <li>{@link #CLOSED}: terminal
 * </ul>
 *
 * @see ConnectionStateMachine
 */
public enum ConnectionState {
    INIT("Init"),
    OPEN("Open"),
    DRAINING("Draining"),
    CLOSING("Closing"),
    CLOSED("Closed");

    private final String displayName;

    ConnectionState(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Checks if sends are accepted in this state.
     *
     * @return true in OPEN and DRAINING
     */
    public boolean isWritable() {
        return this == OPEN || this == DRAINING;
    }

    /**
     * Checks if inbound data is parsed in this state.
     *
     * @return true in OPEN and DRAINING
     */
    public boolean isReadable() {
        return this == OPEN || this == DRAINING;
    }

    /**
     * Checks if this state is CLOSING or CLOSED.
     *
     * @return true once a close has begun
     */
    public boolean isClosedOrClosing() {
        return this == CLOSING || this == CLOSED;
    }

    /**
     * Checks if this is the terminal state.
     *
     * @return true only for CLOSED
     */
    public boolean isTerminal() {
        return this == CLOSED;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
