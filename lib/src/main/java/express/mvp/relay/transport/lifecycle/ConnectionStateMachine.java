package express.mvp.relay.transport.lifecycle;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thread-safe state machine for the connection lifecycle.
 *
 * <h2>Valid Transitions</h2>
 *
 * <pre>
 * INIT     → OPEN
 * OPEN     → DRAINING, CLOSING, CLOSED
 * DRAINING → OPEN, CLOSING, CLOSED
 * CLOSING  → CLOSED
 * CLOSED   → (terminal, no transitions)
 * </pre>
 *
 * <p>Requesting any other transition throws {@link IllegalStateTransitionException}. Inbound data,
 * write-flush and close events can race on one connection, so besides {@link #transitionTo} the
 * machine offers {@link #transitionFrom}, which only moves if the current state is still the
 * expected one and reports a lost race by returning false.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ConnectionStateMachine state = new ConnectionStateMachine("conn-1");
 * state.addListener((prev, curr, cause) -> LOGGER.fine(prev + " -> " + curr));
 *
 * state.transitionTo(ConnectionState.OPEN);
 * state.transitionFrom(ConnectionState.OPEN, ConnectionState.DRAINING);   // write buffered
 * state.transitionFrom(ConnectionState.DRAINING, ConnectionState.OPEN);   // flushed
 * state.transitionTo(ConnectionState.CLOSING);
 * state.transitionTo(ConnectionState.CLOSED);
 * }</pre>
 *
 * @see ConnectionState
 * @see ConnectionStateListener
 */
public final class ConnectionStateMachine {

    private static final Logger LOGGER = Logger.getLogger(ConnectionStateMachine.class.getName());

    private static final Set<ConnectionState> FROM_INIT = EnumSet.of(ConnectionState.OPEN);

    private static final Set<ConnectionState> FROM_OPEN =
            EnumSet.of(ConnectionState.DRAINING, ConnectionState.CLOSING, ConnectionState.CLOSED);

    private static final Set<ConnectionState> FROM_DRAINING =
            EnumSet.of(ConnectionState.OPEN, ConnectionState.CLOSING, ConnectionState.CLOSED);

    private static final Set<ConnectionState> FROM_CLOSING = EnumSet.of(ConnectionState.CLOSED);

    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.INIT);

    private final List<ConnectionStateListener> listeners = new CopyOnWriteArrayList<>();

    private final String connectionId;

    /** Creates an anonymous state machine in {@link ConnectionState#INIT}. */
    public ConnectionStateMachine() {
        this(null);
    }

    /**
     * Creates a state machine in {@link ConnectionState#INIT}.
     *
     * @param connectionId identifier used in exception messages and {@link #toString()}
     */
    public ConnectionStateMachine(String connectionId) {
        this.connectionId = connectionId;
    }

    public ConnectionState getState() {
        return state.get();
    }

    public String getConnectionId() {
        return connectionId;
    }

    public void addListener(ConnectionStateListener listener) {
        listeners.add(listener);
    }

    public boolean removeListener(ConnectionStateListener listener) {
        return listeners.remove(listener);
    }

    /** Detaches every listener. */
    public void clearListeners() {
        listeners.clear();
    }

    /**
     * Transitions from whatever the current state is.
     *
     * @param newState the target state
     * @throws IllegalStateTransitionException if the table has no edge from the current state
     */
    public void transitionTo(ConnectionState newState) {
        transitionTo(newState, null);
    }

    /**
     * Transitions from whatever the current state is, recording a cause.
     *
     * @param newState the target state
     * @param cause the reason for the transition, may be null
     * @throws IllegalStateTransitionException if the table has no edge from the current state
     */
    public void transitionTo(ConnectionState newState, Throwable cause) {
        while (true) {
            ConnectionState current = state.get();
            if (!isValidTransition(current, newState)) {
                throw new IllegalStateTransitionException(connectionId, current, newState);
            }
            if (state.compareAndSet(current, newState)) {
                notifyListeners(current, newState, cause);
                return;
            }
            // CAS failed, retry with new current state
        }
    }

    /**
     * Transitions only if the current state is {@code expectedState}.
     *
     * @param expectedState the state the caller observed
     * @param newState the target state
     * @return true if the transition happened, false if another event changed the state first
     * @throws IllegalStateTransitionException if the table has no edge between the two states
     */
    public boolean transitionFrom(ConnectionState expectedState, ConnectionState newState) {
        return transitionFrom(expectedState, newState, null);
    }

    /**
     * Transitions only if the current state is {@code expectedState}, recording a cause.
     *
     * @param expectedState the state the caller observed
     * @param newState the target state
     * @param cause the reason for the transition, may be null
     * @return true if the transition happened, false if another event changed the state first
     * @throws IllegalStateTransitionException if the table has no edge between the two states
     */
    public boolean transitionFrom(
            ConnectionState expectedState, ConnectionState newState, Throwable cause) {
        if (!isValidTransition(expectedState, newState)) {
            throw new IllegalStateTransitionException(connectionId, expectedState, newState);
        }
        if (state.compareAndSet(expectedState, newState)) {
            notifyListeners(expectedState, newState, cause);
            return true;
        }
        return false;
    }

    /**
     * Checks if a transition is in the table.
     *
     * @param from the source state
     * @param to the target state
     * @return true if the transition is allowed
     */
    public static boolean isValidTransition(ConnectionState from, ConnectionState to) {
        return getValidTransitions(from).contains(to);
    }

    /**
     * Returns the set of valid target states from a given state.
     *
     * @param from the source state
     * @return a fresh set of valid target states
     */
    public static Set<ConnectionState> getValidTransitions(ConnectionState from) {
        return switch (from) {
            case INIT -> EnumSet.copyOf(FROM_INIT);
            case OPEN -> EnumSet.copyOf(FROM_OPEN);
            case DRAINING -> EnumSet.copyOf(FROM_DRAINING);
            case CLOSING -> EnumSet.copyOf(FROM_CLOSING);
            case CLOSED -> EnumSet.noneOf(ConnectionState.class);
        };
    }

    private void notifyListeners(ConnectionState previous, ConnectionState current, Throwable cause) {
        for (ConnectionStateListener listener : listeners) {
            try {
                listener.onStateChanged(previous, current, cause);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Connection state listener failed", e);
            }
        }
    }

    @Override
    public String toString() {
        return connectionId != null
                ? "ConnectionStateMachine[" + connectionId + ":" + state.get() + "]"
                : "ConnectionStateMachine[" + state.get() + "]";
    }
}
