package express.mvp.relay.transport.lifecycle;

/**
 * Callback interface for connection state change events.
 *
 * <p>Invoked synchronously on the thread that performed the transition. Implementations should
 * be quick and non-blocking.
 *
 * @see ConnectionStateMachine
 */
@FunctionalInterface
public interface ConnectionStateListener {

    /**
     * Called after the state changed.
     *
     * @param previousState the state before the transition
     * @param currentState the new state
     * @param cause the reason for the transition, null for normal transitions
     */
    void onStateChanged(ConnectionState previousState, ConnectionState currentState, Throwable cause);
}
