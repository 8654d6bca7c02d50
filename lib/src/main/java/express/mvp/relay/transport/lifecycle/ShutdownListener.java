package express.mvp.relay.transport.lifecycle;

/**
 * Receives shutdown progress notifications from a {@link ShutdownCoordinator}.
 */
public interface ShutdownListener {

    /**
     * Called on every phase change.
     *
     * @param previousPhase the phase being left
     * @param currentPhase the phase entered
     */
    void onPhaseChange(ShutdownPhase previousPhase, ShutdownPhase currentPhase);

    /**
     * Called each time a connection finishes closing while draining.
     *
     * @param remainingConnections connections still open
     * @param totalConnections connections open when draining began
     */
    default void onDrainProgress(int remainingConnections, int totalConnections) {}

    /**
     * Called once shutdown has terminated.
     *
     * @param graceful true if every connection closed before the drain timeout
     * @param durationMs time from the start of draining to termination
     */
    void onShutdownComplete(boolean graceful, long durationMs);

    /**
     * Called when a shutdown step throws.
     *
     * @param phase the phase the step belonged to
     * @param error the failure
     */
    default void onShutdownError(ShutdownPhase phase, Throwable error) {}
}
