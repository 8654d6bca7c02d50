package express.mvp.relay.transport.lifecycle;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Coordinates graceful shutdown of a server and its connections.
 *
 * <p>The coordinator counts live connections. Shutdown stops new connections, asks the open ones
 * to close, and waits (up to a timeout) for the count to reach zero before forcing the rest.
 *
 * <h2>Shutdown Flow</h2>
 *
 * <pre>
 * 1. shutdown() called
 *    └─▶ Phase: RUNNING → DRAINING
 *        └─▶ drainStarter: stop accepting, close() every connection
 *        └─▶ Wait for connectionClosed() to bring the count to 0 (up to drainTimeout)
 *
 * 2. Drain complete OR timeout
 *    └─▶ Phase: DRAINING → CLOSING
 *        └─▶ forceCloser: terminate stragglers, release the selector
 *
 * 3. Phase: CLOSING → TERMINATED
 *    └─▶ Listeners told whether the drain was graceful
 * </pre>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ShutdownCoordinator coordinator = new ShutdownCoordinator();
 *
 * // accept path
 * if (!coordinator.connectionOpened()) {
 *     channel.close();
 * }
 * // close path
 * coordinator.connectionClosed();
 *
 * boolean graceful = coordinator.shutdown(
 *     Duration.ofSeconds(5),
 *     () -> { eventLoop.stopAccepting(); registry.closeAll(); },
 *     () -> { registry.terminateAll(); eventLoop.close(); });
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>All methods are thread-safe. Only the first caller of {@link #shutdown} runs the steps;
 * concurrent callers wait for termination.
 *
 * @see ShutdownPhase
 * @see ShutdownListener
 */
public final class ShutdownCoordinator {

    private static final Logger LOGGER = Logger.getLogger(ShutdownCoordinator.class.getName());

    private final AtomicReference<ShutdownPhase> phase = new AtomicReference<>(ShutdownPhase.RUNNING);

    private final AtomicInteger openConnections = new AtomicInteger(0);

    private final CountDownLatch drainCompleteLatch = new CountDownLatch(1);

    private final CountDownLatch terminatedLatch = new CountDownLatch(1);

    private final List<ShutdownListener> listeners = new CopyOnWriteArrayList<>();

    private volatile int drainStartCount = 0;

    private volatile boolean gracefulShutdown = true;

    public ShutdownPhase getPhase() {
        return phase.get();
    }

    public boolean isAcceptingConnections() {
        return phase.get().isAcceptingConnections();
    }

    public boolean isTerminated() {
        return phase.get().isTerminated();
    }

    /**
     * Returns the number of connections counted as open.
     *
     * @return open connections
     */
    public int getOpenConnectionCount() {
        return openConnections.get();
    }

    public void addListener(ShutdownListener listener) {
        listeners.add(listener);
    }

    public boolean removeListener(ShutdownListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Counts a newly accepted connection.
     *
     * @return true if the connection may proceed, false if shutdown has begun and it must be closed
     */
    public boolean connectionOpened() {
        while (true) {
            if (!phase.get().isAcceptingConnections()) {
                return false;
            }
            int current = openConnections.get();
            if (openConnections.compareAndSet(current, current + 1)) {
                if (phase.get().isAcceptingConnections()) {
                    return true;
                }
                // Shutdown started between the checks
                connectionClosed();
                return false;
            }
        }
    }

    /** Counts a connection that reached CLOSED. Must pair with a successful {@link #connectionOpened()}. */
    public void connectionClosed() {
        int remaining = openConnections.decrementAndGet();
        if (remaining < 0) {
            LOGGER.warning("More connections closed than opened; resetting count");
            openConnections.set(0);
            remaining = 0;
        }

        if (phase.get() == ShutdownPhase.DRAINING) {
            if (remaining == 0) {
                drainCompleteLatch.countDown();
            }
            int total = drainStartCount;
            for (ShutdownListener listener : listeners) {
                try {
                    listener.onDrainProgress(remaining, total);
                } catch (RuntimeException e) {
                    LOGGER.log(Level.WARNING, "Shutdown listener failed", e);
                }
            }
        }
    }

    /**
     * Runs the shutdown sequence, blocking until it terminates.
     *
     * @param drainTimeout maximum time to wait for open connections to close
     * @param drainStarter stops accepting and asks connections to close (DRAINING)
     * @param forceCloser terminates remaining connections and releases resources (CLOSING)
     * @return true if every connection closed within the drain timeout
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public boolean shutdown(Duration drainTimeout, Runnable drainStarter, Runnable forceCloser)
            throws InterruptedException {

        if (!phase.compareAndSet(ShutdownPhase.RUNNING, ShutdownPhase.DRAINING)) {
            // Already shutting down - wait for completion
            awaitTermination(drainTimeout);
            return gracefulShutdown;
        }

        long startNanos = System.nanoTime();
        drainStartCount = openConnections.get();
        notifyPhaseChange(ShutdownPhase.RUNNING, ShutdownPhase.DRAINING);

        runStep(ShutdownPhase.DRAINING, drainStarter);
        if (openConnections.get() == 0) {
            drainCompleteLatch.countDown();
        }

        gracefulShutdown = drainCompleteLatch.await(drainTimeout.toMillis(), TimeUnit.MILLISECONDS);

        transitionToPhase(ShutdownPhase.CLOSING);
        runStep(ShutdownPhase.CLOSING, forceCloser);
        transitionToPhase(ShutdownPhase.TERMINATED);
        terminatedLatch.countDown();

        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        for (ShutdownListener listener : listeners) {
            try {
                listener.onShutdownComplete(gracefulShutdown, durationMs);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Shutdown listener failed", e);
            }
        }
        return gracefulShutdown;
    }

    /**
     * Waits for shutdown to complete.
     *
     * @param timeout maximum time to wait
     * @return true if terminated within timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminatedLatch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void runStep(ShutdownPhase stepPhase, Runnable step) {
        if (step == null) {
            return;
        }
        try {
            step.run();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Shutdown step failed in phase " + stepPhase, e);
            for (ShutdownListener listener : listeners) {
                try {
                    listener.onShutdownError(stepPhase, e);
                } catch (RuntimeException listenerFailure) {
                    LOGGER.log(Level.WARNING, "Shutdown listener failed", listenerFailure);
                }
            }
        }
    }

    private void transitionToPhase(ShutdownPhase newPhase) {
        ShutdownPhase previous = phase.getAndSet(newPhase);
        if (previous != newPhase) {
            notifyPhaseChange(previous, newPhase);
        }
    }

    private void notifyPhaseChange(ShutdownPhase previous, ShutdownPhase current) {
        for (ShutdownListener listener : listeners) {
            try {
                listener.onPhaseChange(previous, current);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Shutdown listener failed", e);
            }
        }
    }
}
