package express.mvp.relay.transport.lifecycle;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link ShutdownCoordinator}.
 */
@DisplayName("ShutdownCoordinator")
class ShutdownCoordinatorTest {

    private ShutdownCoordinator coordinator;

    /** Listener with no-op callbacks, for overriding one event. */
    private abstract static class QuietListener implements ShutdownListener {
        @Override
        public void onPhaseChange(ShutdownPhase previousPhase, ShutdownPhase currentPhase) {}

        @Override
        public void onShutdownComplete(boolean graceful, long durationMs) {}
    }

    @BeforeEach
    void setUp() {
        coordinator = new ShutdownCoordinator();
    }

    @Nested
    @DisplayName("Initial state")
    class InitialStateTests {

        @Test
        @DisplayName("Starts in RUNNING phase")
        void startsInRunningPhase() {
            assertEquals(ShutdownPhase.RUNNING, coordinator.getPhase());
            assertTrue(coordinator.isAcceptingConnections());
            assertFalse(coordinator.isTerminated());
            assertEquals(0, coordinator.getOpenConnectionCount());
        }
    }

    @Nested
    @DisplayName("Connection counting")
    class ConnectionCountingTests {

        @Test
        @DisplayName("Counts opened and closed connections")
        void countsConnections() {
            assertTrue(coordinator.connectionOpened());
            assertTrue(coordinator.connectionOpened());
            coordinator.connectionClosed();

            assertEquals(1, coordinator.getOpenConnectionCount());
        }

        @Test
        @DisplayName("Unbalanced close does not go negative")
        void unbalancedClose() {
            coordinator.connectionClosed();

            assertEquals(0, coordinator.getOpenConnectionCount());
        }

        @Test
        @DisplayName("Rejects connections once shutdown has begun")
        void rejectsAfterShutdown() throws InterruptedException {
            coordinator.shutdown(Duration.ofMillis(10), null, null);

            assertFalse(coordinator.connectionOpened());
            assertEquals(0, coordinator.getOpenConnectionCount());
        }
    }

    @Nested
    @DisplayName("Shutdown sequence")
    class ShutdownSequenceTests {

        @Test
        @DisplayName("Walks every phase in order")
        void walksPhases() throws InterruptedException {
            List<ShutdownPhase> phases = Collections.synchronizedList(new ArrayList<>());
            coordinator.addListener(new QuietListener() {
                @Override
                public void onPhaseChange(ShutdownPhase from, ShutdownPhase to) {
                    phases.add(to);
                }
            });

            assertTrue(coordinator.shutdown(Duration.ofSeconds(1), null, null));

            assertEquals(List.of(ShutdownPhase.DRAINING, ShutdownPhase.CLOSING,
                    ShutdownPhase.TERMINATED), phases);
            assertTrue(coordinator.isTerminated());
        }

        @Test
        @DisplayName("Graceful when connections close during the drain")
        void gracefulDrain() throws InterruptedException {
            coordinator.connectionOpened();
            coordinator.connectionOpened();
            AtomicBoolean forced = new AtomicBoolean();

            boolean graceful = coordinator.shutdown(Duration.ofSeconds(5),
                    () -> {
                        coordinator.connectionClosed();
                        coordinator.connectionClosed();
                    },
                    () -> forced.set(true));

            assertTrue(graceful);
            assertTrue(forced.get(), "force closer always runs to release resources");
        }

        @Test
        @DisplayName("Not graceful when the drain times out")
        void drainTimeout() throws InterruptedException {
            coordinator.connectionOpened();
            AtomicInteger forced = new AtomicInteger();

            long start = System.nanoTime();
            boolean graceful = coordinator.shutdown(Duration.ofMillis(100), () -> { },
                    forced::incrementAndGet);
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertFalse(graceful);
            assertEquals(1, forced.get());
            assertTrue(elapsedMs >= 90, "waited for the drain timeout");
            assertTrue(coordinator.isTerminated());
        }

        @Test
        @DisplayName("Reports drain progress")
        void drainProgress() throws InterruptedException {
            coordinator.connectionOpened();
            coordinator.connectionOpened();
            List<String> progress = Collections.synchronizedList(new ArrayList<>());
            coordinator.addListener(new QuietListener() {
                @Override
                public void onDrainProgress(int remaining, int total) {
                    progress.add(remaining + "/" + total);
                }
            });

            coordinator.shutdown(Duration.ofSeconds(1),
                    () -> {
                        coordinator.connectionClosed();
                        coordinator.connectionClosed();
                    },
                    null);

            assertEquals(List.of("1/2", "0/2"), progress);
        }

        @Test
        @DisplayName("Failing step is reported and shutdown still terminates")
        void failingStep() throws InterruptedException {
            List<ShutdownPhase> failed = new ArrayList<>();
            coordinator.addListener(new QuietListener() {
                @Override
                public void onShutdownError(ShutdownPhase phase, Throwable error) {
                    failed.add(phase);
                }
            });

            coordinator.shutdown(Duration.ofMillis(50),
                    () -> {
                        throw new IllegalStateException("drain failed");
                    },
                    null);

            assertEquals(List.of(ShutdownPhase.DRAINING), failed);
            assertTrue(coordinator.isTerminated());
        }

        @Test
        @DisplayName("Second caller waits for the first shutdown")
        void concurrentShutdown() throws Exception {
            coordinator.connectionOpened();
            CountDownLatch drainStarted = new CountDownLatch(1);
            Thread first = new Thread(() -> {
                try {
                    coordinator.shutdown(Duration.ofSeconds(5), () -> {
                        drainStarted.countDown();
                    }, null);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            first.start();
            assertTrue(drainStarted.await(1, TimeUnit.SECONDS));

            coordinator.connectionClosed();
            assertTrue(coordinator.shutdown(Duration.ofSeconds(5), null, null));

            first.join(5000);
            assertTrue(coordinator.awaitTermination(Duration.ofSeconds(1)));
        }
    }
}
