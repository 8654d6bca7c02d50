package express.mvp.relay.server;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.relay.server.dispatch.Dispatcher;
import express.mvp.relay.server.handler.ChatMessageHandler;
import express.mvp.relay.server.handler.HelloHandler;
import express.mvp.relay.server.handler.JoinRoomHandler;
import express.mvp.relay.server.handler.LeaveRoomHandler;
import express.mvp.relay.server.metrics.RelayMetrics;
import express.mvp.relay.server.room.RoomRegistry;
import express.mvp.relay.transport.Connection;
import express.mvp.relay.transport.ConnectionListener;
import express.mvp.relay.transport.ConnectionRegistry;
import express.mvp.relay.transport.ConnectionStats;
import express.mvp.relay.transport.TransportException;
import express.mvp.relay.transport.error.ErrorCategory;
import express.mvp.relay.transport.framing.FrameCodec;
import express.mvp.relay.transport.framing.MessageType;
import express.mvp.relay.transport.framing.ParsedMessage;
import express.mvp.relay.transport.lifecycle.ShutdownCoordinator;
import express.mvp.relay.transport.lifecycle.ShutdownListener;
import express.mvp.relay.transport.lifecycle.ShutdownPhase;
import express.mvp.relay.transport.nio.NioChannelTransport;
import express.mvp.relay.transport.nio.NioEventLoop;
import java.net.InetSocketAddress;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The relay server: accepts clients, routes their messages and relays them between room members.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * ┌─────────────────────────────────────────────────────────────┐
 * │                        RelayServer                          │
 * ├─────────────────────────────────────────────────────────────┤
 * │                                                             │
 * │   ┌─────────────┐    ┌─────────────────────────────────┐   │
 * │   │ NioEventLoop│    │       ConnectionRegistry        │   │
 * │   │  (accept)   │───▶│  ┌───────┐ ┌───────┐ ┌───────┐  │   │
 * │   └─────────────┘    │  │conn-1 │ │conn-2 │ │conn-3 │  │   │
 * │                      │  └───────┘ └───────┘ └───────┘  │   │
 * │                      └─────────────────────────────────┘   │
 * │                           │ onFrame                        │
 * │                           ▼                                │
 * │   ┌─────────────────────────────────────────────────────┐  │
 * │   │ Dispatcher ─▶ HELLO / JOIN_ROOM / LEAVE_ROOM /      │  │
 * │   │               MESSAGE handlers ─▶ RoomRegistry      │  │
 * │   └─────────────────────────────────────────────────────┘  │
 * │                           │ onClosed                       │
 * │                           ▼                                │
 * │         RoomRegistry.leaveAll, RelayMetrics,               │
 * │         ShutdownCoordinator                                │
 * └─────────────────────────────────────────────────────────────┘
 * </pre>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RelayServerConfig config = RelayServerConfig.builder().port(4000).build();
 *
 * try (RelayServer server = new RelayServer(config)) {
 *     server.start();
 *     server.awaitReady(5, TimeUnit.SECONDS);
 *     // Server runs until stopped
 * }
 * }</pre>
 *
 * <h2>Thread Model</h2>
 *
 * <ul>
 *   <li>Single I/O thread handles accept, read and write readiness
 *   <li>Parsing, dispatch and broadcast run on the I/O thread (keep handlers fast)
 *   <li>{@link #stop()} runs on the caller's thread; the I/O thread keeps flushing until the drain
 *       completes or times out
 * </ul>
 *
 * @see RelayServerConfig
 */
public class RelayServer implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(RelayServer.class.getName());

    /** Maximum time the I/O thread blocks in select. */
    private static final long POLL_TIMEOUT_MS = 100;

    private static final long IO_THREAD_JOIN_MS = 5000;

    private final RelayServerConfig config;

    private final ConnectionRegistry connections;

    private final RoomRegistry rooms;

    private final Dispatcher dispatcher;

    private final RelayMetrics metrics;

    private final ShutdownCoordinator shutdownCoordinator = new ShutdownCoordinator();

    private final ConnectionListener connectionEvents = new ServerConnectionListener();

    private final AtomicBoolean running = new AtomicBoolean(false);

    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private final CountDownLatch readyLatch = new CountDownLatch(1);

    @SuppressFBWarnings(
            value = "AT_UNSAFE_RESOURCE_ACCESS_IN_THREAD",
            justification = "Event loop is confined to the I/O thread; stop() joins before it is closed.")
    private volatile NioEventLoop eventLoop;

    private volatile InetSocketAddress boundAddress;

    private volatile RuntimeException startupFailure;

    private Thread ioThread;

    /**
     * Creates a server with the standard message handlers.
     *
     * @param config server configuration
     */
    public RelayServer(RelayServerConfig config) {
        this.config = config;
        this.connections = new ConnectionRegistry(config.getTransportConfig());
        this.rooms = new RoomRegistry(new FrameCodec(config.getTransportConfig().maxFrameSize()));
        this.metrics = new RelayMetrics();
        this.rooms.addListener(metrics);
        this.dispatcher = Dispatcher.builder()
                .route(MessageType.HELLO, new HelloHandler(config.getHeartbeatInterval()))
                .route(MessageType.JOIN_ROOM, new JoinRoomHandler(rooms))
                .route(MessageType.LEAVE_ROOM, new LeaveRoomHandler(rooms))
                .route(MessageType.MESSAGE, new ChatMessageHandler(rooms))
                .route(MessageType.HEARTBEAT, (connection, message) -> { })
                .route(MessageType.ERROR, (connection, message) ->
                        LOGGER.log(Level.INFO, "[{0}] Client reported error: {1}",
                                new Object[] {connection.id(), message.payload()}))
                .build();
        this.shutdownCoordinator.addListener(new ShutdownLogger());
    }

    /**
     * Starts the I/O thread, which binds the listen socket and serves clients. Returns
     * immediately; use {@link #awaitReady} to wait for the bind.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            ioThread = new Thread(this::runLoop, "relay-server-io");
            ioThread.start();
        }
    }

    /**
     * Waits for the server to be ready to accept connections.
     *
     * @param timeout the maximum time to wait
     * @param unit the time unit of the timeout argument
     * @return true if the server is ready, false if the timeout elapsed
     * @throws InterruptedException if interrupted while waiting
     * @throws TransportException if the server failed to bind
     */
    public boolean awaitReady(long timeout, TimeUnit unit) throws InterruptedException {
        boolean signalled = readyLatch.await(timeout, unit);
        RuntimeException failure = startupFailure;
        if (failure != null) {
            throw new TransportException("Relay server failed to start", failure);
        }
        return signalled;
    }

    /**
     * Stops the server gracefully.
     *
     * <p>Stops accepting, asks every connection to close after flushing, and waits up to the
     * configured shutdown timeout. Connections still open after that are terminated. Metrics are
     * logged at the end.
     *
     * @return true if every connection closed within the timeout
     */
    public boolean stop() {
        if (!stopped.compareAndSet(false, true)) {
            return true;
        }
        boolean graceful;
        try {
            graceful = shutdownCoordinator.shutdown(
                    config.getShutdownTimeout(), this::beginDrain, this::forceClose);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            forceClose();
            graceful = false;
        }
        LOGGER.log(Level.INFO, "Relay server stopped ({0})\n{1}",
                new Object[] {graceful ? "graceful" : "forced", metrics.snapshot().format()});
        return graceful;
    }

    @Override
    public void close() {
        stop();
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Accessors
    // ─────────────────────────────────────────────────────────────────────────

    public RelayServerConfig getConfig() {
        return config;
    }

    /**
     * Returns the bound listen address.
     *
     * @return the address, or null before the server is ready
     */
    public InetSocketAddress getLocalAddress() {
        return boundAddress;
    }

    /**
     * Returns the bound port, useful when configured with port 0.
     *
     * @return the port, or -1 before the server is ready
     */
    public int getPort() {
        InetSocketAddress address = boundAddress;
        return address != null ? address.getPort() : -1;
    }

    public boolean isRunning() {
        return running.get();
    }

    public ConnectionRegistry getConnections() {
        return connections;
    }

    public RoomRegistry getRooms() {
        return rooms;
    }

    public RelayMetrics getMetrics() {
        return metrics;
    }

    public ShutdownCoordinator getShutdownCoordinator() {
        return shutdownCoordinator;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // I/O thread
    // ─────────────────────────────────────────────────────────────────────────

    private void runLoop() {
        NioEventLoop loop = null;
        try {
            loop = new NioEventLoop(config.getTransportConfig(), this::accept);
            eventLoop = loop;
            boundAddress = loop.bind(new InetSocketAddress(config.getHost(), config.getPort()));
            LOGGER.log(Level.INFO, "Relay server listening on {0}", boundAddress);
            readyLatch.countDown();

            while (running.get()) {
                loop.pollOnce(POLL_TIMEOUT_MS);
            }
        } catch (RuntimeException e) {
            if (boundAddress == null) {
                startupFailure = e;
            }
            LOGGER.log(Level.SEVERE, "Relay server I/O loop failed", e);
            running.set(false);
        } finally {
            readyLatch.countDown();
            if (loop != null) {
                loop.close();
            }
        }
    }

    private Connection accept(NioChannelTransport transport) {
        if (!shutdownCoordinator.connectionOpened()) {
            LOGGER.log(Level.FINE, "Rejecting {0}: shutting down", transport.remoteAddress());
            return null;
        }
        metrics.connectionOpened();
        return connections.register(transport, connectionEvents);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Shutdown steps
    // ─────────────────────────────────────────────────────────────────────────

    private void beginDrain() {
        NioEventLoop loop = eventLoop;
        if (loop != null) {
            loop.stopAccepting();
        }
        LOGGER.log(Level.INFO, "Draining {0} connections", connections.size());
        connections.closeAll();
    }

    private void forceClose() {
        int terminated = connections.terminateAll(null);
        if (terminated > 0) {
            LOGGER.log(Level.WARNING, "Terminated {0} connections that did not close in time", terminated);
        }
        running.set(false);
        NioEventLoop loop = eventLoop;
        if (loop != null) {
            loop.wakeup();
        }
        Thread thread = ioThread;
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join(IO_THREAD_JOIN_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.log(Level.WARNING, "Interrupted waiting for the I/O thread", e);
            }
        }
    }

    /** Wires connection events to dispatch, room cleanup and metrics. */
    private final class ServerConnectionListener implements ConnectionListener {

        @Override
        public void onOpened(Connection connection) {
            LOGGER.log(Level.INFO, "[{0}] Connected from {1}",
                    new Object[] {connection.id(), connection.remoteAddress()});
        }

        @Override
        public void onFrame(Connection connection, ParsedMessage message) {
            metrics.messageProcessed();
            dispatcher.dispatch(connection, message);
        }

        @Override
        public void onHeartbeat(Connection connection) {
            LOGGER.log(Level.FINE, "[{0}] Heartbeat", connection.id());
        }

        @Override
        public void onError(Connection connection, ErrorCategory category, String detail) {
            LOGGER.log(Level.FINE, "[{0}] {1} error: {2}",
                    new Object[] {connection.id(), category, detail});
        }

        @Override
        public void onClosed(Connection connection, ConnectionStats stats) {
            int roomsLeft = rooms.leaveAll(connection.id());
            metrics.connectionClosed(stats);
            shutdownCoordinator.connectionClosed();
            LOGGER.log(Level.INFO, "[{0}] Disconnected (rooms left: {1}, in: {2}, out: {3})",
                    new Object[] {
                        connection.id(),
                        roomsLeft,
                        RelayMetrics.formatBytes(stats.bytesReceived()),
                        RelayMetrics.formatBytes(stats.bytesSent())
                    });
        }
    }

    private static final class ShutdownLogger implements ShutdownListener {

        @Override
        public void onPhaseChange(ShutdownPhase previousPhase, ShutdownPhase currentPhase) {
            LOGGER.log(Level.INFO, "Shutdown phase: {0} -> {1}", new Object[] {previousPhase, currentPhase});
        }

        @Override
        public void onDrainProgress(int remainingConnections, int totalConnections) {
            LOGGER.log(Level.FINE, "Draining: {0}/{1} connections remaining",
                    new Object[] {remainingConnections, totalConnections});
        }

        @Override
        public void onShutdownComplete(boolean graceful, long durationMs) {
            LOGGER.log(Level.FINE, "Shutdown completed in {0} ms", durationMs);
        }
    }
}
