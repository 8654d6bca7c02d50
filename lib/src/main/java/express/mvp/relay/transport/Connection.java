package express.mvp.relay.transport;

import express.mvp.relay.transport.buffer.ReceiveBuffer;
import express.mvp.relay.transport.error.ErrorCategory;
import express.mvp.relay.transport.error.ErrorClassifier;
import express.mvp.relay.transport.error.ErrorCode;
import express.mvp.relay.transport.error.ProtocolException;
import express.mvp.relay.transport.error.RelayException;
import express.mvp.relay.transport.framing.Frame;
import express.mvp.relay.transport.framing.FrameCodec;
import express.mvp.relay.transport.framing.MessageType;
import express.mvp.relay.transport.framing.ParsedMessage;
import express.mvp.relay.transport.framing.StreamFrameExtractor;
import express.mvp.relay.transport.lifecycle.ConnectionState;
import express.mvp.relay.transport.lifecycle.ConnectionStateMachine;
import java.io.IOException;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One client connection: a transport, a receive buffer and a lifecycle state.
 *
 * <p>Inbound bytes are accumulated, cut into frames and decoded; each decoded frame is delivered
 * to the registered {@link ConnectionListener}s in arrival order. Outbound messages are encoded
 * and handed to the transport, whose backpressure drives the OPEN/DRAINING transitions.
 *
 * <h2>Lifecycle</h2>
 *
 * <pre>
 * open()                 INIT → OPEN
 * send() queued a write  OPEN → DRAINING
 * onFlushed()            DRAINING → OPEN
 * close()                OPEN/DRAINING → CLOSING, transport flushes then closes
 * onTransportClosed()    → CLOSED
 * terminate(cause)       → CLOSED immediately
 * </pre>
 *
 * <p>{@link ConnectionListener#onClosed} fires exactly once, whichever path reaches CLOSED first.
 * Listeners are detached afterwards.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>{@link #send} may be called from any thread. Inbound parsing is serialized on the receive
 * buffer. State changes are compare-and-set transitions on a {@link ConnectionStateMachine}.
 */
public final class Connection {

    private static final Logger LOGGER = Logger.getLogger(Connection.class.getName());

    private final String id;

    private final ConnectionTransport transport;

    private final FrameCodec codec;

    private final StreamFrameExtractor extractor;

    private final ReceiveBuffer receiveBuffer;

    private final ConnectionStateMachine stateMachine;

    private final Clock clock;

    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();

    private final AtomicBoolean closedFired = new AtomicBoolean(false);

    private final AtomicLong bytesSent = new AtomicLong();

    private final AtomicLong bytesReceived = new AtomicLong();

    private final AtomicLong framesSent = new AtomicLong();

    private final AtomicLong framesReceived = new AtomicLong();

    private volatile Instant lastHeartbeatAt;

    public Connection(String id, ConnectionTransport transport, TransportConfig config) {
        this(id, transport, config, new FrameCodec(config.maxFrameSize()), Clock.systemUTC());
    }

    /**
     * Creates a connection in {@link ConnectionState#INIT}.
     *
     * @param id unique connection id
     * @param transport the underlying byte pipe
     * @param config buffer and frame limits
     * @param codec the codec for both directions
     * @param clock source of heartbeat timestamps
     */
    public Connection(
            String id,
            ConnectionTransport transport,
            TransportConfig config,
            FrameCodec codec,
            Clock clock) {
        this.id = Objects.requireNonNull(id, "id");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.extractor = new StreamFrameExtractor(config.maxFrameSize());
        this.receiveBuffer = new ReceiveBuffer(
                Math.min(config.readBufferSize(), config.maxFrameSize()), config.maxFrameSize());
        this.stateMachine = new ConnectionStateMachine(id);
        this.stateMachine.addListener((previous, current, cause) ->
                fire(l -> l.onStateChanged(this, previous, current)));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Accessors
    // ─────────────────────────────────────────────────────────────────────────

    public String id() {
        return id;
    }

    public ConnectionState state() {
        return stateMachine.getState();
    }

    public FrameCodec codec() {
        return codec;
    }

    public SocketAddress remoteAddress() {
        return transport.remoteAddress();
    }

    /**
     * Returns the time of the last HEARTBEAT frame.
     *
     * @return the timestamp, or null if no heartbeat has arrived
     */
    public Instant lastHeartbeatAt() {
        return lastHeartbeatAt;
    }

    public void addListener(ConnectionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public boolean removeListener(ConnectionListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Returns a snapshot of this connection's counters.
     *
     * @return the current stats
     */
    public ConnectionStats stats() {
        int buffered;
        synchronized (receiveBuffer) {
            buffered = receiveBuffer.size();
        }
        return new ConnectionStats(
                id,
                state(),
                bytesSent.get(),
                bytesReceived.get(),
                framesSent.get(),
                framesReceived.get(),
                lastHeartbeatAt,
                buffered);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Lifecycle
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Moves INIT to OPEN and fires {@link ConnectionListener#onOpened}.
     *
     * @throws express.mvp.relay.transport.lifecycle.IllegalStateTransitionException if already
     *     opened
     */
    public void open() {
        stateMachine.transitionTo(ConnectionState.OPEN);
        fire(l -> l.onOpened(this));
    }

    /**
     * Requests a graceful close: pending writes are flushed, then the socket is closed and the
     * connection reaches CLOSED. Does nothing unless the connection is OPEN or DRAINING.
     */
    public void close() {
        while (true) {
            ConnectionState current = state();
            if (!current.isWritable()) {
                return;
            }
            if (stateMachine.transitionFrom(current, ConnectionState.CLOSING)) {
                transport.shutdown();
                return;
            }
        }
    }

    /**
     * Reports a protocol violation to the peer with an ERROR frame, then closes gracefully.
     *
     * @param error the violation
     */
    public void abort(ProtocolException error) {
        if (!state().isWritable()) {
            return;
        }
        LOGGER.log(Level.WARNING, "Protocol violation on {0}: {1}",
                new Object[] {id, error.getMessage()});
        fire(l -> l.onError(this, ErrorCategory.PROTOCOL, error.getMessage()));
        try {
            send(MessageType.ERROR, error.toErrorPayload());
        } catch (RelayException | IllegalStateException e) {
            LOGGER.log(Level.FINE, "Could not deliver ERROR frame to " + id, e);
        }
        close();
    }

    /**
     * Closes the socket immediately and moves to CLOSED.
     *
     * @param cause why the connection was terminated, may be null
     */
    public void terminate(Throwable cause) {
        transport.close();
        markClosed(cause);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Outbound
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Encodes and sends a message with flags detected from the payload.
     *
     * @param type the message type
     * @param payload null, bytes, or a JSON-serializable value
     * @throws NotWritableException if the connection is not OPEN or DRAINING
     * @throws ProtocolException if the encoded frame exceeds the maximum frame size
     * @throws TransportException if the transport failed; the connection is terminated
     */
    public void send(MessageType type, Object payload) {
        send(type.code(), payload, null);
    }

    /**
     * Encodes and sends a message.
     *
     * @param type the message type code
     * @param payload null, bytes, or a JSON-serializable value
     * @param flags explicit flags, or null to detect them from the payload
     * @throws NotWritableException if the connection is not OPEN or DRAINING
     * @throws ProtocolException if the encoded frame exceeds the maximum frame size
     * @throws TransportException if the transport failed; the connection is terminated
     */
    public void send(int type, Object payload, Integer flags) {
        ConnectionState current = state();
        if (!current.isWritable()) {
            throw new NotWritableException(id, current);
        }
        sendEncoded(codec.encode(type, payload, flags));
    }

    /**
     * Sends a frame that was already encoded, so one encoding can be shared by many receivers.
     *
     * @param frame complete wire bytes of one frame; not modified
     * @throws NotWritableException if the connection is not OPEN or DRAINING
     * @throws TransportException if the transport failed; the connection is terminated
     */
    public void sendEncoded(byte[] frame) {
        ConnectionState current = state();
        if (!current.isWritable()) {
            throw new NotWritableException(id, current);
        }

        boolean flushed;
        try {
            flushed = transport.write(ByteBuffer.wrap(frame));
        } catch (IOException | TransportException e) {
            onTransportError(e);
            throw e instanceof TransportException te
                    ? te
                    : new TransportException("Write failed on " + id, e);
        }
        bytesSent.addAndGet(frame.length);
        framesSent.incrementAndGet();

        if (!flushed && stateMachine.transitionFrom(ConnectionState.OPEN, ConnectionState.DRAINING)) {
            LOGGER.log(Level.FINE, "{0} draining, {1} bytes pending",
                    new Object[] {id, transport.pendingWriteBytes()});
            // The flush may have completed before the transition
            if (transport.pendingWriteBytes() == 0) {
                onFlushed();
            }
        }
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Transport callbacks
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Accepts inbound bytes. Complete frames are decoded and delivered before this returns.
     * Ignored unless the connection is OPEN or DRAINING.
     *
     * @param chunk bytes read from the socket; fully consumed
     */
    public void onData(ByteBuffer chunk) {
        if (!state().isReadable()) {
            LOGGER.log(Level.FINE, "Discarding {0} bytes on {1} in state {2}",
                    new Object[] {chunk.remaining(), id, state()});
            chunk.position(chunk.limit());
            return;
        }
        bytesReceived.addAndGet(chunk.remaining());

        synchronized (receiveBuffer) {
            try {
                while (chunk.hasRemaining() && state().isReadable()) {
                    int length = Math.min(receiveBuffer.remainingCapacity(), chunk.remaining());
                    if (length == 0) {
                        throw new ProtocolException(ErrorCode.FRAME_TOO_LARGE,
                                "Receive buffer exceeded " + receiveBuffer.maxSize() + " bytes");
                    }
                    receiveBuffer.append(chunk, length);
                    drainFrames();
                }
            } catch (ProtocolException e) {
                receiveBuffer.clear();
                chunk.position(chunk.limit());
                abort(e);
            }
        }
    }

    /** Called by the transport when a write backlog has been fully written. */
    public void onFlushed() {
        if (stateMachine.transitionFrom(ConnectionState.DRAINING, ConnectionState.OPEN)) {
            fire(l -> l.onDrained(this));
        }
    }

    /** Called by the transport once the socket is closed, by either side. */
    public void onTransportClosed() {
        markClosed(null);
    }

    /**
     * Called by the transport when the socket failed. The connection is terminated.
     *
     * @param error the failure
     */
    public void onTransportError(Throwable error) {
        if (state() == ConnectionState.CLOSED) {
            return;
        }
        ErrorCategory category = ErrorClassifier.classify(error);
        LOGGER.log(Level.WARNING, "Transport failure on " + id + ": " + error.getMessage(), error);
        fire(l -> l.onError(this, category, String.valueOf(error.getMessage())));
        terminate(error);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Internals
    // ─────────────────────────────────────────────────────────────────────────

    private void drainFrames() {
        ByteBuffer view = receiveBuffer.view();
        Frame frame;
        while (state().isReadable() && (frame = extractor.extract(view)) != null) {
            FrameCodec.checkHeader(frame.version(), frame.flags());
            ParsedMessage message = codec.decode(frame);
            receiveBuffer.consumeTo(view.position());
            framesReceived.incrementAndGet();

            if (message.type() == MessageType.HEARTBEAT.code()) {
                lastHeartbeatAt = clock.instant();
                LOGGER.log(Level.FINE, "Heartbeat from {0}", id);
                fire(l -> l.onHeartbeat(this));
            } else {
                LOGGER.log(Level.FINE, "Frame type {0} from {1}", new Object[] {message.type(), id});
                fire(l -> l.onFrame(this, message));
            }
        }
    }

    private void markClosed(Throwable cause) {
        while (true) {
            ConnectionState current = state();
            if (current == ConnectionState.CLOSED || current == ConnectionState.INIT) {
                break;
            }
            if (stateMachine.transitionFrom(current, ConnectionState.CLOSED, cause)) {
                break;
            }
        }
        if (state() == ConnectionState.CLOSED && closedFired.compareAndSet(false, true)) {
            ConnectionStats stats = stats();
            LOGGER.log(Level.FINE, "{0} closed: {1}", new Object[] {id, stats});
            fire(l -> l.onClosed(this, stats));
            listeners.clear();
            stateMachine.clearListeners();
        }
    }

    private void fire(Consumer<ConnectionListener> event) {
        for (ConnectionListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Connection listener failed on " + id, e);
            }
        }
    }

    @Override
    public String toString() {
        return "Connection[" + id + ":" + state() + "]";
    }
}
