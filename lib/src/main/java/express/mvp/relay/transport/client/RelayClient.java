package express.mvp.relay.transport.client;

import express.mvp.relay.transport.TransportException;
import express.mvp.relay.transport.error.ErrorCode;
import express.mvp.relay.transport.error.ProtocolException;
import express.mvp.relay.transport.framing.FrameCodec;
import express.mvp.relay.transport.framing.MessageType;
import express.mvp.relay.transport.framing.ParsedMessage;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Blocking client for the relay protocol.
 *
 * <p>A daemon reader thread decodes inbound frames into a queue; {@link #receive(Duration)} and
 * {@link #await(Predicate, Duration)} take from it. Sends are synchronized and may be made from
 * any thread.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try (RelayClient client = RelayClient.connect("localhost", 4000, Duration.ofSeconds(2))) {
 *     client.hello("alice");
 *     client.join("general");
 *     client.message("general", "hi");
 *     ParsedMessage reply = client.receive(Duration.ofSeconds(1));
 * }
 * }</pre>
 */
public final class RelayClient implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(RelayClient.class.getName());

    /** Version string sent in HELLO. */
    public static final String CLIENT_VERSION = "1.0.0";

    private final Socket socket;

    private final OutputStream out;

    private final FrameCodec codec;

    private final BlockingQueue<ParsedMessage> inbound = new LinkedBlockingQueue<>();

    private final CountDownLatch closedLatch = new CountDownLatch(1);

    private final Thread reader;

    private volatile ScheduledExecutorService heartbeats;

    private volatile boolean closing;

    private RelayClient(Socket socket, FrameCodec codec) throws IOException {
        this.socket = socket;
        this.codec = codec;
        this.out = new BufferedOutputStream(socket.getOutputStream());
        DataInputStream in = new DataInputStream(socket.getInputStream());
        this.reader = new Thread(() -> readLoop(in), "relay-client-reader");
        this.reader.setDaemon(true);
    }

    /**
     * Connects to a relay server.
     *
     * @param host server host
     * @param port server port
     * @param timeout connect timeout
     * @return the connected client
     * @throws TransportException if the connection cannot be established
     */
    public static RelayClient connect(String host, int port, Duration timeout) {
        return connect(host, port, timeout, new FrameCodec());
    }

    /**
     * Connects to a relay server with a specific codec.
     *
     * @param host server host
     * @param port server port
     * @param timeout connect timeout
     * @param codec codec for both directions
     * @return the connected client
     * @throws TransportException if the connection cannot be established
     */
    public static RelayClient connect(String host, int port, Duration timeout, FrameCodec codec) {
        Socket socket = new Socket();
        try {
            socket.setTcpNoDelay(true);
            socket.connect(new InetSocketAddress(host, port), (int) timeout.toMillis());
            RelayClient client = new RelayClient(socket, codec);
            client.reader.start();
            return client;
        } catch (IOException e) {
            try {
                socket.close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw new TransportException("Connect to " + host + ":" + port + " failed", e);
        }
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Protocol operations
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Sends HELLO.
     *
     * @param userId user name reported to the server, may be null
     */
    public void hello(String userId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        if (userId != null) {
            payload.put("userId", userId);
        }
        payload.put("clientVersion", CLIENT_VERSION);
        send(MessageType.HELLO, payload);
    }

    public void join(String room) {
        send(MessageType.JOIN_ROOM, Map.of("room", room));
    }

    public void leave(String room) {
        send(MessageType.LEAVE_ROOM, Map.of("room", room));
    }

    /**
     * Sends a chat message to a room.
     *
     * @param room the room name
     * @param content any JSON-serializable content
     */
    public void message(String room, Object content) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("room", room);
        payload.put("content", content);
        send(MessageType.MESSAGE, payload);
    }

    public void heartbeat() {
        send(MessageType.HEARTBEAT, null);
    }

    /**
     * Sends HEARTBEAT at a fixed rate until the client is closed.
     *
     * @param interval time between heartbeats
     */
    public synchronized void startHeartbeat(Duration interval) {
        if (heartbeats != null) {
            return;
        }
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "relay-client-heartbeat");
            thread.setDaemon(true);
            return thread;
        });
        long millis = interval.toMillis();
        executor.scheduleAtFixedRate(() -> {
            try {
                heartbeat();
            } catch (TransportException e) {
                LOGGER.log(Level.FINE, "Heartbeat failed, stopping", e);
                executor.shutdown();
            }
        }, millis, millis, TimeUnit.MILLISECONDS);
        heartbeats = executor;
    }

    /**
     * Encodes and sends a message.
     *
     * @param type the message type
     * @param payload null, bytes, or a JSON-serializable value
     * @throws TransportException if the socket write fails
     */
    public void send(MessageType type, Object payload) {
        sendRaw(codec.encode(type, payload));
    }

    /**
     * Writes bytes as-is, for sending frames the codec would refuse to build.
     *
     * @param bytes raw wire bytes
     * @throws TransportException if the socket write fails
     */
    public void sendRaw(byte[] bytes) {
        synchronized (out) {
            try {
                out.write(bytes);
                out.flush();
            } catch (IOException e) {
                throw new TransportException("Write failed", e);
            }
        }
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Receiving
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Takes the next inbound message.
     *
     * @param timeout maximum time to wait
     * @return the message, or null on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public ParsedMessage receive(Duration timeout) throws InterruptedException {
        return inbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Takes inbound messages until one matches, discarding the others.
     *
     * @param filter the match condition
     * @param timeout maximum total time to wait
     * @return the matching message, or null on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public ParsedMessage await(Predicate<ParsedMessage> filter, Duration timeout)
            throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return null;
            }
            ParsedMessage message = inbound.poll(remaining, TimeUnit.NANOSECONDS);
            if (message == null) {
                return null;
            }
            if (filter.test(message)) {
                return message;
            }
        }
    }

    /**
     * Takes inbound messages until one of the given type arrives, discarding the others.
     *
     * @param type the wanted type
     * @param timeout maximum total time to wait
     * @return the message, or null on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public ParsedMessage await(MessageType type, Duration timeout) throws InterruptedException {
        return await(m -> m.type() == type.code(), timeout);
    }

    /**
     * Waits for the server to close the connection.
     *
     * @param timeout maximum time to wait
     * @return true if the connection closed within the timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitClosed(Duration timeout) throws InterruptedException {
        return closedLatch.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isClosed() {
        return closedLatch.getCount() == 0;
    }

    @Override
    public void close() {
        closing = true;
        ScheduledExecutorService executor = heartbeats;
        if (executor != null) {
            executor.shutdownNow();
        }
        try {
            socket.close();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Error closing client socket", e);
        }
    }

    private void readLoop(DataInputStream in) {
        try {
            while (true) {
                long length = in.readInt() & 0xFFFFFFFFL;
                if (length < FrameCodec.HEADER_REMAINDER_SIZE
                        || FrameCodec.LENGTH_FIELD_SIZE + length > codec.maxFrameSize()) {
                    throw new ProtocolException(
                            ErrorCode.INVALID_LENGTH, "Server sent invalid frame length " + length);
                }
                byte[] remainder = new byte[(int) length];
                in.readFully(remainder);
                inbound.add(codec.decode(ByteBuffer.wrap(remainder)));
            }
        } catch (EOFException e) {
            LOGGER.log(Level.FINE, "Server closed the connection");
        } catch (SocketException e) {
            LOGGER.log(Level.FINE, closing ? "Client socket closed" : "Connection reset", e);
        } catch (IOException | ProtocolException e) {
            LOGGER.log(Level.WARNING, "Client read failed", e);
        } finally {
            closedLatch.countDown();
        }
    }
}
