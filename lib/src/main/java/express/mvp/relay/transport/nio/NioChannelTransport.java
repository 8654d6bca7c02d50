package express.mvp.relay.transport.nio;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.relay.transport.Connection;
import express.mvp.relay.transport.ConnectionTransport;
import express.mvp.relay.transport.TransportConfig;
import express.mvp.relay.transport.TransportException;
import express.mvp.relay.transport.error.ErrorCode;
import java.io.IOException;
import java.net.SocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.CancelledKeyException;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.SelectionKey;
import java.nio.channels.SocketChannel;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ConnectionTransport} over a non-blocking {@link SocketChannel}.
 *
 * <p>Writes go straight to the socket while nothing is queued. Whatever the socket does not take
 * is queued, bounded by {@link TransportConfig#maxPendingWriteBytes()}, and written when the
 * selector reports the channel writable. Emptying the queue calls {@link Connection#onFlushed()},
 * or closes the socket if a graceful shutdown was requested.
 *
 * <p>{@link #write} may be called from any thread; the selector callbacks ({@link
 * #handleReadable()}, {@link #handleWritable()}) run on the event loop thread. Connection
 * callbacks are made outside the write lock.
 */
public final class NioChannelTransport implements ConnectionTransport {

    private static final Logger LOGGER = Logger.getLogger(NioChannelTransport.class.getName());

    private final SocketChannel channel;

    private final SelectionKey key;

    private final int maxPendingWriteBytes;

    private final ByteBuffer readBuffer;

    private final Object writeLock = new Object();

    private final Deque<ByteBuffer> pending = new ArrayDeque<>();

    private int pendingBytes;

    private boolean shutdownRequested;

    private volatile boolean closed;

    @SuppressFBWarnings(
            value = "UWF_FIELD_NOT_INITIALIZED_IN_CONSTRUCTOR",
            justification = "Attached by the event loop right after accept, before any I/O event.")
    private volatile Connection connection;

    /**
     * Creates a transport for a registered channel.
     *
     * @param channel the accepted, non-blocking channel
     * @param key the channel's registration with the event loop's selector
     * @param config read buffer size and write backlog bound
     */
    public NioChannelTransport(SocketChannel channel, SelectionKey key, TransportConfig config) {
        this.channel = channel;
        this.key = key;
        this.maxPendingWriteBytes = config.maxPendingWriteBytes();
        this.readBuffer = ByteBuffer.allocate(config.readBufferSize());
    }

    void attach(Connection connection) {
        this.connection = connection;
    }

    Connection connection() {
        return connection;
    }

    @Override
    public boolean write(ByteBuffer frame) throws IOException {
        synchronized (writeLock) {
            if (closed || shutdownRequested) {
                throw new ClosedChannelException();
            }
            if (pending.isEmpty()) {
                channel.write(frame);
                if (!frame.hasRemaining()) {
                    return true;
                }
            }
            int remaining = frame.remaining();
            if ((long) pendingBytes + remaining > maxPendingWriteBytes) {
                throw new TransportException(ErrorCode.WRITE_BACKLOG_EXCEEDED, String.format(
                        "Write backlog %d + %d bytes exceeds limit %d",
                        pendingBytes, remaining, maxPendingWriteBytes));
            }
            pending.addLast(frame.slice());
            pendingBytes += remaining;
            setInterest(SelectionKey.OP_READ | SelectionKey.OP_WRITE);
            return false;
        }
    }

    @Override
    public void shutdown() {
        boolean closeNow;
        synchronized (writeLock) {
            if (closed) {
                return;
            }
            shutdownRequested = true;
            closeNow = pending.isEmpty();
            if (!closeNow) {
                setInterest(SelectionKey.OP_WRITE);
            }
        }
        if (closeNow) {
            closeAndNotify();
        }
    }

    @Override
    public void close() {
        synchronized (writeLock) {
            if (closed) {
                return;
            }
            closed = true;
            pending.clear();
            pendingBytes = 0;
        }
        key.cancel();
        try {
            channel.close();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Error closing channel", e);
        }
        key.selector().wakeup();
    }

    @Override
    public SocketAddress remoteAddress() {
        try {
            return channel.getRemoteAddress();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Remote address unavailable", e);
            return null;
        }
    }

    @Override
    public int pendingWriteBytes() {
        synchronized (writeLock) {
            return pendingBytes;
        }
    }

    public boolean isClosed() {
        return closed;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Selector callbacks (event loop thread)
    // ─────────────────────────────────────────────────────────────────────────

    void handleReadable() {
        int read;
        try {
            readBuffer.clear();
            read = channel.read(readBuffer);
        } catch (IOException e) {
            fail(e);
            return;
        }
        if (read < 0) {
            closeAndNotify();
        } else if (read > 0) {
            readBuffer.flip();
            connection.onData(readBuffer);
        }
    }

    void handleWritable() {
        boolean flushed;
        boolean closeAfterFlush;
        try {
            synchronized (writeLock) {
                if (closed) {
                    return;
                }
                while (!pending.isEmpty()) {
                    ByteBuffer head = pending.peekFirst();
                    pendingBytes -= channel.write(head);
                    if (head.hasRemaining()) {
                        break;
                    }
                    pending.removeFirst();
                }
                flushed = pending.isEmpty();
                closeAfterFlush = flushed && shutdownRequested;
                if (flushed && !shutdownRequested) {
                    setInterest(SelectionKey.OP_READ);
                }
            }
        } catch (IOException e) {
            fail(e);
            return;
        }
        if (closeAfterFlush) {
            closeAndNotify();
        } else if (flushed) {
            connection.onFlushed();
        }
    }

    private void fail(IOException error) {
        close();
        Connection target = connection;
        if (target != null) {
            target.onTransportError(error);
        }
    }

    private void closeAndNotify() {
        close();
        Connection target = connection;
        if (target != null) {
            target.onTransportClosed();
        }
    }

    private void setInterest(int ops) {
        try {
            key.interestOps(ops);
            key.selector().wakeup();
        } catch (CancelledKeyException e) {
            LOGGER.log(Level.FINE, "Interest change on cancelled key", e);
        }
    }

    @Override
    public String toString() {
        return "NioChannelTransport[" + remoteAddress() + ", pending=" + pendingWriteBytes() + "]";
    }
}
