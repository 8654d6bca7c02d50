package express.mvp.relay.transport;

import java.io.IOException;
import java.net.SocketAddress;
import java.nio.ByteBuffer;

/**
 * The byte pipe underneath a {@link Connection}.
 *
 * <p>A transport owns one socket. It accepts whole encoded frames from the connection, buffers what
 * the socket cannot take yet, and reports back through the connection:
 *
 * <ul>
 *   <li>{@link Connection#onData(ByteBuffer)} for inbound bytes
 *   <li>{@link Connection#onFlushed()} once a write backlog has been fully written
 *   <li>{@link Connection#onTransportClosed()} when the socket is closed by either side
 *   <li>{@link Connection#onTransportError(Throwable)} for socket failures
 * </ul>
 *
 * @see express.mvp.relay.transport.nio.NioChannelTransport
 */
public interface ConnectionTransport {

    /**
     * Writes one encoded frame.
     *
     * @param frame the frame bytes, consumed from position to limit
     * @return true if the socket took every byte, false if some are queued for later
     * @throws IOException if the socket failed
     * @throws TransportException if queuing would exceed the write backlog bound
     */
    boolean write(ByteBuffer frame) throws IOException;

    /**
     * Flushes pending writes, then closes the socket and calls {@link
     * Connection#onTransportClosed()}.
     */
    void shutdown();

    /** Closes the socket immediately, discarding pending writes. No callback is made. */
    void close();

    /**
     * Returns the peer address, or null if unknown.
     *
     * @return the remote address
     */
    SocketAddress remoteAddress();

    /**
     * Returns the number of bytes queued and not yet written to the socket.
     *
     * @return backlog size in bytes
     */
    int pendingWriteBytes();
}
