package express.mvp.relay.transport.nio;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.relay.transport.Connection;
import express.mvp.relay.transport.TransportConfig;
import express.mvp.relay.transport.TransportException;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.net.StandardSocketOptions;
import java.nio.channels.CancelledKeyException;
import java.nio.channels.ClosedSelectorException;
import java.nio.channels.SelectionKey;
import java.nio.channels.Selector;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Selector loop that accepts sockets and dispatches their read and write readiness.
 *
 * <p>The owner drives the loop by calling {@link #pollOnce(long)} from a single thread. Every
 * accepted socket becomes a {@link NioChannelTransport}; the {@link AcceptHandler} turns it into a
 * {@link Connection} or rejects it.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * ┌───────────────────────────────────────────────┐
 * │                 NioEventLoop                  │
 * │                                               │
 * │  OP_ACCEPT ──▶ AcceptHandler ──▶ Connection   │
 * │  OP_READ   ──▶ transport.handleReadable()     │
 * │  OP_WRITE  ──▶ transport.handleWritable()     │
 * └───────────────────────────────────────────────┘
 * </pre>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * NioEventLoop loop = new NioEventLoop(config, transport -> registry.register(transport, listener));
 * loop.bind(new InetSocketAddress("0.0.0.0", 4000));
 * while (running) {
 *     loop.pollOnce(100);
 * }
 * loop.close();
 * }</pre>
 */
public final class NioEventLoop implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(NioEventLoop.class.getName());

    /** Creates the connection for an accepted socket. */
    @FunctionalInterface
    public interface AcceptHandler {

        /**
         * Called on the event loop thread for each accepted socket.
         *
         * @param transport the new socket's transport
         * @return the connection reading from the transport, or null to reject the socket
         */
        Connection onAccept(NioChannelTransport transport);
    }

    private final TransportConfig config;

    private final AcceptHandler acceptHandler;

    private final Selector selector;

    @SuppressFBWarnings(
            value = "UWF_FIELD_NOT_INITIALIZED_IN_CONSTRUCTOR",
            justification = "Initialized during bind().")
    private ServerSocketChannel serverChannel;

    private volatile boolean closed;

    /**
     * Opens the selector.
     *
     * @param config socket options and per-connection limits
     * @param acceptHandler turns accepted sockets into connections
     * @throws TransportException if the selector cannot be opened
     */
    public NioEventLoop(TransportConfig config, AcceptHandler acceptHandler) {
        this.config = config;
        this.acceptHandler = acceptHandler;
        try {
            this.selector = Selector.open();
        } catch (IOException e) {
            throw new TransportException("Failed to open selector", e);
        }
    }

    /**
     * Binds the listen socket and starts accepting.
     *
     * @param address the address to bind, port 0 for an ephemeral port
     * @return the bound address
     * @throws TransportException if binding fails
     */
    public InetSocketAddress bind(SocketAddress address) {
        if (serverChannel != null) {
            throw new IllegalStateException("Already bound");
        }
        try {
            ServerSocketChannel server = ServerSocketChannel.open();
            server.configureBlocking(false);
            server.setOption(StandardSocketOptions.SO_REUSEADDR, true);
            server.bind(address);
            server.register(selector, SelectionKey.OP_ACCEPT);
            this.serverChannel = server;
            return (InetSocketAddress) server.getLocalAddress();
        } catch (IOException e) {
            throw new TransportException("Bind failed: " + address, e);
        }
    }

    /**
     * Waits for readiness events and handles them.
     *
     * @param timeoutMillis maximum time to block, 0 to return immediately
     * @return the number of keys handled
     * @throws TransportException if the selector itself fails
     */
    public int pollOnce(long timeoutMillis) {
        if (closed) {
            return 0;
        }
        try {
            if (timeoutMillis > 0) {
                selector.select(timeoutMillis);
            } else {
                selector.selectNow();
            }
        } catch (IOException e) {
            throw new TransportException("Select failed", e);
        }

        int handled = 0;
        Iterator<SelectionKey> keys = selector.selectedKeys().iterator();
        while (keys.hasNext()) {
            SelectionKey key = keys.next();
            keys.remove();
            try {
                processKey(key);
                handled++;
            } catch (CancelledKeyException e) {
                LOGGER.log(Level.FINE, "Key cancelled during dispatch", e);
            }
        }
        return handled;
    }

    /** Interrupts a blocked {@link #pollOnce(long)}. */
    public void wakeup() {
        selector.wakeup();
    }

    /** Closes the listen socket. Accepted sockets are unaffected. */
    public void stopAccepting() {
        ServerSocketChannel server = serverChannel;
        if (server == null || !server.isOpen()) {
            return;
        }
        try {
            server.close();
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Error closing listen socket", e);
        }
        selector.wakeup();
    }

    /**
     * Returns the bound address.
     *
     * @return the local address, or null if not bound
     */
    public InetSocketAddress localAddress() {
        ServerSocketChannel server = serverChannel;
        if (server == null) {
            return null;
        }
        try {
            return (InetSocketAddress) server.getLocalAddress();
        } catch (IOException e) {
            throw new TransportException("Local address unavailable", e);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /** Closes the listen socket, every accepted socket and the selector. */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        stopAccepting();
        List<SelectionKey> registered;
        try {
            registered = new ArrayList<>(selector.keys());
        } catch (ClosedSelectorException e) {
            LOGGER.log(Level.FINE, "Selector already closed", e);
            return;
        }
        for (SelectionKey key : registered) {
            if (key.attachment() instanceof NioChannelTransport transport) {
                transport.close();
            }
        }
        try {
            selector.close();
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Error closing selector", e);
        }
    }

    private void processKey(SelectionKey key) {
        if (!key.isValid()) {
            return;
        }
        if (key.isAcceptable()) {
            acceptAll();
            return;
        }
        if (key.attachment() instanceof NioChannelTransport transport) {
            if (key.isWritable()) {
                transport.handleWritable();
            }
            if (key.isValid() && key.isReadable()) {
                transport.handleReadable();
            }
        }
    }

    private void acceptAll() {
        while (true) {
            SocketChannel client;
            try {
                client = serverChannel.accept();
            } catch (IOException e) {
                LOGGER.log(Level.WARNING, "Accept failed", e);
                return;
            }
            if (client == null) {
                return;
            }
            accept(client);
        }
    }

    private void accept(SocketChannel client) {
        NioChannelTransport transport;
        try {
            client.configureBlocking(false);
            client.setOption(StandardSocketOptions.TCP_NODELAY, config.tcpNoDelay());
            SelectionKey key = client.register(selector, SelectionKey.OP_READ);
            transport = new NioChannelTransport(client, key, config);
            key.attach(transport);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Failed to configure accepted socket", e);
            closeQuietly(client);
            return;
        }

        Connection connection;
        try {
            connection = acceptHandler.onAccept(transport);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Accept handler failed", e);
            transport.close();
            return;
        }
        if (connection == null) {
            transport.close();
            return;
        }
        transport.attach(connection);
    }

    private static void closeQuietly(SocketChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Error closing rejected socket", e);
        }
    }
}
