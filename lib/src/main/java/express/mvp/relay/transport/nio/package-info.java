/**
 * Java NIO networking for the relay.
 *
 * <p>A single selector thread accepts sockets and dispatches readiness events. Each accepted socket
 * is wrapped in a {@link express.mvp.relay.transport.nio.NioChannelTransport}, which owns the
 * bounded write backlog and reports flushes and closes to its connection.
 *
 * @see express.mvp.relay.transport.nio.NioEventLoop
 */
package express.mvp.relay.transport.nio;
