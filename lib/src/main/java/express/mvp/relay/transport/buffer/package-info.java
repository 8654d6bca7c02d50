/**
 * Inbound byte accumulation.
 *
 * <p>{@link express.mvp.relay.transport.buffer.ReceiveBuffer} holds the bytes of partially
 * received frames for one connection, bounded by the maximum frame size.
 */
package express.mvp.relay.transport.buffer;
