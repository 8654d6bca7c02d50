/**
 * Wire protocol: frame codec and incremental stream parsing.
 *
 * <p>Every message travels as one length-prefixed frame. The length field lets a receiver find
 * message boundaries in a TCP byte stream regardless of how the stream was split into reads.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.relay.transport.framing.FrameCodec} - (type, payload, flags) to bytes
 *       and back
 *   <li>{@link express.mvp.relay.transport.framing.StreamFrameExtractor} - cuts complete frames off
 *       an accumulating buffer
 *   <li>{@link express.mvp.relay.transport.framing.Payload} - decoded payload variants
 * </ul>
 */
package express.mvp.relay.transport.framing;
