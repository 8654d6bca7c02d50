/**
 * Relay transport: the framed wire protocol and the connections that speak it.
 *
 * <h2>Architecture Overview</h2>
 *
 * <pre>
 * socket bytes
 *    │
 *    ▼
 * ┌─────────────────────┐   ┌──────────────────────┐   ┌─────────────┐
 * │ ConnectionTransport │──▶│ Connection           │──▶│ Connection- │
 * │ (nio)               │   │  ReceiveBuffer       │   │ Listener    │
 * │                     │◀──│  StreamFrameExtractor│   └─────────────┘
 * └─────────────────────┘   │  FrameCodec          │
 *                           │  state machine       │
 *                           └──────────────────────┘
 * </pre>
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.relay.transport.Connection} - one client, its buffer and lifecycle
 *   <li>{@link express.mvp.relay.transport.ConnectionRegistry} - id assignment and the live set
 *   <li>{@link express.mvp.relay.transport.framing.FrameCodec} - frame encoding and decoding
 *   <li>{@link express.mvp.relay.transport.nio.NioEventLoop} - selector thread
 *   <li>{@link express.mvp.relay.transport.client.RelayClient} - blocking client
 * </ul>
 */
package express.mvp.relay.transport;
