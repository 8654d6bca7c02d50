/**
 * Connection lifecycle and server shutdown.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.relay.transport.lifecycle.ConnectionStateMachine} - enforces the
 *       INIT/OPEN/DRAINING/CLOSING/CLOSED transition table
 *   <li>{@link express.mvp.relay.transport.lifecycle.ShutdownCoordinator} - drains connections
 *       before the server releases its resources
 * </ul>
 *
 * @see express.mvp.relay.transport.Connection
 */
package express.mvp.relay.transport.lifecycle;
