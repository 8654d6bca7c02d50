/**
 * Error taxonomy for the relay.
 *
 * <p>Every failure that can reach a peer carries an {@link
 * express.mvp.relay.transport.error.ErrorCode}; its {@link
 * express.mvp.relay.transport.error.ErrorCategory} decides whether the connection survives.
 *
 * <ul>
 *   <li>{@link express.mvp.relay.transport.error.ProtocolException} - ERROR frame, then close
 *   <li>{@link express.mvp.relay.transport.error.ApplicationException} - ERROR frame, stay open
 *   <li>{@link express.mvp.relay.transport.TransportException} - logged, connection terminated
 * </ul>
 */
package express.mvp.relay.transport.error;
