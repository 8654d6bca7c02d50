package express.mvp.relay.transport;

import express.mvp.relay.transport.error.ErrorCode;
import express.mvp.relay.transport.error.RelayException;

/**
 * Exception thrown when a socket-level operation fails.
 *
 * <p>Transport failures are never retried by the relay: the affected connection is logged and
 * terminated, and no other connection is touched. Common causes:
 *
 * <ul>
 *   <li>the peer reset the connection
 *   <li>binding the listen address failed
 *   <li>a slow consumer's write backlog exceeded {@link TransportConfig#maxPendingWriteBytes()}
 * </ul>
 */
public class TransportException extends RelayException {

    /**
     * Constructs a new transport exception with the specified message.
     *
     * @param message the detail message describing the failure
     */
    public TransportException(String message) {
        super(ErrorCode.TRANSPORT_FAILURE, message);
    }

    /**
     * Constructs a new transport exception with the specified message and cause.
     *
     * @param message the detail message describing the failure
     * @param cause the underlying cause of the failure
     */
    public TransportException(String message, Throwable cause) {
        super(ErrorCode.TRANSPORT_FAILURE, message, cause);
    }

    /**
     * Constructs a new transport exception with an explicit transport error code.
     *
     * @param code the error code
     * @param message the detail message describing the failure
     */
    public TransportException(ErrorCode code, String message) {
        super(code, message);
    }
}
