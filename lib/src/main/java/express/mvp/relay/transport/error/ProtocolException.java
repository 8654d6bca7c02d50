package express.mvp.relay.transport.error;

/**
 * Thrown when the inbound byte stream violates the wire protocol.
 *
 * <p>Once a protocol violation is detected the stream position can no longer be trusted, so the
 * connection reports the error with an ERROR frame and then closes. Typical causes:
 *
 * <ul>
 *   <li>a length prefix below the header remainder or above the maximum frame size
 *   <li>an unsupported version or unknown message type
 *   <li>a payload flagged as JSON that does not parse
 * </ul>
 *
 * <pre>{@code
 * try {
 *     Frame frame = extractor.extract(buffer);
 * } catch (ProtocolException e) {
 *     connection.abort(e);
 * }
 * }</pre>
 */
public class ProtocolException extends RelayException {

    /**
     * Constructs a new protocol exception.
     *
     * @param code the error code, which must belong to {@link ErrorCategory#PROTOCOL}
     * @param message the detail message
     */
    public ProtocolException(ErrorCode code, String message) {
        super(checkCategory(code), message);
    }

    /**
     * Constructs a new protocol exception with a cause.
     *
     * @param code the error code, which must belong to {@link ErrorCategory#PROTOCOL}
     * @param message the detail message
     * @param cause the underlying parse failure
     */
    public ProtocolException(ErrorCode code, String message, Throwable cause) {
        super(checkCategory(code), message, cause);
    }

    private static ErrorCode checkCategory(ErrorCode code) {
        if (code != null && code.category() != ErrorCategory.PROTOCOL) {
            throw new IllegalArgumentException("Not a protocol error code: " + code);
        }
        return code;
    }
}
