package express.mvp.relay.transport.error;

/**
 * Thrown by message handlers when a well-formed request cannot be honoured.
 *
 * <p>The dispatcher answers with an ERROR frame and leaves the connection open; the client may
 * correct the request and retry.
 */
public class ApplicationException extends RelayException {

    /**
     * Constructs a new application exception.
     *
     * @param code the error code, which must belong to {@link ErrorCategory#APPLICATION}
     * @param message the detail message
     */
    public ApplicationException(ErrorCode code, String message) {
        super(checkCategory(code), message);
    }

    /**
     * Constructs a new application exception with a cause.
     *
     * @param code the error code, which must belong to {@link ErrorCategory#APPLICATION}
     * @param message the detail message
     * @param cause the underlying failure
     */
    public ApplicationException(ErrorCode code, String message, Throwable cause) {
        super(checkCategory(code), message, cause);
    }

    private static ErrorCode checkCategory(ErrorCode code) {
        if (code != null && code.category() != ErrorCategory.APPLICATION) {
            throw new IllegalArgumentException("Not an application error code: " + code);
        }
        return code;
    }
}
