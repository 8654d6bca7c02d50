package express.mvp.relay.transport.error;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for relay failures that carry a machine-readable {@link ErrorCode}.
 *
 * <p>Subclasses fix the category: {@link ProtocolException} for stream-level violations,
 * {@link ApplicationException} for rejected requests and {@link
 * express.mvp.relay.transport.TransportException} for socket failures.
 */
public abstract class RelayException extends RuntimeException {

    private final ErrorCode code;

    protected RelayException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code must not be null");
    }

    protected RelayException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code must not be null");
    }

    /**
     * Returns the wire-level error code.
     *
     * @return the error code
     */
    public ErrorCode code() {
        return code;
    }

    /**
     * Returns the category derived from the error code.
     *
     * @return the error category
     */
    public ErrorCategory category() {
        return code.category();
    }

    /**
     * Builds the body of the ERROR frame reporting this failure.
     *
     * <p>The map has exactly two entries, {@code code} and {@code message}, so that a client can
     * diagnose the failure from the wire alone.
     *
     * @return a JSON-serializable map
     */
    public Map<String, Object> toErrorPayload() {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("code", code.name());
        payload.put("message", getMessage());
        return payload;
    }
}
