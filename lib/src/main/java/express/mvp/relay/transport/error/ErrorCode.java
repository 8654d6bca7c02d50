package express.mvp.relay.transport.error;

/**
 * Machine-readable error codes carried in the {@code code} field of ERROR frames.
 *
 * <p>The enum constant name is the wire value, so renaming a constant is a protocol change.
 */
public enum ErrorCode {
    /** Declared frame length is below the 3-byte header remainder. */
    INVALID_LENGTH(ErrorCategory.PROTOCOL),

    /** Declared frame length, or buffered data, exceeds the maximum frame size. */
    FRAME_TOO_LARGE(ErrorCategory.PROTOCOL),

    /** Frame version byte is not a supported protocol version. */
    UNSUPPORTED_VERSION(ErrorCategory.PROTOCOL),

    /** Frame type byte is not a known message type. */
    UNKNOWN_MESSAGE_TYPE(ErrorCategory.PROTOCOL),

    /** Reserved flag bits are set. */
    RESERVED_FLAGS(ErrorCategory.PROTOCOL),

    /** Payload flagged as UTF-8 JSON is not valid UTF-8 JSON. */
    MALFORMED_PAYLOAD(ErrorCategory.PROTOCOL),

    /** Payload is valid but does not have the shape the message type requires. */
    INVALID_PAYLOAD(ErrorCategory.APPLICATION),

    /** Room name is missing, not a string, or not 1-64 characters. */
    INVALID_ROOM_NAME(ErrorCategory.APPLICATION),

    /** Target room does not exist. */
    ROOM_NOT_FOUND(ErrorCategory.APPLICATION),

    /** Sender is not a member of the target room. */
    NOT_IN_ROOM(ErrorCategory.APPLICATION),

    /** MESSAGE payload has no content. */
    MISSING_CONTENT(ErrorCategory.APPLICATION),

    /** Socket-level failure. */
    TRANSPORT_FAILURE(ErrorCategory.TRANSPORT),

    /** Outbound backlog for a slow consumer exceeded its bound. */
    WRITE_BACKLOG_EXCEEDED(ErrorCategory.TRANSPORT),

    /** Unexpected failure inside a message handler. */
    INTERNAL_ERROR(ErrorCategory.INTERNAL);

    private final ErrorCategory category;

    ErrorCode(ErrorCategory category) {
        this.category = category;
    }

    /**
     * Returns the category that decides how the connection reacts.
     *
     * @return the error category
     */
    public ErrorCategory category() {
        return category;
    }
}
