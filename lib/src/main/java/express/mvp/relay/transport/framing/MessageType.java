package express.mvp.relay.transport.framing;

/**
 * Message type codes carried in the {@code type} byte of every frame.
 *
 * <p>Codes outside this table are reserved; receiving one is a protocol violation.
 */
public enum MessageType {
    HELLO(0x01),
    JOIN_ROOM(0x02),
    LEAVE_ROOM(0x03),
    MESSAGE(0x04),
    HEARTBEAT(0x05),
    ERROR(0x06);

    private static final MessageType[] BY_CODE = new MessageType[256];

    static {
        for (MessageType type : values()) {
            BY_CODE[type.code] = type;
        }
    }

    private final int code;

    MessageType(int code) {
        this.code = code;
    }

    /**
     * Returns the wire code of this type.
     *
     * @return the type byte, 0-255
     */
    public int code() {
        return code;
    }

    /**
     * Resolves a wire code.
     *
     * @param code the type byte
     * @return the message type, or null if the code is not assigned
     */
    public static MessageType fromCode(int code) {
        if (code < 0 || code >= BY_CODE.length) {
            return null;
        }
        return BY_CODE[code];
    }
}
