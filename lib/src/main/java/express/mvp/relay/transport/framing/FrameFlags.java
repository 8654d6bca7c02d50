package express.mvp.relay.transport.framing;

/**
 * Bit assignments of the {@code flags} byte.
 *
 * <pre>
 * bit 0  UTF8_JSON   payload is UTF-8 encoded JSON
 * bit 1  BINARY      payload is raw bytes
 * bit 2  COMPRESSED  reserved, compression is not implemented
 * bit 3-7            reserved, must be 0
 * </pre>
 */
public final class FrameFlags {

    /** No flags. */
    public static final int NONE = 0;

    /** Payload is UTF-8 encoded JSON. */
    public static final int UTF8_JSON = 0b0000_0001;

    /** Payload is raw bytes. */
    public static final int BINARY = 0b0000_0010;

    /** Reserved for compression. */
    public static final int COMPRESSED = 0b0000_0100;

    /** Every bit this implementation accepts on inbound frames. */
    public static final int SUPPORTED_MASK = UTF8_JSON | BINARY;

    private FrameFlags() {
        // Constants
    }

    public static boolean isJson(int flags) {
        return (flags & UTF8_JSON) != 0;
    }

    public static boolean isBinary(int flags) {
        return (flags & BINARY) != 0;
    }

    /**
     * Checks if any bit outside {@link #SUPPORTED_MASK} is set.
     *
     * @param flags the flags byte
     * @return true if a reserved bit, including the compression bit, is set
     */
    public static boolean hasReservedBits(int flags) {
        return (flags & ~SUPPORTED_MASK & 0xFF) != 0;
    }
}
