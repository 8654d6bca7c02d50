package express.mvp.relay.transport.framing;

import java.nio.ByteBuffer;

/**
 * One frame as it appears on the wire, with its payload still undecoded.
 *
 * <p>The {@code payload} is a read-only view into the buffer the frame was extracted from. It is
 * valid until that buffer is next appended to, so decode it before reading more input.
 *
 * @param length the length field: bytes following it, header remainder included
 * @param version the version byte
 * @param type the type byte
 * @param flags the flags byte
 * @param payload view of the {@code length - 3} payload bytes
 */
public record Frame(int length, int version, int type, int flags, ByteBuffer payload) {

    /**
     * Returns the number of payload bytes.
     *
     * @return {@code length - 3}
     */
    public int payloadLength() {
        return length - FrameCodec.HEADER_REMAINDER_SIZE;
    }

    /**
     * Returns the total size of the frame on the wire.
     *
     * @return {@code 4 + length}
     */
    public int wireSize() {
        return FrameCodec.LENGTH_FIELD_SIZE + length;
    }
}
