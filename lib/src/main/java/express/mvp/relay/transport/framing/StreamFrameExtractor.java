package express.mvp.relay.transport.framing;

import express.mvp.relay.transport.error.ErrorCode;
import express.mvp.relay.transport.error.ProtocolException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

/**
 * Recovers frame boundaries from an arbitrarily fragmented or coalesced byte stream.
 *
 * <p>The extractor has no notion of "one read = one message". It looks only at the bytes between
 * the buffer's position and limit: if a complete frame is there it is returned and the position
 * is advanced past it, otherwise nothing is consumed and {@code null} is returned. Callers keep
 * appending input and calling {@link #extract} until it returns {@code null}.
 *
 * <pre>{@code
 * Frame frame;
 * while ((frame = extractor.extract(buffer)) != null) {
 *     handle(codec.decode(frame));
 * }
 * // buffer.position() now marks the first unconsumed byte
 * }</pre>
 *
 * <h2>Validation</h2>
 *
 * <p>The length field is validated as soon as its 4 bytes are available, before the body has
 * arrived, so a peer cannot stall the parser by announcing a frame that will never fit.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is immutable and thread-safe; the buffers passed to it are not.
 *
 * @see FrameCodec
 */
public final class StreamFrameExtractor {

    private final int maxFrameSize;

    /** Creates an extractor enforcing the default maximum frame size. */
    public StreamFrameExtractor() {
        this(FrameCodec.DEFAULT_MAX_FRAME_SIZE);
    }

    /**
     * Creates an extractor.
     *
     * @param maxFrameSize largest accepted frame, length field included
     */
    public StreamFrameExtractor(int maxFrameSize) {
        if (maxFrameSize < FrameCodec.HEADER_SIZE) {
            throw new IllegalArgumentException(
                    "maxFrameSize must be at least " + FrameCodec.HEADER_SIZE + ": " + maxFrameSize);
        }
        this.maxFrameSize = maxFrameSize;
    }

    /**
     * Removes one complete frame from the front of the buffer.
     *
     * @param buffer readable bytes between position and limit; the position is advanced past the
     *     frame when one is returned and left untouched otherwise
     * @return the frame, whose payload is a read-only view into {@code buffer}, or null if more
     *     input is needed
     * @throws ProtocolException if the length field is below 3 or the frame would exceed the
     *     maximum frame size
     */
    public Frame extract(ByteBuffer buffer) {
        if (buffer.remaining() < FrameCodec.LENGTH_FIELD_SIZE) {
            return null;
        }

        int start = buffer.position();
        long frameLength = readUnsignedInt(buffer, start);

        if (frameLength < FrameCodec.HEADER_REMAINDER_SIZE) {
            throw new ProtocolException(ErrorCode.INVALID_LENGTH,
                    "Invalid frame length " + frameLength + ": must be at least "
                            + FrameCodec.HEADER_REMAINDER_SIZE);
        }
        long wireSize = FrameCodec.LENGTH_FIELD_SIZE + frameLength;
        if (wireSize > maxFrameSize) {
            throw new ProtocolException(ErrorCode.FRAME_TOO_LARGE, String.format(
                    "Frame size %d exceeds maximum allowed size %d", wireSize, maxFrameSize));
        }

        if (buffer.remaining() < wireSize) {
            return null;
        }

        int headerStart = start + FrameCodec.LENGTH_FIELD_SIZE;
        int version = buffer.get(headerStart) & 0xFF;
        int type = buffer.get(headerStart + 1) & 0xFF;
        int flags = buffer.get(headerStart + 2) & 0xFF;

        int payloadStart = start + FrameCodec.HEADER_SIZE;
        int payloadLength = (int) frameLength - FrameCodec.HEADER_REMAINDER_SIZE;
        ByteBuffer payload = buffer.slice(payloadStart, payloadLength).asReadOnlyBuffer();

        buffer.position(start + (int) wireSize);
        return new Frame((int) frameLength, version, type, flags, payload);
    }

    /**
     * Removes every complete frame from the front of the buffer.
     *
     * @param buffer readable bytes; the position is advanced past the last complete frame
     * @return the frames in stream order, empty if none is complete
     * @throws ProtocolException if a length field is invalid
     */
    public List<Frame> extractAll(ByteBuffer buffer) {
        List<Frame> frames = new ArrayList<>();
        Frame frame;
        while ((frame = extract(buffer)) != null) {
            frames.add(frame);
        }
        return frames;
    }

    public int maxFrameSize() {
        return maxFrameSize;
    }

    // Byte-wise so the caller's buffer byte order does not matter.
    private static long readUnsignedInt(ByteBuffer buffer, int index) {
        return ((long) (buffer.get(index) & 0xFF) << 24)
                | ((buffer.get(index + 1) & 0xFF) << 16)
                | ((buffer.get(index + 2) & 0xFF) << 8)
                | (buffer.get(index + 3) & 0xFF);
    }
}
