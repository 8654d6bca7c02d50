package express.mvp.relay.transport.framing;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.relay.transport.error.ErrorCode;
import express.mvp.relay.transport.error.ProtocolException;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Unit tests for {@link StreamFrameExtractor}. */
@DisplayName("StreamFrameExtractor")
class StreamFrameExtractorTest {

    private final FrameCodec codec = new FrameCodec();

    private StreamFrameExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new StreamFrameExtractor();
    }

    private static ByteBuffer lengthOnly(long length) {
        ByteBuffer buffer = ByteBuffer.allocate(4);
        buffer.putInt((int) length).flip();
        return buffer;
    }

    // ==================== Complete Frame Tests ====================

    @Test
    @DisplayName("Extracts a complete frame and advances past it")
    void extractsCompleteFrame() {
        byte[] wire = codec.encode(MessageType.JOIN_ROOM, Map.of("room", "g"));
        ByteBuffer buffer = ByteBuffer.wrap(wire);

        Frame frame = extractor.extract(buffer);

        assertNotNull(frame);
        assertEquals(wire.length - 4, frame.length());
        assertEquals(FrameCodec.PROTOCOL_VERSION, frame.version());
        assertEquals(MessageType.JOIN_ROOM.code(), frame.type());
        assertEquals(FrameFlags.UTF8_JSON, frame.flags());
        assertEquals(wire.length, frame.wireSize());
        assertEquals(frame.payloadLength(), frame.payload().remaining());
        assertFalse(buffer.hasRemaining());
    }

    @Test
    @DisplayName("Extracts a header-only frame")
    void extractsHeaderOnlyFrame() {
        ByteBuffer buffer = ByteBuffer.wrap(codec.encode(MessageType.HEARTBEAT, null));

        Frame frame = extractor.extract(buffer);

        assertEquals(3, frame.length());
        assertEquals(0, frame.payloadLength());
    }

    @Test
    @DisplayName("Extracts coalesced frames in order and keeps the partial tail")
    void extractsCoalescedFrames() {
        byte[] a = codec.encode(MessageType.HELLO, Map.of());
        byte[] b = codec.encode(MessageType.HEARTBEAT, null);
        byte[] c = codec.encode(MessageType.MESSAGE, Map.of("room", "g", "content", "x"));
        ByteBuffer buffer = ByteBuffer.allocate(a.length + b.length + c.length - 2);
        buffer.put(a).put(b).put(c, 0, c.length - 2).flip();

        List<Frame> frames = extractor.extractAll(buffer);

        assertEquals(2, frames.size());
        assertEquals(MessageType.HELLO.code(), frames.get(0).type());
        assertEquals(MessageType.HEARTBEAT.code(), frames.get(1).type());
        assertEquals(c.length - 2, buffer.remaining());
    }

    // ==================== Fragmentation Tests ====================

    @Test
    @DisplayName("Every split point yields the same frame exactly once")
    void everySplitPoint() {
        byte[] wire = codec.encode(MessageType.MESSAGE, Map.of("room", "general", "content", "hello"));

        for (int split = 0; split <= wire.length; split++) {
            ByteBuffer buffer = ByteBuffer.allocate(wire.length);
            buffer.put(wire, 0, split).flip();

            Frame partial = extractor.extract(buffer);
            if (split < wire.length) {
                assertNull(partial, "split at " + split);
                assertEquals(0, buffer.position(), "position untouched at split " + split);
                buffer.compact();
                buffer.put(wire, split, wire.length - split).flip();
                partial = extractor.extract(buffer);
            }

            assertNotNull(partial, "split at " + split);
            assertEquals(wire.length - FrameCodec.HEADER_SIZE, partial.payloadLength());
            assertNull(extractor.extract(buffer));
        }
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 3})
    @DisplayName("Fewer than four bytes is incomplete")
    void partialLengthIsIncomplete(int available) {
        ByteBuffer buffer = ByteBuffer.wrap(new byte[] {0, 0, 0, 5}, 0, available);

        assertNull(extractor.extract(buffer));
    }

    // ==================== Validation Tests ====================

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2})
    @DisplayName("Length below 3 is INVALID_LENGTH")
    void lengthBelowHeader(int length) {
        ProtocolException e = assertThrows(ProtocolException.class,
                () -> extractor.extract(lengthOnly(length)));
        assertEquals(ErrorCode.INVALID_LENGTH, e.code());
    }

    @Test
    @DisplayName("Oversized length is rejected as soon as the length field arrives")
    void oversizedLengthRejectedEarly() {
        ProtocolException e = assertThrows(ProtocolException.class,
                () -> extractor.extract(lengthOnly(FrameCodec.DEFAULT_MAX_FRAME_SIZE)));
        assertEquals(ErrorCode.FRAME_TOO_LARGE, e.code());
    }

    @Test
    @DisplayName("Length field is read as unsigned")
    void lengthIsUnsigned() {
        ProtocolException e = assertThrows(ProtocolException.class,
                () -> extractor.extract(lengthOnly(0xFFFFFFFFL)));
        assertEquals(ErrorCode.FRAME_TOO_LARGE, e.code());
    }

    @Test
    @DisplayName("Frame of exactly the maximum size is accepted")
    void maxSizeAccepted() {
        StreamFrameExtractor small = new StreamFrameExtractor(32);
        ByteBuffer buffer = ByteBuffer.allocate(32);
        buffer.putInt(28).put((byte) 1).put((byte) 4).put((byte) 0).position(32);
        buffer.flip();

        assertNotNull(small.extract(buffer));
    }

    @Test
    @DisplayName("Maximum below the header size is rejected")
    void invalidMaximum() {
        assertThrows(IllegalArgumentException.class, () -> new StreamFrameExtractor(6));
    }
}
