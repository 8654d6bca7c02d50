package express.mvp.relay.transport.framing;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import express.mvp.relay.transport.error.ErrorCode;
import express.mvp.relay.transport.error.ProtocolException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Unit tests for {@link FrameCodec}. */
@DisplayName("FrameCodec")
class FrameCodecTest {

    private FrameCodec codec;

    @BeforeEach
    void setUp() {
        codec = new FrameCodec();
    }

    private ParsedMessage decodeWire(byte[] frame) {
        return codec.decode(ByteBuffer.wrap(frame, FrameCodec.LENGTH_FIELD_SIZE,
                frame.length - FrameCodec.LENGTH_FIELD_SIZE));
    }

    private static byte[] remainder(int type, int flags, byte[] payload) {
        ByteBuffer buffer = ByteBuffer.allocate(FrameCodec.HEADER_REMAINDER_SIZE + payload.length);
        buffer.put((byte) FrameCodec.PROTOCOL_VERSION).put((byte) type).put((byte) flags);
        buffer.put(payload);
        return buffer.array();
    }

    // ==================== Encoding Tests ====================

    @Nested
    @DisplayName("Encoding")
    class EncodingTests {

        @Test
        @DisplayName("Writes a big-endian length, version, type and flags")
        void writesHeader() {
            byte[] frame = codec.encode(MessageType.JOIN_ROOM, Map.of("room", "g"));
            ByteBuffer buffer = ByteBuffer.wrap(frame);

            assertEquals(frame.length - 4, buffer.getInt());
            assertEquals(FrameCodec.PROTOCOL_VERSION, buffer.get());
            assertEquals(MessageType.JOIN_ROOM.code(), buffer.get());
            assertEquals(FrameFlags.UTF8_JSON, buffer.get());
            assertEquals("{\"room\":\"g\"}",
                    new String(frame, FrameCodec.HEADER_SIZE, frame.length - FrameCodec.HEADER_SIZE,
                            StandardCharsets.UTF_8));
        }

        @Test
        @DisplayName("Null payload produces a 7-byte frame with no flags")
        void nullPayload() {
            byte[] frame = codec.encode(MessageType.HEARTBEAT, null);

            assertEquals(FrameCodec.HEADER_SIZE, frame.length);
            assertArrayEquals(new byte[] {0, 0, 0, 3, 1, 5, 0}, frame);
        }

        @Test
        @DisplayName("Byte arrays are sent as binary")
        void bytesAreBinary() {
            byte[] frame = codec.encode(MessageType.MESSAGE, new byte[] {9, 8, 7});

            assertEquals(FrameFlags.BINARY, frame[6]);
            assertEquals(10, frame.length);
        }

        @Test
        @DisplayName("Explicit flags are written as given")
        void explicitFlags() {
            byte[] frame = codec.encode(MessageType.MESSAGE, Map.of("a", 1), FrameFlags.NONE);

            assertEquals(FrameFlags.NONE, frame[6]);
        }

        @Test
        @DisplayName("Frame exceeding the maximum size is rejected")
        void oversizedFrameRejected() {
            FrameCodec small = new FrameCodec(16);

            ProtocolException e = assertThrows(ProtocolException.class,
                    () -> small.encode(MessageType.MESSAGE, new byte[10]));
            assertEquals(ErrorCode.FRAME_TOO_LARGE, e.code());
        }

        @Test
        @DisplayName("Frame of exactly the maximum size is accepted")
        void maxSizedFrameAccepted() {
            FrameCodec small = new FrameCodec(16);

            assertEquals(16, small.encode(MessageType.MESSAGE, new byte[9]).length);
        }

        @ParameterizedTest
        @ValueSource(ints = {-1, 256, 1000})
        @DisplayName("Type outside 0-255 is rejected")
        void typeOutOfRange(int type) {
            assertThrows(IllegalArgumentException.class, () -> codec.encode(type, null, null));
        }

        @Test
        @DisplayName("Unserializable payload is rejected")
        void unserializablePayload() {
            assertThrows(IllegalArgumentException.class,
                    () -> codec.encode(MessageType.MESSAGE, new Object()));
        }
    }

    // ==================== Decoding Tests ====================

    @Nested
    @DisplayName("Decoding")
    class DecodingTests {

        @Test
        @DisplayName("Decodes a JSON payload")
        void decodesJson() {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("room", "general");
            payload.put("content", List.of(1, 2));

            ParsedMessage message = decodeWire(codec.encode(MessageType.MESSAGE, payload));

            assertEquals(FrameCodec.PROTOCOL_VERSION, message.version());
            assertEquals(MessageType.MESSAGE, message.messageType());
            JsonNode json = message.payload().asJson();
            assertEquals("general", json.get("room").asText());
            assertEquals(2, json.get("content").size());
        }

        @Test
        @DisplayName("Decodes a JSON string and null literal")
        void decodesScalars() {
            assertEquals("hi", decodeWire(codec.encode(MessageType.MESSAGE, "hi"))
                    .payload().asJson().asText());
            byte[] nullLiteral = remainder(4, FrameFlags.UTF8_JSON,
                    "null".getBytes(StandardCharsets.UTF_8));
            assertTrue(codec.decode(ByteBuffer.wrap(nullLiteral)).payload().asJson().isNull());
        }

        @Test
        @DisplayName("Empty payload decodes as EMPTY regardless of flags")
        void emptyPayload() {
            ParsedMessage message = codec.decode(
                    ByteBuffer.wrap(remainder(5, FrameFlags.UTF8_JSON, new byte[0])));

            assertSame(Payload.EMPTY, message.payload());
            assertTrue(message.payload().isEmpty());
        }

        @Test
        @DisplayName("Payload without the JSON flag is binary")
        void unflaggedIsBinary() {
            byte[] bytes = "{\"a\":1}".getBytes(StandardCharsets.UTF_8);
            ParsedMessage message = codec.decode(ByteBuffer.wrap(remainder(4, FrameFlags.NONE, bytes)));

            assertEquals(Payload.Kind.BINARY, message.payload().kind());
            assertArrayEquals(bytes, message.payload().asBytes());
        }

        @Test
        @DisplayName("Unknown type codes decode without error")
        void unknownTypeDecodes() {
            ParsedMessage message = codec.decode(ByteBuffer.wrap(remainder(0x7F, 0, new byte[0])));

            assertEquals(0x7F, message.type());
            assertNull(message.messageType());
        }

        @Test
        @DisplayName("Invalid JSON is MALFORMED_PAYLOAD")
        void invalidJson() {
            byte[] bytes = "{\"room\":".getBytes(StandardCharsets.UTF_8);

            ProtocolException e = assertThrows(ProtocolException.class,
                    () -> codec.decode(ByteBuffer.wrap(remainder(2, FrameFlags.UTF8_JSON, bytes))));
            assertEquals(ErrorCode.MALFORMED_PAYLOAD, e.code());
        }

        @Test
        @DisplayName("Trailing tokens after the JSON value are rejected")
        void trailingTokens() {
            byte[] bytes = "{} {}".getBytes(StandardCharsets.UTF_8);

            assertThrows(ProtocolException.class,
                    () -> codec.decode(ByteBuffer.wrap(remainder(2, FrameFlags.UTF8_JSON, bytes))));
        }

        @Test
        @DisplayName("Invalid UTF-8 in a JSON payload is MALFORMED_PAYLOAD")
        void invalidUtf8() {
            byte[] bytes = {'"', (byte) 0xC3, (byte) 0x28, '"'};

            ProtocolException e = assertThrows(ProtocolException.class,
                    () -> codec.decode(ByteBuffer.wrap(remainder(4, FrameFlags.UTF8_JSON, bytes))));
            assertEquals(ErrorCode.MALFORMED_PAYLOAD, e.code());
        }

        @Test
        @DisplayName("Remainder shorter than the header is INVALID_LENGTH")
        void shortRemainder() {
            ProtocolException e = assertThrows(ProtocolException.class,
                    () -> codec.decode(ByteBuffer.wrap(new byte[] {1, 2})));
            assertEquals(ErrorCode.INVALID_LENGTH, e.code());
        }

        @Test
        @DisplayName("Decoding does not move the caller's buffer")
        void decodeLeavesPosition() {
            ByteBuffer buffer = ByteBuffer.wrap(remainder(5, 0, new byte[0]));

            codec.decode(buffer);

            assertEquals(0, buffer.position());
        }
    }
}
