package express.mvp.relay.transport.framing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import express.mvp.relay.transport.error.ErrorCode;
import express.mvp.relay.transport.error.ProtocolException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Converts (type, payload, flags) tuples to wire frames and back.
 *
 * <h2>Frame Format</h2>
 *
 * <pre>
 * ┌──────────────┬─────────┬────────┬────────┬──────────────────────┐
 * │ length (4,BE)│ version │  type  │ flags  │ payload (length - 3) │
 * └──────────────┴─────────┴────────┴────────┴──────────────────────┘
 *        ▲
 *        └── counts every byte after itself: 3 + payload length
 * </pre>
 *
 * <h2>Payload Encoding</h2>
 *
 * <ul>
 *   <li>{@code null} - no payload bytes
 *   <li>{@code byte[]}, {@link ByteBuffer} or {@link Payload.Binary} - raw bytes, BINARY flag
 *   <li>anything else - serialized as UTF-8 JSON with Jackson, UTF8_JSON flag
 * </ul>
 *
 * <p>The encoding flag is only filled in automatically when the caller does not supply flags;
 * explicit flags are written verbatim.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is immutable and thread-safe. The same instance is shared by every connection.
 *
 * @see StreamFrameExtractor
 */
public final class FrameCodec {

    /** Protocol version written into every frame. */
    public static final int PROTOCOL_VERSION = 1;

    /** Size of the length field. */
    public static final int LENGTH_FIELD_SIZE = 4;

    /** Size of version + type + flags. */
    public static final int HEADER_REMAINDER_SIZE = 3;

    /** Size of the complete fixed header. */
    public static final int HEADER_SIZE = LENGTH_FIELD_SIZE + HEADER_REMAINDER_SIZE;

    /** Maximum total frame size, length field included: 10 MiB. */
    public static final int DEFAULT_MAX_FRAME_SIZE = 10 * 1024 * 1024;

    private static final byte[] NO_BYTES = new byte[0];

    private final ObjectMapper mapper;
    private final int maxFrameSize;

    /** Creates a codec with the default maximum frame size. */
    public FrameCodec() {
        this(DEFAULT_MAX_FRAME_SIZE);
    }

    /**
     * Creates a codec with a custom maximum frame size.
     *
     * @param maxFrameSize the largest frame this codec will produce, length field included
     */
    public FrameCodec(int maxFrameSize) {
        this(new ObjectMapper(), maxFrameSize);
    }

    /**
     * Creates a codec with a caller-supplied mapper.
     *
     * @param mapper the Jackson mapper used for JSON payloads; trailing tokens are always rejected
     * @param maxFrameSize the largest frame this codec will produce, length field included
     */
    public FrameCodec(ObjectMapper mapper, int maxFrameSize) {
        Objects.requireNonNull(mapper, "mapper must not be null");
        if (maxFrameSize < HEADER_SIZE) {
            throw new IllegalArgumentException("maxFrameSize must be at least " + HEADER_SIZE);
        }
        this.mapper = mapper.copy().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.maxFrameSize = maxFrameSize;
    }

    /**
     * Encodes a frame with automatically detected flags.
     *
     * @param type the message type
     * @param payload the payload, may be null
     * @return the complete frame, length field included
     */
    public byte[] encode(MessageType type, Object payload) {
        return encode(type.code(), payload, null);
    }

    /**
     * Encodes a frame.
     *
     * @param type the message type
     * @param payload the payload, may be null
     * @param flags explicit flags, or null to derive them from the payload
     * @return the complete frame, length field included
     */
    public byte[] encode(MessageType type, Object payload, Integer flags) {
        return encode(type.code(), payload, flags);
    }

    /**
     * Encodes a frame from a raw type code.
     *
     * @param type the type byte, 0-255
     * @param payload the payload, may be null
     * @param flags explicit flags 0-255, or null to derive them from the payload
     * @return the complete frame, length field included
     * @throws ProtocolException if the frame would exceed the maximum frame size
     * @throws IllegalArgumentException if type or flags are out of range, or the payload cannot be
     *     serialized to JSON
     */
    public byte[] encode(int type, Object payload, Integer flags) {
        checkByte("type", type);
        if (flags != null) {
            checkByte("flags", flags);
        }

        byte[] body;
        int detectedFlags;
        if (payload == null || payload == Payload.EMPTY) {
            body = NO_BYTES;
            detectedFlags = FrameFlags.NONE;
        } else if (payload instanceof byte[] bytes) {
            body = bytes;
            detectedFlags = FrameFlags.BINARY;
        } else if (payload instanceof ByteBuffer buffer) {
            body = new byte[buffer.remaining()];
            buffer.duplicate().get(body);
            detectedFlags = FrameFlags.BINARY;
        } else if (payload instanceof Payload.Binary binary) {
            body = binary.asBytes();
            detectedFlags = FrameFlags.BINARY;
        } else {
            Object value = payload instanceof Payload.Json json ? json.asJson() : payload;
            body = toJson(value);
            detectedFlags = FrameFlags.UTF8_JSON;
        }

        long frameSize = (long) HEADER_SIZE + body.length;
        if (frameSize > maxFrameSize) {
            throw new ProtocolException(ErrorCode.FRAME_TOO_LARGE, String.format(
                    "Frame size %d exceeds maximum allowed size %d", frameSize, maxFrameSize));
        }

        ByteBuffer frame = ByteBuffer.allocate((int) frameSize);
        frame.putInt(HEADER_REMAINDER_SIZE + body.length);
        frame.put((byte) PROTOCOL_VERSION);
        frame.put((byte) type);
        frame.put((byte) (flags != null ? flags : detectedFlags));
        frame.put(body);
        return frame.array();
    }

    /**
     * Decodes an extracted frame.
     *
     * @param frame a frame produced by {@link StreamFrameExtractor}
     * @return the parsed message
     * @throws ProtocolException if the payload is flagged as JSON but is not valid UTF-8 JSON
     */
    public ParsedMessage decode(Frame frame) {
        return new ParsedMessage(
                frame.version(), frame.type(), frame.flags(),
                decodePayload(frame.flags(), frame.payload()));
    }

    /**
     * Decodes one frame's remainder: the bytes after the length field and nothing more.
     *
     * @param remainder version, type, flags and payload of exactly one frame
     * @return the parsed message
     * @throws ProtocolException if the remainder is shorter than the 3-byte header or the payload is
     *     flagged as JSON but is not valid UTF-8 JSON
     */
    public ParsedMessage decode(ByteBuffer remainder) {
        ByteBuffer view = remainder.duplicate();
        if (view.remaining() < HEADER_REMAINDER_SIZE) {
            throw new ProtocolException(ErrorCode.INVALID_LENGTH, String.format(
                    "Frame too short: expected at least %d bytes, got %d",
                    HEADER_REMAINDER_SIZE, view.remaining()));
        }
        int version = view.get() & 0xFF;
        int type = view.get() & 0xFF;
        int flags = view.get() & 0xFF;
        return new ParsedMessage(version, type, flags, decodePayload(flags, view.slice()));
    }

    /**
     * Checks the header fields every inbound frame must carry, whatever its type.
     *
     * @param version the version byte
     * @param flags the flags byte
     * @throws ProtocolException with {@code UNSUPPORTED_VERSION} or {@code RESERVED_FLAGS}
     */
    public static void checkHeader(int version, int flags) {
        if (version != PROTOCOL_VERSION) {
            throw new ProtocolException(ErrorCode.UNSUPPORTED_VERSION,
                    "Unsupported protocol version " + version);
        }
        if (FrameFlags.hasReservedBits(flags)) {
            throw new ProtocolException(ErrorCode.RESERVED_FLAGS, String.format(
                    "Reserved flag bits set: 0x%02x", flags));
        }
    }

    /**
     * Returns the maximum total frame size this codec produces.
     *
     * @return bytes, length field included
     */
    public int maxFrameSize() {
        return maxFrameSize;
    }

    /**
     * Returns the mapper used for JSON payloads, for building payload trees.
     *
     * @return the Jackson mapper
     */
    public ObjectMapper mapper() {
        return mapper;
    }

    private Payload decodePayload(int flags, ByteBuffer payload) {
        if (!payload.hasRemaining()) {
            return Payload.EMPTY;
        }
        if (FrameFlags.isJson(flags)) {
            return Payload.json(parseJson(payload));
        }
        byte[] bytes = new byte[payload.remaining()];
        payload.duplicate().get(bytes);
        return Payload.binary(bytes);
    }

    private JsonNode parseJson(ByteBuffer payload) {
        CharBuffer text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(payload.duplicate());
        } catch (CharacterCodingException e) {
            throw new ProtocolException(
                    ErrorCode.MALFORMED_PAYLOAD, "Invalid UTF-8 in JSON payload", e);
        }
        JsonNode node;
        try {
            node = mapper.readTree(text.toString());
        } catch (JsonProcessingException e) {
            throw new ProtocolException(
                    ErrorCode.MALFORMED_PAYLOAD, "Invalid JSON payload: " + e.getOriginalMessage(), e);
        }
        if (node == null || node.isMissingNode()) {
            throw new ProtocolException(ErrorCode.MALFORMED_PAYLOAD, "Invalid JSON payload: no content");
        }
        return node;
    }

    private byte[] toJson(Object value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Payload is not JSON serializable: " + value.getClass().getName(), e);
        }
    }

    private static void checkByte(String name, int value) {
        if (value < 0 || value > 0xFF) {
            throw new IllegalArgumentException(name + " must be in 0-255: " + value);
        }
    }

    @Override
    public String toString() {
        return "FrameCodec[version=" + PROTOCOL_VERSION + ", maxFrameSize=" + maxFrameSize + "]";
    }
}
