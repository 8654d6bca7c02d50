package express.mvp.relay.transport.framing;

import com.fasterxml.jackson.databind.JsonNode;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Decoded frame payload.
 *
 * <p>A payload is exactly one of three variants, chosen by the frame's flags:
 *
 * <ul>
 *   <li>{@link Json} - the UTF8_JSON flag was set; holds the parsed JSON tree
 *   <li>{@link Binary} - the BINARY flag, or no known encoding flag, was set
 *   <li>{@link #EMPTY} - the frame carried no payload bytes
 * </ul>
 *
 * <p>Handlers resolve the variant explicitly with {@link #kind()} or the {@code as} accessors,
 * which fail rather than coerce.
 */
public abstract class Payload {

    /** Variant tag. */
    public enum Kind {
        EMPTY,
        JSON,
        BINARY
    }

    /** The payload of a frame with no payload bytes. */
    public static final Payload EMPTY = new Empty();

    private Payload() {}

    /**
     * Wraps a parsed JSON tree.
     *
     * @param value the JSON value
     * @return a JSON payload
     */
    public static Payload json(JsonNode value) {
        return new Json(value);
    }

    /**
     * Wraps raw bytes. The array is copied.
     *
     * @param bytes the payload bytes
     * @return a binary payload, or {@link #EMPTY} for a zero-length array
     */
    public static Payload binary(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        return bytes.length == 0 ? EMPTY : new Binary(bytes.clone());
    }

    public abstract Kind kind();

    /**
     * Returns the JSON tree of a {@link Json} payload.
     *
     * @return the JSON value
     * @throws IllegalStateException if this is not a JSON payload
     */
    public JsonNode asJson() {
        throw new IllegalStateException("Payload is " + kind() + ", not JSON");
    }

    /**
     * Returns a copy of the bytes of a {@link Binary} payload.
     *
     * @return the payload bytes
     * @throws IllegalStateException if this is not a binary payload
     */
    public byte[] asBytes() {
        throw new IllegalStateException("Payload is " + kind() + ", not BINARY");
    }

    public boolean isEmpty() {
        return kind() == Kind.EMPTY;
    }

    /** JSON variant. */
    public static final class Json extends Payload {
        private final JsonNode value;

        private Json(JsonNode value) {
            this.value = Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public Kind kind() {
            return Kind.JSON;
        }

        @Override
        public JsonNode asJson() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Json other && value.equals(other.value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return "Json" + value;
        }
    }

    /** Raw bytes variant. */
    public static final class Binary extends Payload {
        private final byte[] bytes;

        private Binary(byte[] bytes) {
            this.bytes = bytes;
        }

        @Override
        public Kind kind() {
            return Kind.BINARY;
        }

        @Override
        public byte[] asBytes() {
            return bytes.clone();
        }

        public int size() {
            return bytes.length;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Binary other && Arrays.equals(bytes, other.bytes);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(bytes);
        }

        @Override
        public String toString() {
            if (bytes.length <= 32) {
                return "Binary[" + new String(bytes, StandardCharsets.ISO_8859_1) + "]";
            }
            return "Binary[" + bytes.length + " bytes]";
        }
    }

    private static final class Empty extends Payload {
        @Override
        public Kind kind() {
            return Kind.EMPTY;
        }

        @Override
        public String toString() {
            return "Empty";
        }
    }
}
