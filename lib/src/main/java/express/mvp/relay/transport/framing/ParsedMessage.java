package express.mvp.relay.transport.framing;

import java.util.Objects;

/**
 * Application-level view of a frame: header fields plus the decoded payload.
 *
 * <p>Created by {@link FrameCodec#decode} and handed straight to the dispatcher; it is not
 * retained by the transport.
 *
 * @param version the protocol version byte
 * @param type the type byte, possibly an unassigned code
 * @param flags the flags byte
 * @param payload the decoded payload, never null
 */
public record ParsedMessage(int version, int type, int flags, Payload payload) {

    public ParsedMessage {
        Objects.requireNonNull(payload, "payload must not be null");
    }

    /**
     * Resolves the type byte.
     *
     * @return the message type, or null if the code is not assigned
     */
    public MessageType messageType() {
        return MessageType.fromCode(type);
    }
}
