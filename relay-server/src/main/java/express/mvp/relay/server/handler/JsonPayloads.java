package express.mvp.relay.server.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import express.mvp.relay.transport.error.ApplicationException;
import express.mvp.relay.transport.error.ErrorCode;
import express.mvp.relay.transport.framing.ParsedMessage;
import express.mvp.relay.transport.framing.Payload;

/** Payload checks shared by the handlers. */
final class JsonPayloads {

    private JsonPayloads() {}

    /**
     * Returns the payload as a JSON object.
     *
     * @throws ApplicationException with {@link ErrorCode#INVALID_PAYLOAD} for any other payload
     */
    static ObjectNode requireObject(ParsedMessage message) {
        Payload payload = message.payload();
        if (payload.kind() == Payload.Kind.JSON && payload.asJson() instanceof ObjectNode object) {
            return object;
        }
        throw new ApplicationException(ErrorCode.INVALID_PAYLOAD, "Expected a JSON object payload");
    }

    /**
     * Returns the payload as a JSON object, or null for an empty payload.
     *
     * @throws ApplicationException with {@link ErrorCode#INVALID_PAYLOAD} for any other payload
     */
    static ObjectNode optionalObject(ParsedMessage message) {
        return message.payload().isEmpty() ? null : requireObject(message);
    }

    /**
     * Returns the {@code room} field.
     *
     * @return the raw room name, not yet trimmed
     * @throws ApplicationException with {@link ErrorCode#INVALID_ROOM_NAME} if absent or not text
     */
    static String requireRoomField(ObjectNode payload) {
        JsonNode room = payload.get("room");
        if (room == null || !room.isTextual()) {
            throw new ApplicationException(ErrorCode.INVALID_ROOM_NAME, "Room name required");
        }
        return room.textValue();
    }

    static String optionalText(ObjectNode payload, String field) {
        if (payload == null) {
            return null;
        }
        JsonNode value = payload.get(field);
        return value != null && value.isTextual() ? value.textValue() : null;
    }
}
