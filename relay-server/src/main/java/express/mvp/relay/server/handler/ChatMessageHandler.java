package express.mvp.relay.server.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import express.mvp.relay.server.dispatch.MessageHandler;
import express.mvp.relay.server.room.Room;
import express.mvp.relay.server.room.RoomRegistry;
import express.mvp.relay.transport.Connection;
import express.mvp.relay.transport.error.ApplicationException;
import express.mvp.relay.transport.error.ErrorCode;
import express.mvp.relay.transport.error.ProtocolException;
import express.mvp.relay.transport.framing.ParsedMessage;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Relays a chat message to the other members of a room. The sender does not get its own message
 * back.
 *
 * <pre>{@code
 * -> {"room": "general", "content": "hi"}
 * => {"room": "general", "from": "conn-1", "content": "hi", "timestamp": 1700000000000}
 * }</pre>
 *
 * <p>Errors, in the order they are checked: {@code INVALID_ROOM_NAME}, {@code MISSING_CONTENT},
 * {@code ROOM_NOT_FOUND}, {@code NOT_IN_ROOM}. A message whose relayed frame would exceed the
 * maximum frame size is rejected with {@code INVALID_PAYLOAD}; the sender stays connected.
 *
 * <p>An explicit {@code "content": null} is relayed as is; only an absent field is missing.
 */
public final class ChatMessageHandler implements MessageHandler {

    private static final Logger LOGGER = Logger.getLogger(ChatMessageHandler.class.getName());

    private final RoomRegistry rooms;

    private final Clock clock;

    public ChatMessageHandler(RoomRegistry rooms) {
        this(rooms, Clock.systemUTC());
    }

    public ChatMessageHandler(RoomRegistry rooms, Clock clock) {
        this.rooms = rooms;
        this.clock = clock;
    }

    @Override
    public void handle(Connection connection, ParsedMessage message) {
        ObjectNode payload = JsonPayloads.requireObject(message);
        String name = RoomRegistry.validateName(JsonPayloads.requireRoomField(payload));

        JsonNode content = payload.get("content");
        if (content == null) {
            throw new ApplicationException(ErrorCode.MISSING_CONTENT, "Message content required");
        }

        Room room = rooms.getRoom(name);
        if (room == null) {
            throw new ApplicationException(
                    ErrorCode.ROOM_NOT_FOUND, "Room '" + name + "' does not exist");
        }
        if (!room.hasMember(connection.id())) {
            throw new ApplicationException(
                    ErrorCode.NOT_IN_ROOM, "You are not in room '" + name + "'");
        }

        Map<String, Object> relayed = new LinkedHashMap<>();
        relayed.put("room", name);
        relayed.put("from", connection.id());
        relayed.put("content", content);
        relayed.put("timestamp", clock.millis());
        int delivered;
        try {
            delivered = rooms.broadcast(name, relayed, connection.id());
        } catch (ProtocolException e) {
            if (e.code() != ErrorCode.FRAME_TOO_LARGE) {
                throw e;
            }
            throw new ApplicationException(
                    ErrorCode.INVALID_PAYLOAD, "Message too large to relay", e);
        }

        LOGGER.log(Level.FINE, "[{0}] Message to room {1} delivered to {2}",
                new Object[] {connection.id(), name, delivered});
    }
}
