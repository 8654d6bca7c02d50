package express.mvp.relay.server.handler;

import express.mvp.relay.server.dispatch.MessageHandler;
import express.mvp.relay.server.room.RoomRegistry;
import express.mvp.relay.transport.Connection;
import express.mvp.relay.transport.framing.MessageType;
import express.mvp.relay.transport.framing.ParsedMessage;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Joins the sender to a room and confirms. Joining a room twice is confirmed again.
 *
 * <pre>{@code
 * -> {"room": "general"}
 * <- {"status": "joined", "room": "general"}
 * }</pre>
 */
public final class JoinRoomHandler implements MessageHandler {

    private final RoomRegistry rooms;

    public JoinRoomHandler(RoomRegistry rooms) {
        this.rooms = rooms;
    }

    @Override
    public void handle(Connection connection, ParsedMessage message) {
        String room = RoomRegistry.validateName(
                JsonPayloads.requireRoomField(JsonPayloads.requireObject(message)));
        rooms.join(connection, room);

        Map<String, Object> reply = new LinkedHashMap<>();
        reply.put("status", "joined");
        reply.put("room", room);
        connection.send(MessageType.JOIN_ROOM, reply);
    }
}
