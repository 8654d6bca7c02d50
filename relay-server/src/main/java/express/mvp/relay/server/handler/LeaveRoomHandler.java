package express.mvp.relay.server.handler;

import express.mvp.relay.server.dispatch.MessageHandler;
import express.mvp.relay.server.room.RoomRegistry;
import express.mvp.relay.transport.Connection;
import express.mvp.relay.transport.framing.MessageType;
import express.mvp.relay.transport.framing.ParsedMessage;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Removes the sender from a room and confirms, whether or not it was a member.
 *
 * <pre>{@code
 * -> {"room": "general"}
 * <- {"status": "left", "room": "general"}
 * }</pre>
 */
public final class LeaveRoomHandler implements MessageHandler {

    private final RoomRegistry rooms;

    public LeaveRoomHandler(RoomRegistry rooms) {
        this.rooms = rooms;
    }

    @Override
    public void handle(Connection connection, ParsedMessage message) {
        String room = RoomRegistry.validateName(
                JsonPayloads.requireRoomField(JsonPayloads.requireObject(message)));
        rooms.leave(connection.id(), room);

        Map<String, Object> reply = new LinkedHashMap<>();
        reply.put("status", "left");
        reply.put("room", room);
        connection.send(MessageType.LEAVE_ROOM, reply);
    }
}
