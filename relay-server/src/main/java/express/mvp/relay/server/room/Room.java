package express.mvp.relay.server.room;

import express.mvp.relay.transport.Connection;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A named broadcast group.
 *
 * <p>Members are kept in join order, which is the order a broadcast visits them. Membership is
 * changed only by {@link RoomRegistry}, which creates a room on first join and drops it when the
 * last member leaves.
 */
public final class Room {

    private static final Logger LOGGER = Logger.getLogger(Room.class.getName());

    private final String name;

    private final Map<String, Connection> members = new LinkedHashMap<>();

    Room(String name) {
        this.name = name;
    }

    public String name() {
        return name;
    }

    public synchronized boolean hasMember(String connectionId) {
        return members.containsKey(connectionId);
    }

    public synchronized int memberCount() {
        return members.size();
    }

    public synchronized boolean isEmpty() {
        return members.isEmpty();
    }

    /**
     * Returns the member ids in join order.
     *
     * @return a copy of the member ids
     */
    public synchronized List<String> memberIds() {
        return new ArrayList<>(members.keySet());
    }

    /**
     * Sends one encoded frame to a member, isolating failures.
     *
     * @param target the receiving connection
     * @param frame complete wire bytes of a frame
     * @return true if the frame was handed to the connection, false if the send failed
     */
    public boolean sendTo(Connection target, byte[] frame) {
        try {
            target.sendEncoded(frame);
            return true;
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Broadcast to " + target.id() + " in room " + name
                    + " failed: " + e.getMessage(), e);
            return false;
        }
    }

    synchronized boolean add(Connection connection) {
        return members.putIfAbsent(connection.id(), connection) == null;
    }

    synchronized boolean remove(String connectionId) {
        return members.remove(connectionId) != null;
    }

    synchronized List<Connection> snapshot() {
        return new ArrayList<>(members.values());
    }

    @Override
    public synchronized String toString() {
        return "Room[" + name + ", members=" + members.size() + "]";
    }
}
