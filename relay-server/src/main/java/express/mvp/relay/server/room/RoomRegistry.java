package express.mvp.relay.server.room;

import express.mvp.relay.transport.Connection;
import express.mvp.relay.transport.error.ApplicationException;
import express.mvp.relay.transport.error.ErrorCode;
import express.mvp.relay.transport.framing.FrameCodec;
import express.mvp.relay.transport.framing.MessageType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns every room and the reverse index from connection id to joined rooms.
 *
 * <p>Membership changes are serialized by one registry-wide lock, so a room is created on the
 * first join and removed the moment its last member leaves, with no window in which a join can
 * land in a room that is being dropped. Broadcasts copy the member list under the lock and send
 * outside it.
 *
 * <h2>Broadcast Snapshot</h2>
 *
 * <p>A broadcast goes to the members present when it was called. A member that joins while the
 * frames are being sent does not receive it; a member that leaves during the loop still does,
 * unless its connection is no longer writable, in which case the failed send is logged.
 *
 * <h2>Membership Notices</h2>
 *
 * <p>Joining and leaving send the other members a MESSAGE frame:
 *
 * <pre>{@code
 * {"type": "userJoined", "room": "general", "connectionId": "conn-7"}
 * {"type": "userLeft",   "room": "general", "connectionId": "conn-7"}
 * }</pre>
 */
public final class RoomRegistry {

    private static final Logger LOGGER = Logger.getLogger(RoomRegistry.class.getName());

    /** Longest room name, after trimming. */
    public static final int MAX_ROOM_NAME_LENGTH = 64;

    public static final String USER_JOINED = "userJoined";

    public static final String USER_LEFT = "userLeft";

    private final FrameCodec codec;

    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, Room> rooms = new HashMap<>();

    private final Map<String, Set<String>> roomsByConnection = new HashMap<>();

    private final List<RoomRegistryListener> listeners = new CopyOnWriteArrayList<>();

    public RoomRegistry() {
        this(new FrameCodec());
    }

    /**
     * Creates an empty registry.
     *
     * @param codec encodes broadcast frames, once per broadcast
     */
    public RoomRegistry(FrameCodec codec) {
        this.codec = codec;
    }

    public void addListener(RoomRegistryListener listener) {
        listeners.add(listener);
    }

    public boolean removeListener(RoomRegistryListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Validates and normalizes a room name.
     *
     * @param raw the requested name
     * @return the trimmed name
     * @throws ApplicationException with {@link ErrorCode#INVALID_ROOM_NAME} unless the trimmed name
     *     has 1 to 64 characters
     */
    public static String validateName(String raw) {
        if (raw == null) {
            throw new ApplicationException(ErrorCode.INVALID_ROOM_NAME, "Room name required");
        }
        String name = raw.trim();
        if (name.isEmpty() || name.length() > MAX_ROOM_NAME_LENGTH) {
            throw new ApplicationException(ErrorCode.INVALID_ROOM_NAME,
                    "Room name must be 1-" + MAX_ROOM_NAME_LENGTH + " characters");
        }
        return name;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Membership
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Adds a connection to a room, creating the room if needed. Joining twice is a no-op.
     *
     * @param connection the joining connection
     * @param roomName the room name, trimmed before use
     * @return true if the connection was not yet a member
     * @throws ApplicationException if the room name is invalid
     */
    public boolean join(Connection connection, String roomName) {
        String name = validateName(roomName);
        boolean created = false;
        boolean added;
        lock.lock();
        try {
            Room room = rooms.get(name);
            if (room == null) {
                room = new Room(name);
                rooms.put(name, room);
                created = true;
            }
            added = room.add(connection);
            if (added) {
                roomsByConnection
                        .computeIfAbsent(connection.id(), id -> new LinkedHashSet<>())
                        .add(name);
            }
        } finally {
            lock.unlock();
        }

        if (created) {
            LOGGER.log(Level.INFO, "Room created: {0}", name);
            fire(l -> l.roomCreated(name));
        }
        if (added) {
            LOGGER.log(Level.FINE, "{0} joined {1}", new Object[] {connection.id(), name});
            broadcast(name, notice(USER_JOINED, name, connection.id()), connection.id());
        }
        return added;
    }

    /**
     * Removes a connection from a room, dropping the room if it becomes empty. Leaving a room the
     * connection is not in, or one that does not exist, is a no-op.
     *
     * @param connectionId the leaving connection
     * @param roomName the room name, trimmed before use
     * @return true if the connection was a member
     * @throws ApplicationException if the room name is invalid
     */
    public boolean leave(String connectionId, String roomName) {
        String name = validateName(roomName);
        boolean removed;
        boolean destroyed = false;
        lock.lock();
        try {
            Room room = rooms.get(name);
            if (room == null) {
                return false;
            }
            removed = room.remove(connectionId);
            if (removed) {
                Set<String> joined = roomsByConnection.get(connectionId);
                if (joined != null) {
                    joined.remove(name);
                    if (joined.isEmpty()) {
                        roomsByConnection.remove(connectionId);
                    }
                }
                if (room.isEmpty()) {
                    rooms.remove(name);
                    destroyed = true;
                }
            }
        } finally {
            lock.unlock();
        }

        if (removed) {
            LOGGER.log(Level.FINE, "{0} left {1}", new Object[] {connectionId, name});
            afterLeave(connectionId, name, destroyed);
        }
        return removed;
    }

    /**
     * Removes a connection from every room it joined. Called once when the connection closes.
     *
     * @param connectionId the departing connection
     * @return the number of rooms left
     */
    public int leaveAll(String connectionId) {
        Map<String, Boolean> left = new LinkedHashMap<>();
        lock.lock();
        try {
            Set<String> joined = roomsByConnection.remove(connectionId);
            if (joined == null) {
                return 0;
            }
            for (String name : joined) {
                Room room = rooms.get(name);
                if (room == null || !room.remove(connectionId)) {
                    continue;
                }
                boolean destroyed = room.isEmpty();
                if (destroyed) {
                    rooms.remove(name);
                }
                left.put(name, destroyed);
            }
        } finally {
            lock.unlock();
        }

        left.forEach((name, destroyed) -> afterLeave(connectionId, name, destroyed));
        return left.size();
    }

    private void afterLeave(String connectionId, String name, boolean destroyed) {
        if (destroyed) {
            LOGGER.log(Level.INFO, "Room destroyed: {0}", name);
            fire(l -> l.roomDestroyed(name));
        } else {
            broadcast(name, notice(USER_LEFT, name, connectionId), null);
        }
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Broadcast
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Sends a MESSAGE frame to every member of a room.
     *
     * <p>The payload is encoded once. A failed send to one member is logged and does not stop the
     * others.
     *
     * @param roomName the room name
     * @param payload any JSON-serializable value or bytes
     * @param excludeId connection id to skip, usually the sender; may be null
     * @return the number of members the frame was handed to
     * @throws express.mvp.relay.transport.error.ProtocolException if the payload exceeds the
     *     maximum frame size
     */
    public int broadcast(String roomName, Object payload, String excludeId) {
        Room room;
        List<Connection> members;
        lock.lock();
        try {
            room = rooms.get(roomName);
            if (room == null) {
                return 0;
            }
            members = room.snapshot();
        } finally {
            lock.unlock();
        }

        byte[] frame = codec.encode(MessageType.MESSAGE, payload);
        int delivered = 0;
        for (Connection member : members) {
            if (member.id().equals(excludeId)) {
                continue;
            }
            if (room.sendTo(member, frame)) {
                delivered++;
            }
        }
        return delivered;
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Queries
    // ─────────────────────────────────────────────────────────────────────────

    /**
     * Looks up a room.
     *
     * @param roomName the exact (trimmed) room name
     * @return the room, or null if it does not exist
     */
    public Room getRoom(String roomName) {
        lock.lock();
        try {
            return rooms.get(roomName);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the rooms a connection has joined, in join order.
     *
     * @param connectionId the connection id
     * @return a copy of the room names, empty if none
     */
    public Set<String> roomsOf(String connectionId) {
        lock.lock();
        try {
            Set<String> joined = roomsByConnection.get(connectionId);
            return joined == null
                    ? Collections.emptySet()
                    : Collections.unmodifiableSet(new LinkedHashSet<>(joined));
        } finally {
            lock.unlock();
        }
    }

    public int roomCount() {
        lock.lock();
        try {
            return rooms.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the names of all rooms, sorted.
     *
     * @return a copy of the room names
     */
    public List<String> roomNames() {
        lock.lock();
        try {
            return new ArrayList<>(new TreeSet<>(rooms.keySet()));
        } finally {
            lock.unlock();
        }
    }

    private static Map<String, Object> notice(String type, String room, String connectionId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", type);
        payload.put("room", room);
        payload.put("connectionId", connectionId);
        return payload;
    }

    private void fire(Consumer<RoomRegistryListener> event) {
        for (RoomRegistryListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Room registry listener failed", e);
            }
        }
    }
}
