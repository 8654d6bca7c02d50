package express.mvp.relay.server.room;

/** Receives room creation and destruction events from a {@link RoomRegistry}. */
public interface RoomRegistryListener {

    default void roomCreated(String roomName) {}

    default void roomDestroyed(String roomName) {}
}
