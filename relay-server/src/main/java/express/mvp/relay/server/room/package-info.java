/**
 * Rooms: named broadcast groups with dynamic membership.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.relay.server.room.RoomRegistry} - membership, reverse index, broadcast
 *   <li>{@link express.mvp.relay.server.room.Room} - one group's members in join order
 * </ul>
 */
package express.mvp.relay.server.room;
