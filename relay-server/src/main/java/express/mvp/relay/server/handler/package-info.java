/**
 * Handlers for the relay's message types: HELLO, JOIN_ROOM, LEAVE_ROOM and MESSAGE.
 *
 * <p>Every handler replies with the same message type it received, except MESSAGE, which is relayed
 * to the room instead.
 */
package express.mvp.relay.server.handler;
