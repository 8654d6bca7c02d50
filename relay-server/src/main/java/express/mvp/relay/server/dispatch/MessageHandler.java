package express.mvp.relay.server.dispatch;

import express.mvp.relay.transport.Connection;
import express.mvp.relay.transport.framing.ParsedMessage;

/**
 * Handles one message type.
 *
 * <p>Handlers run on the thread that delivered the frame. They report failures by throwing:
 * {@link express.mvp.relay.transport.error.ApplicationException} for requests the client can
 * correct (the connection stays open), {@link express.mvp.relay.transport.error.ProtocolException}
 * for violations that close the connection.
 */
@FunctionalInterface
public interface MessageHandler {

    /**
     * Handles a validated message.
     *
     * @param connection the sending connection
     * @param message the decoded message
     */
    void handle(Connection connection, ParsedMessage message);
}
