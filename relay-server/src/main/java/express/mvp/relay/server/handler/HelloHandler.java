package express.mvp.relay.server.handler;

import com.fasterxml.jackson.databind.node.ObjectNode;
import express.mvp.relay.server.dispatch.MessageHandler;
import express.mvp.relay.transport.Connection;
import express.mvp.relay.transport.framing.MessageType;
import express.mvp.relay.transport.framing.ParsedMessage;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Answers HELLO with the connection id the server assigned.
 *
 * <pre>{@code
 * -> {"userId": "alice", "clientVersion": "1.0.0"}      (both optional, payload may be empty)
 * <- {"status": "connected", "connectionId": "conn-1", "serverVersion": "1.0.0",
 *     "heartbeatInterval": 30000}
 * }</pre>
 */
public final class HelloHandler implements MessageHandler {

    private static final Logger LOGGER = Logger.getLogger(HelloHandler.class.getName());

    public static final String SERVER_VERSION = "1.0.0";

    private final Duration heartbeatInterval;

    public HelloHandler(Duration heartbeatInterval) {
        this.heartbeatInterval = heartbeatInterval;
    }

    @Override
    public void handle(Connection connection, ParsedMessage message) {
        ObjectNode payload = JsonPayloads.optionalObject(message);
        String userId = JsonPayloads.optionalText(payload, "userId");

        Map<String, Object> reply = new LinkedHashMap<>();
        reply.put("status", "connected");
        reply.put("connectionId", connection.id());
        reply.put("serverVersion", SERVER_VERSION);
        reply.put("heartbeatInterval", heartbeatInterval.toMillis());
        connection.send(MessageType.HELLO, reply);

        LOGGER.log(Level.INFO, "[{0}] HELLO from user: {1}",
                new Object[] {connection.id(), userId != null ? userId : "anonymous"});
    }
}
