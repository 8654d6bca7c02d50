package express.mvp.relay.server.dispatch;

import express.mvp.relay.transport.Connection;
import express.mvp.relay.transport.NotWritableException;
import express.mvp.relay.transport.error.ApplicationException;
import express.mvp.relay.transport.error.ErrorCategory;
import express.mvp.relay.transport.error.ErrorCode;
import express.mvp.relay.transport.error.ProtocolException;
import express.mvp.relay.transport.error.RelayException;
import express.mvp.relay.transport.framing.FrameCodec;
import express.mvp.relay.transport.framing.MessageType;
import express.mvp.relay.transport.framing.ParsedMessage;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Validates decoded messages and routes each to the handler for its type.
 *
 * <h2>Validation</h2>
 *
 * <table border="1">
 *   <caption>Checks applied before routing</caption>
 *   <tr><th>Check</th><th>Error code</th></tr>
 *   <tr><td>version is {@value FrameCodec#PROTOCOL_VERSION}</td><td>UNSUPPORTED_VERSION</td></tr>
 *   <tr><td>reserved flag bits 2-7 are zero</td><td>RESERVED_FLAGS</td></tr>
 *   <tr><td>type is known and routed</td><td>UNKNOWN_MESSAGE_TYPE</td></tr>
 * </table>
 *
 * <p>A failed check aborts the connection: the peer gets an ERROR frame and the connection closes.
 *
 * <h2>Handler Outcomes</h2>
 *
 * <p>Failures are handled by the {@link ErrorCategory} of their code:
 *
 * <ul>
 *   <li>{@link ApplicationException}: ERROR frame, connection stays open
 *   <li>{@link ProtocolException}: connection aborted
 *   <li>transport failure: already terminated by the connection, logged only
 *   <li>anything else: logged, ERROR frame with {@code INTERNAL_ERROR}, connection stays open
 * </ul>
 *
 * <p>The routing table is immutable once built, so a dispatcher can be shared by every
 * connection.
 */
public final class Dispatcher {

    private static final Logger LOGGER = Logger.getLogger(Dispatcher.class.getName());

    private final Map<MessageType, MessageHandler> routes;

    private Dispatcher(Map<MessageType, MessageHandler> routes) {
        this.routes = Collections.unmodifiableMap(new EnumMap<>(routes));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Validates and routes one message.
     *
     * @param connection the sending connection
     * @param message the decoded message
     */
    public void dispatch(Connection connection, ParsedMessage message) {
        MessageHandler handler;
        try {
            handler = validate(message);
        } catch (ProtocolException e) {
            connection.abort(e);
            return;
        }

        try {
            handler.handle(connection, message);
        } catch (NotWritableException e) {
            LOGGER.log(Level.FINE, "{0} closed while handling {1}",
                    new Object[] {connection.id(), message.messageType()});
        } catch (RelayException e) {
            handleFailure(connection, message, e);
        } catch (RuntimeException e) {
            internalError(connection, message, e);
        }
    }

    /**
     * Returns the handler for a type.
     *
     * @param type the message type
     * @return the handler, or null if the type is not routed
     */
    public MessageHandler handlerFor(MessageType type) {
        return routes.get(type);
    }

    private MessageHandler validate(ParsedMessage message) {
        FrameCodec.checkHeader(message.version(), message.flags());
        MessageType type = message.messageType();
        MessageHandler handler = type == null ? null : routes.get(type);
        if (handler == null) {
            throw new ProtocolException(ErrorCode.UNKNOWN_MESSAGE_TYPE, String.format(
                    "Unknown message type 0x%02x", message.type()));
        }
        return handler;
    }

    /** Applies the policy of the failure's {@link ErrorCategory}. */
    private static void handleFailure(Connection connection, ParsedMessage message, RelayException e) {
        ErrorCategory category = e.category();
        if (category == ErrorCategory.INTERNAL) {
            internalError(connection, message, e);
            return;
        }
        if (!category.isReportedToPeer()) {
            // the connection terminated itself when the transport failed
            LOGGER.log(Level.FINE, "Transport failed while handling message on " + connection.id(), e);
            return;
        }
        if (category.closesConnection()) {
            connection.abort(e instanceof ProtocolException pe
                    ? pe
                    : new ProtocolException(e.code(), e.getMessage(), e));
            return;
        }
        LOGGER.log(Level.FINE, "{0} rejected {1}: {2}",
                new Object[] {connection.id(), message.messageType(), e.getMessage()});
        sendError(connection, e.toErrorPayload());
    }

    private static void internalError(Connection connection, ParsedMessage message, RuntimeException e) {
        LOGGER.log(Level.SEVERE, "Handler for " + message.messageType() + " failed on "
                + connection.id(), e);
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("code", ErrorCode.INTERNAL_ERROR.name());
        payload.put("message", "Internal server error");
        sendError(connection, payload);
    }

    private static void sendError(Connection connection, Map<String, Object> payload) {
        try {
            connection.send(MessageType.ERROR, payload);
        } catch (RuntimeException e) {
            LOGGER.log(Level.FINE, "Could not deliver ERROR frame to " + connection.id(), e);
        }
    }

    /** Builds the routing table. */
    public static final class Builder {
        private final Map<MessageType, MessageHandler> routes = new EnumMap<>(MessageType.class);

        private Builder() {}

        /**
         * Routes a message type to a handler, replacing any earlier route.
         *
         * @param type the message type
         * @param handler the handler
         * @return this builder
         */
        public Builder route(MessageType type, MessageHandler handler) {
            routes.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(handler, "handler"));
            return this;
        }

        public Dispatcher build() {
            return new Dispatcher(routes);
        }
    }
}
