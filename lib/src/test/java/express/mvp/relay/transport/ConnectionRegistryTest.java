package express.mvp.relay.transport;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.relay.transport.framing.MessageType;
import express.mvp.relay.transport.lifecycle.ConnectionState;
import java.util.Collection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ConnectionRegistry}. */
@DisplayName("ConnectionRegistry")
class ConnectionRegistryTest {

    private ConnectionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry(TransportConfig.defaults());
    }

    private Connection register(RecordingListener listener) {
        RecordingTransport transport = new RecordingTransport();
        Connection connection = registry.register(transport, listener);
        transport.attach(connection);
        return connection;
    }

    @Test
    @DisplayName("Assigns unique sequential ids")
    void assignsUniqueIds() {
        Connection first = register(null);
        Connection second = register(null);

        assertEquals("conn-1", first.id());
        assertEquals("conn-2", second.id());
        assertNotEquals(first.id(), second.id());
    }

    @Test
    @DisplayName("Registered connections are open and tracked")
    void registeredConnectionsOpen() {
        RecordingListener listener = new RecordingListener();
        Connection connection = register(listener);

        assertEquals(ConnectionState.OPEN, connection.state());
        assertEquals(1, listener.opened);
        assertSame(connection, registry.get(connection.id()));
        assertEquals(1, registry.size());
    }

    @Test
    @DisplayName("Closed connections are removed")
    void closedConnectionsRemoved() {
        Connection connection = register(null);

        connection.onTransportClosed();

        assertNull(registry.get(connection.id()));
        assertEquals(0, registry.size());
    }

    @Test
    @DisplayName("closeAll closes every connection gracefully")
    void closeAll() {
        RecordingListener a = new RecordingListener();
        RecordingListener b = new RecordingListener();
        register(a);
        register(b);

        registry.closeAll();

        assertEquals(1, a.closed.size());
        assertEquals(1, b.closed.size());
        assertEquals(0, registry.size());
    }

    @Test
    @DisplayName("terminateAll terminates connections stuck draining")
    void terminateAll() {
        RecordingTransport transport = new RecordingTransport();
        RecordingListener listener = new RecordingListener();
        Connection connection = registry.register(transport, listener);
        transport.attach(connection);
        transport.backpressure(true);
        connection.send(MessageType.MESSAGE, "x");
        connection.close();
        assertEquals(ConnectionState.CLOSING, connection.state());

        int terminated = registry.terminateAll(null);

        assertEquals(1, terminated);
        assertEquals(ConnectionState.CLOSED, connection.state());
        assertEquals(1, transport.closeCalls);
        assertEquals(1, listener.closed.size());
        assertEquals(0, registry.size());
    }

    @Test
    @DisplayName("all() is a snapshot")
    void allIsSnapshot() {
        register(null);
        Collection<Connection> snapshot = registry.all();

        register(null);

        assertEquals(1, snapshot.size());
        assertEquals(2, registry.all().size());
    }
}
