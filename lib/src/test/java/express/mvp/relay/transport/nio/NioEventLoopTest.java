package express.mvp.relay.transport.nio;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.relay.transport.Connection;
import express.mvp.relay.transport.ConnectionListener;
import express.mvp.relay.transport.ConnectionRegistry;
import express.mvp.relay.transport.ConnectionStats;
import express.mvp.relay.transport.TransportConfig;
import express.mvp.relay.transport.client.RelayClient;
import express.mvp.relay.transport.framing.MessageType;
import express.mvp.relay.transport.framing.ParsedMessage;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

/** Loopback tests for {@link NioEventLoop} with an echoing connection listener. */
@DisplayName("NioEventLoop")
@Timeout(value = 30, unit = TimeUnit.SECONDS)
class NioEventLoopTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private final CountDownLatch closed = new CountDownLatch(1);
    private final AtomicInteger closedCount = new AtomicInteger();

    private ConnectionRegistry registry;
    private NioEventLoop loop;
    private Thread ioThread;
    private volatile boolean running = true;
    private int port;

    @BeforeEach
    void setUp() {
        TransportConfig config = TransportConfig.defaults();
        registry = new ConnectionRegistry(config);
        ConnectionListener echo = new ConnectionListener() {
            @Override
            public void onFrame(Connection connection, ParsedMessage message) {
                if (message.messageType() == MessageType.LEAVE_ROOM) {
                    connection.close();
                } else {
                    connection.send(MessageType.MESSAGE, message.payload().asJson());
                }
            }

            @Override
            public void onClosed(Connection connection, ConnectionStats stats) {
                closedCount.incrementAndGet();
                closed.countDown();
            }
        };
        loop = new NioEventLoop(config, transport -> registry.register(transport, echo));
        InetSocketAddress bound = loop.bind(new InetSocketAddress("127.0.0.1", 0));
        port = bound.getPort();
        ioThread = new Thread(() -> {
            while (running) {
                loop.pollOnce(50);
            }
        }, "nio-test-loop");
        ioThread.start();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        running = false;
        loop.wakeup();
        ioThread.join(5000);
        loop.close();
    }

    @Test
    @DisplayName("Binds an ephemeral port")
    void bindsEphemeralPort() {
        assertTrue(port > 0);
        assertEquals(port, loop.localAddress().getPort());
    }

    @Test
    @DisplayName("Echoes frames over a real socket")
    void echoesFrames() throws InterruptedException {
        try (RelayClient client = RelayClient.connect("127.0.0.1", port, WAIT)) {
            client.send(MessageType.HELLO, Map.of("userId", "alice"));

            ParsedMessage reply = client.await(MessageType.MESSAGE, WAIT);

            assertNotNull(reply);
            assertEquals("alice", reply.payload().asJson().get("userId").asText());
        }
    }

    @Test
    @DisplayName("Large frames cross many reads and writes intact")
    void largeFrame() throws InterruptedException {
        String content = "x".repeat(512 * 1024);
        try (RelayClient client = RelayClient.connect("127.0.0.1", port, WAIT)) {
            client.send(MessageType.MESSAGE, Map.of("content", content));

            ParsedMessage reply = client.await(MessageType.MESSAGE, WAIT);

            assertNotNull(reply);
            assertEquals(content.length(), reply.payload().asJson().get("content").asText().length());
        }
    }

    @Test
    @DisplayName("Peer disconnect closes the connection once")
    void peerDisconnect() throws InterruptedException {
        RelayClient client = RelayClient.connect("127.0.0.1", port, WAIT);
        client.send(MessageType.HELLO, Map.of());
        assertNotNull(client.await(MessageType.MESSAGE, WAIT));

        client.close();

        assertTrue(closed.await(5, TimeUnit.SECONDS));
        Thread.sleep(100);
        assertEquals(1, closedCount.get());
        assertEquals(0, registry.size());
    }

    @Test
    @DisplayName("Server close is seen by the client")
    void serverClose() throws InterruptedException {
        try (RelayClient client = RelayClient.connect("127.0.0.1", port, WAIT)) {
            client.leave("any");

            assertTrue(client.awaitClosed(WAIT));
            assertTrue(closed.await(5, TimeUnit.SECONDS));
        }
    }

    @Test
    @DisplayName("Accepted sockets close when the handler rejects them")
    void rejectedAccept() throws InterruptedException {
        running = false;
        loop.wakeup();
        ioThread.join(5000);
        loop.close();

        loop = new NioEventLoop(TransportConfig.defaults(), transport -> null);
        port = loop.bind(new InetSocketAddress("127.0.0.1", 0)).getPort();
        running = true;
        ioThread = new Thread(() -> {
            while (running) {
                loop.pollOnce(50);
            }
        }, "nio-test-loop-reject");
        ioThread.start();

        try (RelayClient client = RelayClient.connect("127.0.0.1", port, WAIT)) {
            assertTrue(client.awaitClosed(WAIT));
        }
    }
}
