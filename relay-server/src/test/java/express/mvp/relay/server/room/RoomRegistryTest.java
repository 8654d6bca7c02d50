package express.mvp.relay.server.room;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.relay.server.StubTransport;
import express.mvp.relay.transport.error.ApplicationException;
import express.mvp.relay.transport.error.ErrorCode;
import express.mvp.relay.transport.framing.MessageType;
import express.mvp.relay.transport.framing.ParsedMessage;
import express.mvp.relay.transport.lifecycle.ConnectionState;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Unit tests for {@link RoomRegistry}. */
@DisplayName("RoomRegistry")
class RoomRegistryTest {

    private RoomRegistry registry;
    private List<String> events;
    private StubTransport alice;
    private StubTransport bob;
    private StubTransport carol;

    @BeforeEach
    void setUp() {
        registry = new RoomRegistry();
        events = new ArrayList<>();
        registry.addListener(new RoomRegistryListener() {
            @Override
            public void roomCreated(String roomName) {
                events.add("created:" + roomName);
            }

            @Override
            public void roomDestroyed(String roomName) {
                events.add("destroyed:" + roomName);
            }
        });
        alice = StubTransport.open("conn-1");
        bob = StubTransport.open("conn-2");
        carol = StubTransport.open("conn-3");
    }

    private static String field(ParsedMessage message, String name) {
        return message.payload().asJson().get(name).asText();
    }

    // ==================== Membership Tests ====================

    @Nested
    @DisplayName("Membership")
    class MembershipTests {

        @Test
        @DisplayName("First join creates the room")
        void firstJoinCreatesRoom() {
            assertTrue(registry.join(alice.connection(), "general"));

            Room room = registry.getRoom("general");
            assertNotNull(room);
            assertTrue(room.hasMember("conn-1"));
            assertEquals(List.of("created:general"), events);
        }

        @Test
        @DisplayName("Joining twice is a no-op")
        void doubleJoin() {
            registry.join(alice.connection(), "general");

            assertFalse(registry.join(alice.connection(), "general"));

            assertEquals(1, registry.getRoom("general").memberCount());
            assertEquals(List.of("created:general"), events);
        }

        @Test
        @DisplayName("Names are trimmed")
        void namesTrimmed() {
            registry.join(alice.connection(), "  general ");

            assertNotNull(registry.getRoom("general"));
            assertEquals(Set.of("general"), registry.roomsOf("conn-1"));
        }

        @Test
        @DisplayName("Last leave destroys the room")
        void lastLeaveDestroysRoom() {
            registry.join(alice.connection(), "general");
            registry.join(bob.connection(), "general");

            assertTrue(registry.leave("conn-1", "general"));
            assertNotNull(registry.getRoom("general"));
            assertTrue(registry.leave("conn-2", "general"));

            assertNull(registry.getRoom("general"));
            assertEquals(0, registry.roomCount());
            assertEquals(List.of("created:general", "destroyed:general"), events);
        }

        @Test
        @DisplayName("Leaving a room not joined is a no-op")
        void leaveUnjoined() {
            registry.join(alice.connection(), "general");

            assertFalse(registry.leave("conn-2", "general"));
            assertFalse(registry.leave("conn-2", "missing"));
            assertEquals(1, registry.getRoom("general").memberCount());
        }

        @Test
        @DisplayName("leaveAll removes the connection everywhere")
        void leaveAll() {
            registry.join(alice.connection(), "a");
            registry.join(alice.connection(), "b");
            registry.join(bob.connection(), "b");

            assertEquals(2, registry.leaveAll("conn-1"));

            assertNull(registry.getRoom("a"));
            assertFalse(registry.getRoom("b").hasMember("conn-1"));
            assertTrue(registry.roomsOf("conn-1").isEmpty());
            assertEquals(0, registry.leaveAll("conn-1"));
        }

        @Test
        @DisplayName("Rooms of a connection keep join order")
        void roomsOfKeepsOrder() {
            registry.join(alice.connection(), "zeta");
            registry.join(alice.connection(), "alpha");

            assertEquals(List.of("zeta", "alpha"), new ArrayList<>(registry.roomsOf("conn-1")));
            assertEquals(List.of("alpha", "zeta"), registry.roomNames());
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "\t"})
        @DisplayName("Invalid names are rejected")
        void invalidNames(String name) {
            ApplicationException e = assertThrows(ApplicationException.class,
                    () -> registry.join(alice.connection(), name));
            assertEquals(ErrorCode.INVALID_ROOM_NAME, e.code());
            assertEquals(0, registry.roomCount());
        }

        @Test
        @DisplayName("A 65-character name is rejected")
        void tooLongName() {
            String name = "r".repeat(RoomRegistry.MAX_ROOM_NAME_LENGTH + 1);

            assertThrows(ApplicationException.class, () -> registry.join(alice.connection(), name));
        }

        @Test
        @DisplayName("A 64-character name is accepted")
        void maxLengthName() {
            String name = "r".repeat(RoomRegistry.MAX_ROOM_NAME_LENGTH);

            assertTrue(registry.join(alice.connection(), name));
        }
    }

    // ==================== Notice Tests ====================

    @Nested
    @DisplayName("Membership notices")
    class NoticeTests {

        @Test
        @DisplayName("Join notifies existing members only")
        void joinNotifiesOthers() {
            registry.join(alice.connection(), "general");

            registry.join(bob.connection(), "general");

            ParsedMessage notice = alice.last();
            assertEquals(MessageType.MESSAGE, notice.messageType());
            assertEquals(RoomRegistry.USER_JOINED, field(notice, "type"));
            assertEquals("general", field(notice, "room"));
            assertEquals("conn-2", field(notice, "connectionId"));
            assertTrue(bob.messages().isEmpty());
        }

        @Test
        @DisplayName("Leave notifies remaining members")
        void leaveNotifiesRemaining() {
            registry.join(alice.connection(), "general");
            registry.join(bob.connection(), "general");
            alice.clear();

            registry.leave("conn-2", "general");

            assertEquals(RoomRegistry.USER_LEFT, field(alice.last(), "type"));
            assertEquals("conn-2", field(alice.last(), "connectionId"));
        }
    }

    // ==================== Broadcast Tests ====================

    @Nested
    @DisplayName("Broadcast")
    class BroadcastTests {

        @BeforeEach
        void joinAll() {
            registry.join(alice.connection(), "general");
            registry.join(bob.connection(), "general");
            registry.join(carol.connection(), "general");
            alice.clear();
            bob.clear();
            carol.clear();
        }

        @Test
        @DisplayName("Excludes the sender")
        void excludesSender() {
            int delivered = registry.broadcast("general", Map.of("content", "hi"), "conn-1");

            assertEquals(2, delivered);
            assertTrue(alice.messages().isEmpty());
            assertEquals("hi", field(bob.last(), "content"));
            assertEquals("hi", field(carol.last(), "content"));
        }

        @Test
        @DisplayName("Without exclusion every member receives it")
        void noExclusion() {
            assertEquals(3, registry.broadcast("general", Map.of("content", "all"), null));
        }

        @Test
        @DisplayName("A failing member does not stop delivery to the others")
        void failingMemberIsolated() {
            bob.failWrites();

            int delivered = registry.broadcast("general", Map.of("content", "hi"), "conn-1");

            assertEquals(1, delivered);
            assertEquals("hi", field(carol.last(), "content"));
            assertEquals(ConnectionState.CLOSED, bob.connection().state());
            assertEquals(ConnectionState.OPEN, carol.connection().state());
        }

        @Test
        @DisplayName("With no exclusion, two healthy members receive despite a failing third")
        void failingMemberIsolatedWithoutExclusion() {
            bob.failWrites();

            int delivered = registry.broadcast("general", Map.of("content", "hi"), null);

            assertEquals(2, delivered);
            assertEquals("hi", field(alice.last(), "content"));
            assertEquals("hi", field(carol.last(), "content"));
            assertEquals(ConnectionState.CLOSED, bob.connection().state());
        }

        @Test
        @DisplayName("Membership changes during delivery do not alter the recipients")
        void snapshotDuringDelivery() {
            StubTransport dave = StubTransport.open("conn-4");
            alice.afterNextWrite(() -> {
                registry.leave("conn-3", "general");
                registry.join(dave.connection(), "general");
            });

            int delivered = registry.broadcast("general", Map.of("content", "hi"), null);

            assertEquals(3, delivered);
            assertTrue(carol.messages().stream().anyMatch(m -> m.payload().asJson().has("content")));
            assertTrue(dave.messages().stream().noneMatch(m -> m.payload().asJson().has("content")));
            assertEquals(List.of("conn-1", "conn-2", "conn-4"),
                    registry.getRoom("general").memberIds());
        }

        @Test
        @DisplayName("Rooms are isolated")
        void roomsIsolated() {
            StubTransport dave = StubTransport.open("conn-4");
            registry.join(dave.connection(), "other");

            registry.broadcast("general", Map.of("content", "hi"), null);

            assertTrue(dave.messages().isEmpty());
        }

        @Test
        @DisplayName("Broadcast to a missing room delivers nothing")
        void missingRoom() {
            assertEquals(0, registry.broadcast("missing", Map.of("content", "hi"), null));
        }

        @Test
        @DisplayName("Closed members are skipped and counted as not delivered")
        void closedMembersSkipped() {
            carol.connection().close();

            assertEquals(1, registry.broadcast("general", Map.of("content", "hi"), "conn-1"));
        }
    }
}
