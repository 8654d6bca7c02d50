package express.mvp.relay.transport.buffer;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.ByteBuffer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ReceiveBuffer}. */
@DisplayName("ReceiveBuffer")
class ReceiveBufferTest {

    private static ByteBuffer bytes(int count, int start) {
        ByteBuffer buffer = ByteBuffer.allocate(count);
        for (int i = 0; i < count; i++) {
            buffer.put((byte) (start + i));
        }
        return buffer.flip();
    }

    @Test
    @DisplayName("Appended bytes are visible in the view")
    void appendAndView() {
        ReceiveBuffer buffer = new ReceiveBuffer(16, 1024);

        buffer.append(bytes(10, 0), 10);

        ByteBuffer view = buffer.view();
        assertEquals(10, view.remaining());
        assertEquals(0, view.get());
        assertEquals(10, buffer.size());
    }

    @Test
    @DisplayName("consumeTo drops the consumed prefix")
    void consumePrefix() {
        ReceiveBuffer buffer = new ReceiveBuffer(16, 1024);
        buffer.append(bytes(10, 0), 10);

        ByteBuffer view = buffer.view();
        view.position(view.position() + 4);
        buffer.consumeTo(view.position());

        assertEquals(6, buffer.size());
        assertEquals(4, buffer.view().get());
    }

    @Test
    @DisplayName("Grows beyond the initial capacity and keeps unconsumed bytes")
    void growsAndCompacts() {
        ReceiveBuffer buffer = new ReceiveBuffer(256, 4096);
        buffer.append(bytes(200, 0), 200);
        ByteBuffer view = buffer.view();
        buffer.consumeTo(view.position() + 100);

        buffer.append(bytes(1000, 0), 1000);

        assertEquals(1100, buffer.size());
        ByteBuffer after = buffer.view();
        assertEquals(100, after.get());
    }

    @Test
    @DisplayName("Appending past the bound is rejected")
    void boundEnforced() {
        ReceiveBuffer buffer = new ReceiveBuffer(16, 300);
        buffer.append(bytes(250, 0), 250);

        assertEquals(50, buffer.remainingCapacity());
        assertThrows(IllegalArgumentException.class, () -> buffer.append(bytes(51, 0), 51));
        assertEquals(250, buffer.size());
    }

    @Test
    @DisplayName("Consuming everything and clear both reset the buffer")
    void resets() {
        ReceiveBuffer buffer = new ReceiveBuffer(16, 1024);
        buffer.append(bytes(8, 0), 8);
        ByteBuffer view = buffer.view();
        buffer.consumeTo(view.limit());
        assertEquals(0, buffer.size());

        buffer.append(bytes(8, 0), 8);
        buffer.clear();
        assertEquals(0, buffer.size());
        assertEquals(1024, buffer.remainingCapacity());
    }

    @Test
    @DisplayName("consumeTo outside the unconsumed region is rejected")
    void invalidConsume() {
        ReceiveBuffer buffer = new ReceiveBuffer(16, 1024);
        buffer.append(bytes(8, 0), 8);

        assertThrows(IllegalArgumentException.class, () -> buffer.consumeTo(9));
    }
}
