package express.mvp.relay.transport.buffer;

import java.nio.ByteBuffer;

/**
 * Per-connection accumulation arena for inbound bytes.
 *
 * <p>Bytes are appended at the write index and consumed from the read index. Consuming only moves
 * the read index; the consumed prefix is reclaimed lazily, when an append needs space, by moving
 * the unconsumed tail to the front. The tail is always shorter than one frame, so reclaiming never
 * costs more than one partial frame copy no matter how many frames were consumed.
 *
 * <pre>
 *  0          readIndex           writeIndex        capacity
 *  ├──consumed──┼────unconsumed──────┼──────free────────┤
 * </pre>
 *
 * <p>The unconsumed region never exceeds {@code maxSize}. The buffer is owned by exactly one
 * connection and is not thread-safe.
 */
public final class ReceiveBuffer {

    private static final int MIN_CAPACITY = 256;

    private final int maxSize;
    private byte[] data;
    private int readIndex;
    private int writeIndex;

    /**
     * Creates a buffer.
     *
     * @param initialCapacity starting capacity, grown on demand
     * @param maxSize bound on unconsumed bytes
     */
    public ReceiveBuffer(int initialCapacity, int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.data = new byte[Math.max(MIN_CAPACITY, Math.min(initialCapacity, maxSize))];
    }

    /**
     * Returns the number of unconsumed bytes.
     *
     * @return bytes between read and write index
     */
    public int size() {
        return writeIndex - readIndex;
    }

    /**
     * Returns how many more bytes may be appended before the bound is reached.
     *
     * @return {@code maxSize - size()}
     */
    public int remainingCapacity() {
        return maxSize - size();
    }

    public int maxSize() {
        return maxSize;
    }

    /**
     * Appends up to {@code length} bytes from the source.
     *
     * @param source bytes to copy; its position is advanced by {@code length}
     * @param length number of bytes to copy
     * @throws IllegalArgumentException if the append would exceed the bound or the source holds
     *     fewer than {@code length} bytes
     */
    public void append(ByteBuffer source, int length) {
        if (length < 0 || length > source.remaining()) {
            throw new IllegalArgumentException(
                    "length " + length + " outside source remaining " + source.remaining());
        }
        if (length > remainingCapacity()) {
            throw new IllegalArgumentException(String.format(
                    "Append of %d bytes exceeds buffer bound %d (buffered %d)", length, maxSize, size()));
        }
        ensureWritable(length);
        source.get(data, writeIndex, length);
        writeIndex += length;
    }

    /**
     * Returns a view over the unconsumed bytes.
     *
     * <p>The view shares this buffer's storage: its position is the read index and its limit the
     * write index. Advance it with a parser, then report progress with {@link #consumeTo}. The view
     * is invalidated by the next {@link #append}.
     *
     * @return a big-endian view of the unconsumed region
     */
    public ByteBuffer view() {
        return ByteBuffer.wrap(data, readIndex, size());
    }

    /**
     * Marks everything before {@code position} as consumed.
     *
     * @param position a position of the most recent {@link #view()}, between read and write index
     */
    public void consumeTo(int position) {
        if (position < readIndex || position > writeIndex) {
            throw new IllegalArgumentException(String.format(
                    "Position %d outside unconsumed region [%d, %d]", position, readIndex, writeIndex));
        }
        readIndex = position;
        if (readIndex == writeIndex) {
            readIndex = 0;
            writeIndex = 0;
        }
    }

    /** Discards all buffered bytes. */
    public void clear() {
        readIndex = 0;
        writeIndex = 0;
    }

    private void ensureWritable(int length) {
        if (data.length - writeIndex >= length) {
            return;
        }
        int unconsumed = size();
        int required = unconsumed + length;
        if (required <= data.length) {
            System.arraycopy(data, readIndex, data, 0, unconsumed);
        } else {
            int newCapacity = (int) Math.min(Math.max((long) data.length * 2, required), maxSize);
            byte[] grown = new byte[newCapacity];
            System.arraycopy(data, readIndex, grown, 0, unconsumed);
            data = grown;
        }
        readIndex = 0;
        writeIndex = unconsumed;
    }

    @Override
    public String toString() {
        return "ReceiveBuffer[size=" + size() + ", capacity=" + data.length + ", maxSize=" + maxSize + "]";
    }
}
