package express.mvp.relay.transport;

import express.mvp.relay.transport.framing.FrameCodec;

/**
 * Configuration for connections and the socket transport.
 *
 * <p>This immutable configuration object bounds the per-connection resources the relay is willing
 * to spend on a peer.
 *
 * <table border="1">
 *   <caption>Transport Configuration Parameters</caption>
 *   <tr><th>Parameter</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>maxFrameSize</td><td>10 MiB</td><td>Largest frame, length field included</td></tr>
 *   <tr><td>readBufferSize</td><td>64 KiB</td><td>Bytes read from a socket per event</td></tr>
 *   <tr><td>maxPendingWriteBytes</td><td>16 MiB</td><td>Outbound backlog per connection</td></tr>
 *   <tr><td>tcpNoDelay</td><td>true</td><td>Disable Nagle's algorithm</td></tr>
 * </table>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * TransportConfig config = TransportConfig.builder()
 *     .maxFrameSize(1024 * 1024)
 *     .maxPendingWriteBytes(4 * 1024 * 1024)
 *     .build();
 * }</pre>
 */
public final class TransportConfig {

    /** Default outbound backlog bound: 16 MiB. */
    public static final int DEFAULT_MAX_PENDING_WRITE_BYTES = 16 * 1024 * 1024;

    /** Default socket read size: 64 KiB. */
    public static final int DEFAULT_READ_BUFFER_SIZE = 64 * 1024;

    private final int maxFrameSize;
    private final int readBufferSize;
    private final int maxPendingWriteBytes;
    private final boolean tcpNoDelay;

    private TransportConfig(Builder builder) {
        this.maxFrameSize = builder.maxFrameSize;
        this.readBufferSize = builder.readBufferSize;
        this.maxPendingWriteBytes = builder.maxPendingWriteBytes;
        this.tcpNoDelay = builder.tcpNoDelay;
    }

    /**
     * Creates a new builder for constructing configuration.
     *
     * @return a new builder with default values
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the default configuration.
     *
     * @return a configuration with every parameter at its default
     */
    public static TransportConfig defaults() {
        return builder().build();
    }

    /**
     * Returns the maximum total frame size, including the 4-byte length field.
     *
     * @return the maximum frame size in bytes
     */
    public int maxFrameSize() {
        return maxFrameSize;
    }

    /**
     * Returns the number of bytes read from a socket per readiness event.
     *
     * @return the read buffer size in bytes
     */
    public int readBufferSize() {
        return readBufferSize;
    }

    /**
     * Returns the maximum number of outbound bytes a transport queues while the socket is not
     * writable. A write beyond this bound fails and the connection is terminated.
     *
     * @return the backlog bound in bytes
     */
    public int maxPendingWriteBytes() {
        return maxPendingWriteBytes;
    }

    public boolean tcpNoDelay() {
        return tcpNoDelay;
    }

    @Override
    public String toString() {
        return "TransportConfig{"
                + "maxFrameSize=" + maxFrameSize
                + ", readBufferSize=" + readBufferSize
                + ", maxPendingWriteBytes=" + maxPendingWriteBytes
                + ", tcpNoDelay=" + tcpNoDelay
                + '}';
    }

    /** Builder for {@link TransportConfig}. */
    public static final class Builder {
        private int maxFrameSize = FrameCodec.DEFAULT_MAX_FRAME_SIZE;
        private int readBufferSize = DEFAULT_READ_BUFFER_SIZE;
        private int maxPendingWriteBytes = DEFAULT_MAX_PENDING_WRITE_BYTES;
        private boolean tcpNoDelay = true;

        private Builder() {}

        /**
         * Sets the maximum total frame size.
         *
         * @param maxFrameSize bytes, at least the 7-byte header
         * @return this builder
         */
        public Builder maxFrameSize(int maxFrameSize) {
            if (maxFrameSize < FrameCodec.HEADER_SIZE) {
                throw new IllegalArgumentException(
                        "maxFrameSize must be at least " + FrameCodec.HEADER_SIZE + ": " + maxFrameSize);
            }
            this.maxFrameSize = maxFrameSize;
            return this;
        }

        public Builder readBufferSize(int readBufferSize) {
            if (readBufferSize <= 0) {
                throw new IllegalArgumentException("readBufferSize must be positive: " + readBufferSize);
            }
            this.readBufferSize = readBufferSize;
            return this;
        }

        public Builder maxPendingWriteBytes(int maxPendingWriteBytes) {
            if (maxPendingWriteBytes <= 0) {
                throw new IllegalArgumentException(
                        "maxPendingWriteBytes must be positive: " + maxPendingWriteBytes);
            }
            this.maxPendingWriteBytes = maxPendingWriteBytes;
            return this;
        }

        public Builder tcpNoDelay(boolean tcpNoDelay) {
            this.tcpNoDelay = tcpNoDelay;
            return this;
        }

        public TransportConfig build() {
            return new TransportConfig(this);
        }
    }
}
