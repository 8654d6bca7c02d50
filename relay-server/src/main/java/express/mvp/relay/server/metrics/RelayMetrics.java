package express.mvp.relay.server.metrics;

import express.mvp.relay.server.room.RoomRegistryListener;
import express.mvp.relay.transport.ConnectionStats;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Server-wide counters.
 *
 * <p>Connection byte counts are folded in when a connection closes, so {@link Snapshot} byte
 * totals cover closed connections only. All updates are atomic; a snapshot is not taken under a
 * lock and may mix values from slightly different instants.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RelayMetrics metrics = new RelayMetrics();
 * roomRegistry.addListener(metrics);
 *
 * metrics.connectionOpened();
 * metrics.messageProcessed();
 * metrics.connectionClosed(stats);
 *
 * LOGGER.info(metrics.snapshot().format());
 * }</pre>
 */
public final class RelayMetrics implements RoomRegistryListener {

    private final Clock clock;

    private final Instant startedAt;

    private final AtomicLong totalConnections = new AtomicLong();

    private final AtomicLong openConnections = new AtomicLong();

    private final AtomicLong activeRooms = new AtomicLong();

    private final AtomicLong bytesSent = new AtomicLong();

    private final AtomicLong bytesReceived = new AtomicLong();

    private final AtomicLong messagesProcessed = new AtomicLong();

    public RelayMetrics() {
        this(Clock.systemUTC());
    }

    public RelayMetrics(Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public void connectionOpened() {
        totalConnections.incrementAndGet();
        openConnections.incrementAndGet();
    }

    /**
     * Records a closed connection and its final byte counts.
     *
     * @param stats the connection's final stats
     */
    public void connectionClosed(ConnectionStats stats) {
        openConnections.decrementAndGet();
        bytesSent.addAndGet(stats.bytesSent());
        bytesReceived.addAndGet(stats.bytesReceived());
    }

    public void messageProcessed() {
        messagesProcessed.incrementAndGet();
    }

    @Override
    public void roomCreated(String roomName) {
        activeRooms.incrementAndGet();
    }

    @Override
    public void roomDestroyed(String roomName) {
        activeRooms.decrementAndGet();
    }

    public Snapshot snapshot() {
        return new Snapshot(
                openConnections.get(),
                totalConnections.get(),
                activeRooms.get(),
                bytesSent.get(),
                bytesReceived.get(),
                messagesProcessed.get(),
                Duration.between(startedAt, clock.instant()));
    }

    /**
     * Formats a byte count for humans: {@code 512B}, {@code 1.50KB}, {@code 10.00MB}.
     *
     * @param bytes the byte count
     * @return the formatted count
     */
    public static String formatBytes(long bytes) {
        if (bytes < 1024) {
            return bytes + "B";
        }
        if (bytes < 1024 * 1024) {
            return String.format(Locale.ROOT, "%.2fKB", bytes / 1024.0);
        }
        return String.format(Locale.ROOT, "%.2fMB", bytes / (1024.0 * 1024.0));
    }

    /**
     * Point-in-time view of the counters.
     *
     * @param openConnections connections currently open
     * @param totalConnections connections accepted since start
     * @param rooms rooms currently existing
     * @param bytesSent bytes sent by closed connections
     * @param bytesReceived bytes received by closed connections
     * @param messagesProcessed frames dispatched, heartbeats excluded
     * @param uptime time since the metrics were created
     */
    public record Snapshot(
            long openConnections,
            long totalConnections,
            long rooms,
            long bytesSent,
            long bytesReceived,
            long messagesProcessed,
            Duration uptime) {

        /**
         * Returns the average message rate over the uptime.
         *
         * @return messages per second, 0 for a zero uptime
         */
        public double messagesPerSecond() {
            double seconds = uptime.toMillis() / 1000.0;
            return seconds > 0 ? messagesProcessed / seconds : 0.0;
        }

        /**
         * Renders the snapshot as a multi-line report.
         *
         * @return the report
         */
        public String format() {
            return String.format(Locale.ROOT,
                    "Server metrics:%n"
                            + "  Uptime:              %ds%n"
                            + "  Active connections:  %d (total %d)%n"
                            + "  Active rooms:        %d%n"
                            + "  Bytes sent:          %s%n"
                            + "  Bytes received:      %s%n"
                            + "  Messages processed:  %d%n"
                            + "  Messages/sec:        %.2f",
                    uptime.getSeconds(),
                    openConnections,
                    totalConnections,
                    rooms,
                    formatBytes(bytesSent),
                    formatBytes(bytesReceived),
                    messagesProcessed,
                    messagesPerSecond());
        }
    }
}
