package express.mvp.relay.transport;

import express.mvp.relay.transport.lifecycle.ConnectionState;
import java.time.Instant;

/**
 * Immutable snapshot of a connection's counters.
 *
 * @param id the connection id
 * @param state the state when the snapshot was taken
 * @param bytesSent encoded bytes handed to the transport
 * @param bytesReceived raw bytes received from the transport
 * @param framesSent frames handed to the transport
 * @param framesReceived complete frames extracted, heartbeats included
 * @param lastHeartbeatAt time of the last HEARTBEAT, or null if none arrived
 * @param bufferedBytes bytes of an incomplete frame still in the receive buffer
 */
public record ConnectionStats(
        String id,
        ConnectionState state,
        long bytesSent,
        long bytesReceived,
        long framesSent,
        long framesReceived,
        Instant lastHeartbeatAt,
        int bufferedBytes) {}
