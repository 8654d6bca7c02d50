package express.mvp.relay.transport.error;

/**
 * Categories of relay errors and the connection policy attached to each.
 *
 * <ul>
 *   <li><b>PROTOCOL:</b> the byte stream can no longer be trusted; an ERROR frame is sent and the
 *       connection is closed
 *   <li><b>APPLICATION:</b> the request was well formed but cannot be honoured; an ERROR frame is
 *       sent and the connection stays open
 *   <li><b>TRANSPORT:</b> the socket failed; the error is logged and the connection terminated
 *   <li><b>INTERNAL:</b> a handler failed unexpectedly; logged, reported, connection stays open
 * </ul>
 *
 * @see ErrorCode
 * @see ErrorClassifier
 */
public enum ErrorCategory {
    PROTOCOL(true, true, "Protocol error - stream desynchronized"),

    APPLICATION(false, true, "Application error - request rejected"),

    TRANSPORT(true, false, "Transport error - socket failure"),

    INTERNAL(false, true, "Internal error - handler failure");

    private final boolean closesConnection;
    private final boolean reportedToPeer;
    private final String description;

    ErrorCategory(boolean closesConnection, boolean reportedToPeer, String description) {
        this.closesConnection = closesConnection;
        this.reportedToPeer = reportedToPeer;
        this.description = description;
    }

    /**
     * Checks if errors in this category end the connection.
     *
     * @return true for PROTOCOL and TRANSPORT
     */
    public boolean closesConnection() {
        return closesConnection;
    }

    /**
     * Checks if the peer is told about the error with an ERROR frame.
     *
     * @return false only for TRANSPORT, where the socket is already unusable
     */
    public boolean isReportedToPeer() {
        return reportedToPeer;
    }

    /**
     * Returns a human-readable description of this category.
     *
     * @return the description
     */
    public String description() {
        return description;
    }

    @Override
    public String toString() {
        return name() + " (" + description + ")";
    }
}
