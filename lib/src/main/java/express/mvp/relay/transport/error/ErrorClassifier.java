package express.mvp.relay.transport.error;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.ClosedChannelException;

/**
 * Classifies throwables into {@link ErrorCategory} values.
 *
 * <h2>Classification Strategy</h2>
 *
 * <ol>
 *   <li>{@link RelayException} subclasses carry their own category
 *   <li>I/O failures anywhere in the cause chain are TRANSPORT
 *   <li>everything else is INTERNAL
 * </ol>
 *
 * <pre>{@code
 * ErrorCategory category = ErrorClassifier.classify(e);
 * if (category.closesConnection()) {
 *     connection.terminate(e);
 * }
 * }</pre>
 */
public final class ErrorClassifier {

    /** Maximum cause-chain depth inspected, guards against cyclic causes. */
    private static final int MAX_CAUSE_DEPTH = 8;

    private ErrorClassifier() {
        // Utility class
    }

    /**
     * Classifies a throwable.
     *
     * @param throwable the failure to classify, may be null
     * @return the error category, INTERNAL for null or unrecognised failures
     */
    public static ErrorCategory classify(Throwable throwable) {
        Throwable current = throwable;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof RelayException relay) {
                return relay.category();
            }
            if (isTransportError(current)) {
                return ErrorCategory.TRANSPORT;
            }
            current = current.getCause();
        }
        return ErrorCategory.INTERNAL;
    }

    /**
     * Resolves the error code to report for a throwable.
     *
     * @param throwable the failure
     * @return the carried code for relay exceptions, otherwise a code matching the category
     */
    public static ErrorCode codeOf(Throwable throwable) {
        if (throwable instanceof RelayException relay) {
            return relay.code();
        }
        return classify(throwable) == ErrorCategory.TRANSPORT
                ? ErrorCode.TRANSPORT_FAILURE
                : ErrorCode.INTERNAL_ERROR;
    }

    /**
     * Checks if a throwable is a socket-level failure.
     *
     * @param throwable the failure
     * @return true for I/O exceptions and closed-channel errors
     */
    public static boolean isTransportError(Throwable throwable) {
        return throwable instanceof IOException
                || throwable instanceof UncheckedIOException
                || throwable instanceof ClosedChannelException;
    }
}
