package express.mvp.retrysink.error;

import java.io.EOFException;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.PortUnreachableException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.nio.channels.ClosedChannelException;
import java.nio.charset.CharacterCodingException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLException;

/**
 * Classifies sink and factory failures into {@link ErrorCategory categories}.
 *
 * <p>Classification looks at the exception type first and then walks the cause chain. Wrapper
 * types such as {@link UncheckedIOException} are looked through.
 *
 * <pre>{@code
 * ErrorCategory category = ErrorClassifier.classify(exception);
 * LOGGER.fine(() -> "Sink failed (" + category + "): " + exception);
 * }</pre>
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
        // Utility class
    }

    /**
     * Classifies a failure.
     *
     * @param throwable the failure, may be null
     * @return the category, {@link ErrorCategory#UNKNOWN} for null or unrecognized failures
     */
    public static ErrorCategory classify(Throwable throwable) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = throwable;
        while (current != null && seen.add(current)) {
            ErrorCategory category = classifyType(current);
            if (category != ErrorCategory.UNKNOWN) {
                return category;
            }
            current = current.getCause();
        }
        return ErrorCategory.UNKNOWN;
    }

    /**
     * Returns a one-line description of a failure, including its category.
     *
     * @param throwable the failure
     * @return description such as {@code "Network: ConnectException: Connection refused"}
     */
    public static String describe(Throwable throwable) {
        if (throwable == null) {
            return "none";
        }
        return classify(throwable).displayName()
                + ": "
                + throwable.getClass().getSimpleName()
                + ": "
                + throwable.getMessage();
    }

    private static ErrorCategory classifyType(Throwable t) {
        if (t instanceof VirtualMachineError) {
            return t instanceof OutOfMemoryError ? ErrorCategory.RESOURCE : ErrorCategory.FATAL;
        }
        if (t instanceof LinkageError || t instanceof SecurityException) {
            return ErrorCategory.FATAL;
        }

        // Timeouts before the generic socket check, SocketTimeoutException is an IOException
        if (t instanceof SocketTimeoutException
                || t instanceof TimeoutException
                || t instanceof InterruptedIOException
                || t instanceof InterruptedException) {
            return ErrorCategory.TRANSIENT;
        }

        if (t instanceof ConnectException
                || t instanceof UnknownHostException
                || t instanceof NoRouteToHostException
                || t instanceof PortUnreachableException
                || t instanceof ClosedChannelException
                || t instanceof SocketException
                || t instanceof EOFException
                || t instanceof SSLException) {
            return ErrorCategory.NETWORK;
        }

        if (t instanceof RejectedExecutionException) {
            return ErrorCategory.RESOURCE;
        }

        if (t instanceof CharacterCodingException) {
            return ErrorCategory.PROTOCOL;
        }

        return ErrorCategory.UNKNOWN;
    }
}
