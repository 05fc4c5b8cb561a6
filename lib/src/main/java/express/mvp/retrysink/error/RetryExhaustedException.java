package express.mvp.retrysink.error;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Optional;

/**
 * Thrown when a reconnection campaign runs out of backoff entries.
 *
 * <p>The exception carries the most recent failure of each kind seen during the campaign: the last
 * error raised while creating a sink and the last error raised by a sink while accepting the
 * event. At least one of the two is always present. Earlier failures of the same kind are not
 * kept.
 *
 * <p>The {@linkplain #getCause() cause} is the sink error when there is one, otherwise the factory
 * error. When both are present the factory error is also attached as a {@linkplain
 * #getSuppressed() suppressed} exception so that stack traces show it.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try {
 *     sink.accept(event);
 * } catch (RetryExhaustedException e) {
 *     e.factoryError(ConnectException.class)
 *         .ifPresent(ce -> alerting.endpointDown(ce.getMessage()));
 * }
 * }</pre>
 */
public class RetryExhaustedException extends Exception {

    private static final long serialVersionUID = 1L;

    /** Last error raised by the sink factory. */
    private final Exception factoryError;

    /** Last error raised by a sink. */
    private final Exception sinkError;

    /** Construction attempts made by the campaign. */
    private final int attempts;

    /**
     * Creates a new exception.
     *
     * @param factoryError last factory error, may be null
     * @param sinkError last sink error, may be null
     * @param attempts number of construction attempts made by the campaign
     * @throws IllegalArgumentException if both errors are null
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Exceptions are kept for diagnostics and cannot be safely copied.")
    public RetryExhaustedException(Exception factoryError, Exception sinkError, int attempts) {
        super(
                message(factoryError, sinkError, attempts),
                sinkError != null ? sinkError : factoryError);
        if (factoryError == null && sinkError == null) {
            throw new IllegalArgumentException(
                    "At least one of factoryError or sinkError is required");
        }
        this.factoryError = factoryError;
        this.sinkError = sinkError;
        this.attempts = attempts;
        if (factoryError != null && sinkError != null) {
            addSuppressed(factoryError);
        }
    }

    /**
     * Returns the last error raised while creating a sink.
     *
     * @return the factory error, empty if every construction attempt succeeded
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "Exceptions are exposed for diagnostics and cannot be safely copied.")
    public Optional<Exception> factoryError() {
        return Optional.ofNullable(factoryError);
    }

    /**
     * Returns the last factory error if it is of the given type.
     *
     * @param type the expected exception type
     * @param <T> the exception type
     * @return the factory error, empty if absent or of another type
     */
    public <T extends Exception> Optional<T> factoryError(Class<T> type) {
        return factoryError().filter(type::isInstance).map(type::cast);
    }

    /**
     * Returns the last error raised by a sink while accepting the event.
     *
     * @return the sink error, empty if no sink ever rejected the event
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "Exceptions are exposed for diagnostics and cannot be safely copied.")
    public Optional<Exception> sinkError() {
        return Optional.ofNullable(sinkError);
    }

    /**
     * Returns the last sink error if it is of the given type.
     *
     * @param type the expected exception type
     * @param <T> the exception type
     * @return the sink error, empty if absent or of another type
     */
    public <T extends Exception> Optional<T> sinkError(Class<T> type) {
        return sinkError().filter(type::isInstance).map(type::cast);
    }

    /**
     * Returns the number of construction attempts made by the failed campaign.
     *
     * @return attempt count, 0 if the campaign ended before its first attempt
     */
    public int attempts() {
        return attempts;
    }

    /**
     * Returns the category of the most relevant failure.
     *
     * @return category of the {@linkplain #getCause() cause}
     */
    public ErrorCategory category() {
        return ErrorClassifier.classify(getCause());
    }

    private static String message(Exception factoryError, Exception sinkError, int attempts) {
        return "Run out of retries after "
                + attempts
                + (attempts == 1 ? " attempt" : " attempts")
                + ", last errors: factory="
                + ErrorClassifier.describe(factoryError)
                + ", sink="
                + ErrorClassifier.describe(sinkError);
    }
}
