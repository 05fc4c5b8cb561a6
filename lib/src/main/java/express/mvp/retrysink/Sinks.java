package express.mvp.retrysink;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BiConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Combinators for {@link Sink}s.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * // Keep logging even when the collector stays down; failures are logged and dropped
 * Sink<LogRecord, RuntimeException> sink = Sinks.ignoringErrors(retryingSink);
 * }</pre>
 */
public final class Sinks {

    private static final Logger LOGGER = Logger.getLogger(Sinks.class.getName());

    private Sinks() {
        // Utility class
    }

    /**
     * Returns a sink that never fails; failures are logged at {@link Level#WARNING} and dropped.
     *
     * @param sink the sink to wrap
     * @param <E> the event type
     * @return a sink that does not throw checked exceptions
     */
    public static <E> Sink<E, RuntimeException> ignoringErrors(Sink<E, ?> sink) {
        return ignoringErrors(
                sink,
                (event, error) ->
                        LOGGER.log(Level.WARNING, "Dropping event after sink failure", error));
    }

    /**
     * Returns a sink that never fails; failures are handed to {@code handler} and dropped.
     *
     * <p>Only {@link Exception}s are handled. {@link Error}s propagate.
     *
     * @param sink the sink to wrap
     * @param handler receives the event and the failure
     * @param <E> the event type
     * @return a sink that does not throw
     */
    public static <E> Sink<E, RuntimeException> ignoringErrors(
            Sink<E, ?> sink, BiConsumer<? super E, ? super Exception> handler) {
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(handler, "handler");
        return new Sink<>() {
            @Override
            public void accept(E event) {
                try {
                    sink.accept(event);
                } catch (Exception e) {
                    handler.accept(event, e);
                }
            }

            @Override
            public void close() {
                sink.close();
            }
        };
    }

    /**
     * Returns a sink that serializes calls to {@code sink} with an exclusive lock.
     *
     * @param sink a sink that is not thread-safe
     * @param <E> the event type
     * @param <X> the failure type
     * @return a thread-safe view of {@code sink}
     */
    public static <E, X extends Exception> Sink<E, X> synchronizedSink(Sink<E, X> sink) {
        Objects.requireNonNull(sink, "sink");
        ReentrantLock lock = new ReentrantLock();
        return new Sink<>() {
            @Override
            public void accept(E event) throws X {
                lock.lock();
                try {
                    sink.accept(event);
                } finally {
                    lock.unlock();
                }
            }

            @Override
            public void close() {
                lock.lock();
                try {
                    sink.close();
                } finally {
                    lock.unlock();
                }
            }
        };
    }
}
