package express.mvp.retrysink;

/**
 * Destination that accepts one event at a time.
 *
 * <p>A sink is the unit that {@link RetryingSink} owns, discards and recreates. Implementations may
 * be stateful and may hold open connections; they are released through {@link #close()} when the
 * owner drops them.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * Sink<String, IOException> sink = line -> {
 *     writer.write(line);
 *     writer.newLine();
 *     writer.flush();
 * };
 * sink.accept("hello");
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Implementations are not required to be thread-safe. {@link RetryingSink} never calls a sink it
 * owns from more than one thread at a time.
 *
 * @param <E> the event type
 * @param <X> the failure reported by {@link #accept(Object)}
 * @see SinkFactory
 */
@FunctionalInterface
public interface Sink<E, X extends Exception> extends AutoCloseable {

    /**
     * Accepts one event.
     *
     * @param event the event to write (never modified)
     * @throws X if the event could not be written
     */
    void accept(E event) throws X;

    /**
     * Releases any resource held by this sink.
     *
     * <p>The default implementation does nothing.
     */
    @Override
    default void close() {
        // Nothing to release
    }
}
