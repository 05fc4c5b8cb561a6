package express.mvp.retrysink;

/**
 * Fallible producer of fresh {@link Sink} instances.
 *
 * <p>Each call to {@link #create()} is an independent attempt: a failed call must not prevent a
 * later call from succeeding, and no state is carried between calls. Blocking I/O (for example
 * opening a socket) is expected here.
 *
 * <pre>{@code
 * SinkFactory<JsonTcpSink, IOException> factory = () -> JsonTcpSink.connect(config);
 * }</pre>
 *
 * @param <S> the sink type produced
 * @param <X> the failure reported when a sink cannot be created
 */
@FunctionalInterface
public interface SinkFactory<S extends Sink<?, ?>, X extends Exception> {

    /**
     * Creates a new sink.
     *
     * @return a new sink, never null
     * @throws X if the sink could not be created
     */
    S create() throws X;
}
