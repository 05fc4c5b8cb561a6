package express.mvp.retrysink.jsontcp;

import express.mvp.retrysink.Sink;
import java.util.Objects;
import java.util.logging.ErrorManager;
import java.util.logging.Handler;
import java.util.logging.LogRecord;

/**
 * Bridges {@code java.util.logging} to a {@link Sink}.
 *
 * <p>Records that pass the handler's level and filter are handed to the sink. A failure is
 * reported to the handler's {@link ErrorManager} with {@link ErrorManager#WRITE_FAILURE} and the
 * record is dropped, so logging never throws into application code.
 *
 * <p>Records logged on a thread that is already inside {@link #publish(LogRecord)} are dropped.
 * This stops the sink's own diagnostics (for example a retrying sink reporting that it gave up)
 * from re-entering the sink when the handler is installed on the root logger.
 */
public final class SinkHandler extends Handler {

    private final Sink<LogRecord, ?> sink;
    private final ThreadLocal<Boolean> publishing = ThreadLocal.withInitial(() -> Boolean.FALSE);

    /**
     * Creates a handler writing to the given sink.
     *
     * @param sink destination, closed together with this handler
     */
    public SinkHandler(Sink<LogRecord, ?> sink) {
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    @Override
    public void publish(LogRecord record) {
        if (!isLoggable(record) || publishing.get()) {
            return;
        }
        publishing.set(Boolean.TRUE);
        try {
            sink.accept(record);
        } catch (Exception e) {
            reportError("Failed to publish log record", e, ErrorManager.WRITE_FAILURE);
        } finally {
            publishing.set(Boolean.FALSE);
        }
    }

    /** Records are flushed by the sink on every write. */
    @Override
    public void flush() {}

    @Override
    public void close() {
        try {
            sink.close();
        } catch (RuntimeException e) {
            reportError("Failed to close sink", e, ErrorManager.CLOSE_FAILURE);
        }
    }
}
