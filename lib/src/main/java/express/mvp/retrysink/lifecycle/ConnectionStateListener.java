package express.mvp.retrysink.lifecycle;

/**
 * Callback for connection state changes of a {@link express.mvp.retrysink.RetryingSink}.
 *
 * <pre>{@code
 * RetryingSink<LogRecord, JsonTcpSink> sink = RetryingSink.builder(factory)
 *     .listener((previous, current, cause) -> {
 *         if (current == ConnectionState.DISCONNECTED && cause != null) {
 *             metrics.incrementDisconnects();
 *         }
 *     })
 *     .build();
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Callbacks run synchronously on the thread driving the sink, while the sink holds its lock.
 * They must be quick and must not call back into the same sink.
 *
 * @see ConnectionStateMachine
 */
@FunctionalInterface
public interface ConnectionStateListener {

    /**
     * Called when the state changes.
     *
     * @param previousState the state before the transition
     * @param currentState the new state after the transition
     * @param cause the failure behind the transition, null for normal transitions
     */
    void onStateChanged(
            ConnectionState previousState, ConnectionState currentState, Throwable cause);
}
