/**
 * Reconnecting retry decorator for logging sinks.
 *
 * <p>{@link express.mvp.retrysink.RetryingSink} wraps sinks produced by a {@link
 * express.mvp.retrysink.SinkFactory} and transparently recreates them when creation or delivery
 * fails, following the delays of a {@link express.mvp.retrysink.backoff.BackoffStrategy}.
 *
 * <h2>Key Types</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.retrysink.Sink} - Destination accepting one event at a time
 *   <li>{@link express.mvp.retrysink.SinkFactory} - Fallible producer of fresh sinks
 *   <li>{@link express.mvp.retrysink.RetryingSink} - The reconnecting decorator
 *   <li>{@link express.mvp.retrysink.Sinks} - Error-ignoring and synchronizing combinators
 * </ul>
 *
 * @see express.mvp.retrysink.backoff
 * @see express.mvp.retrysink.error.RetryExhaustedException
 */
package express.mvp.retrysink;
