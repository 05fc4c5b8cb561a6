/**
 * Connection state tracking for {@link express.mvp.retrysink.RetryingSink}.
 *
 * @see express.mvp.retrysink.lifecycle.ConnectionStateMachine
 */
package express.mvp.retrysink.lifecycle;
