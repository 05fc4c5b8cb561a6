/**
 * Failure reporting for reconnection campaigns.
 *
 * <ul>
 *   <li>{@link express.mvp.retrysink.error.RetryExhaustedException} - Last factory and sink errors
 *       of a campaign that ran out of retries
 *   <li>{@link express.mvp.retrysink.error.ErrorClassifier} - Classifies failures for diagnostics
 *   <li>{@link express.mvp.retrysink.error.ErrorCategory} - The categories
 * </ul>
 */
package express.mvp.retrysink.error;
