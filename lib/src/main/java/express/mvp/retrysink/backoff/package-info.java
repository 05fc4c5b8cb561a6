/**
 * Backoff schedules and strategies driving reconnection campaigns.
 *
 * <p>A {@link express.mvp.retrysink.backoff.BackoffStrategy} is asked for one fresh {@link
 * express.mvp.retrysink.backoff.BackoffSchedule} per campaign. The schedule is pulled one delay at
 * a time, so it may be unbounded.
 */
package express.mvp.retrysink.backoff;
