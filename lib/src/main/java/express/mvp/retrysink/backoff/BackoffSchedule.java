package express.mvp.retrysink.backoff;

import java.time.Duration;
import java.util.Arrays;
import java.util.Iterator;
import java.util.Objects;
import java.util.Optional;

/**
 * One reconnection campaign's timing plan.
 *
 * <p>A schedule is a pull-based sequence of wait durations, consumed front to back with one entry
 * per construction attempt. It is produced lazily, so it may be unbounded, and a campaign that
 * succeeds early never materializes the remaining entries.
 *
 * <p>An exhausted schedule (an empty {@link Optional} from {@link #nextDelay()}) ends the campaign.
 * Once exhausted a schedule stays exhausted.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * BackoffSchedule schedule = BackoffSchedule.of(Duration.ofMillis(100), Duration.ofMillis(500));
 * Optional<Duration> delay;
 * while ((delay = schedule.nextDelay()).isPresent()) {
 *     sleeper.sleep(delay.get());
 *     if (tryConnect()) {
 *         break;
 *     }
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Schedules are not thread-safe. Each campaign owns its schedule exclusively.
 *
 * @see BackoffStrategy
 */
@FunctionalInterface
public interface BackoffSchedule {

    /**
     * Returns the delay to wait before the next attempt.
     *
     * @return the next delay (non-negative), or empty when no attempt remains
     */
    Optional<Duration> nextDelay();

    /**
     * Returns a schedule with no entries.
     *
     * @return an exhausted schedule
     */
    static BackoffSchedule empty() {
        return Optional::empty;
    }

    /**
     * Returns a schedule over the given delays.
     *
     * @param delays the delays, in order
     * @return a new schedule
     * @throws IllegalArgumentException if a delay is negative
     */
    static BackoffSchedule of(Duration... delays) {
        return of(Arrays.asList(delays.clone()));
    }

    /**
     * Returns a schedule over the given delays.
     *
     * @param delays the delays, in order
     * @return a new schedule
     * @throws IllegalArgumentException if a delay is negative
     */
    static BackoffSchedule of(Iterable<Duration> delays) {
        Objects.requireNonNull(delays, "delays");
        return from(delays.iterator());
    }

    /**
     * Returns a schedule that pulls its delays from an iterator.
     *
     * <p>The iterator may be infinite. Each delay is validated when it is pulled.
     *
     * @param delays the source iterator
     * @return a new schedule
     */
    static BackoffSchedule from(Iterator<Duration> delays) {
        Objects.requireNonNull(delays, "delays");
        return () -> {
            if (!delays.hasNext()) {
                return Optional.empty();
            }
            return Optional.of(requireNonNegative(delays.next()));
        };
    }

    /**
     * Returns a schedule whose first entry is a zero delay, followed by every entry of {@code
     * schedule}.
     *
     * @param schedule the schedule to extend
     * @return a schedule one entry longer
     */
    static BackoffSchedule prependZero(BackoffSchedule schedule) {
        Objects.requireNonNull(schedule, "schedule");
        boolean[] taken = {false};
        return () -> {
            if (!taken[0]) {
                taken[0] = true;
                return Optional.of(Duration.ZERO);
            }
            return schedule.nextDelay().map(BackoffSchedule::requireNonNegative);
        };
    }

    private static Duration requireNonNegative(Duration delay) {
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("Backoff delay must not be negative: " + delay);
        }
        return delay;
    }
}
