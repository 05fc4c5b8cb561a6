package express.mvp.retrysink.backoff;

import java.time.Duration;

/**
 * Waits out a backoff delay on the calling thread.
 *
 * <p>The default {@link #system()} sleeper blocks with {@link Thread#sleep(long, int)}. Tests and
 * hosts with their own clock can plug in a different implementation.
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * Blocks the calling thread for {@code delay}.
     *
     * @param delay how long to wait, zero means do not wait
     * @throws InterruptedException if the thread is interrupted while waiting
     */
    void sleep(Duration delay) throws InterruptedException;

    /** Longest delay {@link Thread#sleep(long, int)} can express. Longer ones are clamped. */
    Duration MAX_SLEEP = Duration.ofMillis(Long.MAX_VALUE);

    /**
     * Returns a sleeper backed by {@link Thread#sleep(long, int)}.
     *
     * <p>Delays beyond {@link #MAX_SLEEP} are clamped to it.
     *
     * @return the system sleeper
     */
    static Sleeper system() {
        return delay -> {
            if (delay.isZero() || delay.isNegative()) {
                return;
            }
            if (delay.compareTo(MAX_SLEEP) >= 0) {
                Thread.sleep(Long.MAX_VALUE);
                return;
            }
            Thread.sleep(delay.toMillis(), delay.toNanosPart() % 1_000_000);
        };
    }
}
