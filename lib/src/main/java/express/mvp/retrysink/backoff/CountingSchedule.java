package express.mvp.retrysink.backoff;

import java.time.Duration;
import java.util.Optional;

/** Finite schedule whose n-th entry is computed when it is pulled. */
abstract class CountingSchedule implements BackoffSchedule {

    private final int maxRetries;

    /** Number of entries handed out so far. */
    private int retry;

    CountingSchedule(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    /**
     * Computes the delay of one entry.
     *
     * @param retry zero-based index of the entry
     * @return the delay, never negative
     */
    abstract Duration delayFor(int retry);

    @Override
    public Optional<Duration> nextDelay() {
        if (retry >= maxRetries) {
            return Optional.empty();
        }
        return Optional.of(delayFor(retry++));
    }
}
