package express.mvp.retrysink.backoff;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Produces a fresh {@link BackoffSchedule} for every reconnection campaign.
 *
 * <p>{@link #newSchedule()} is called exactly once at the start of each campaign. Schedules
 * returned by distinct calls must not share consumption state.
 *
 * <h2>Built-in Strategies</h2>
 *
 * <ul>
 *   <li>{@link #defaultStrategy()} - 1s, 2s, 3s, 4s
 *   <li>{@link #noRetry()} - One attempt per campaign, never retry
 *   <li>{@link #immediate(int)} - Retry without delay
 *   <li>{@link #fixedDelay(int, Duration)} - Fixed delay between retries
 *   <li>{@link #linear(int, Duration)} - Delay grows by a fixed step
 *   <li>{@link #exponentialBackoff(int, Duration, Duration)} - Doubling delay with cap
 *   <li>{@link #exponentialBackoffWithJitter(int, Duration, Duration, double)} - With jitter
 *   <li>{@link #forever(Duration)} - Unbounded fixed delay
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * BackoffStrategy strategy = BackoffStrategy.builder()
 *     .maxRetries(5)                       // at most 5 retries per campaign
 *     .initialDelay(Duration.ofMillis(100))
 *     .maxDelay(Duration.ofSeconds(30))
 *     .jitterFactor(0.2)                   // +/- 20%
 *     .build();
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Built-in strategies are immutable and may be shared. Custom strategies are called while the
 * owning {@link express.mvp.retrysink.RetryingSink} holds its lock, but may also be shared between
 * several sinks and must then be safe for concurrent use.
 *
 * @see BackoffSchedule
 */
@FunctionalInterface
public interface BackoffStrategy {

    /** Number of retries made by {@link #defaultStrategy()}. */
    int DEFAULT_RETRIES = 4;

    /** Delay step of {@link #defaultStrategy()}. */
    Duration DEFAULT_STEP = Duration.ofSeconds(1);

    /**
     * Returns a new, unconsumed schedule.
     *
     * @return a fresh schedule
     */
    BackoffSchedule newSchedule();

    /**
     * Returns the strategy used when none is configured: four retries waiting 1s, 2s, 3s and 4s.
     *
     * @return the default strategy
     */
    static BackoffStrategy defaultStrategy() {
        return linear(DEFAULT_RETRIES, DEFAULT_STEP);
    }

    /**
     * Returns a strategy whose schedules are empty.
     *
     * @return no-retry strategy
     */
    static BackoffStrategy noRetry() {
        return BackoffSchedule::empty;
    }

    /**
     * Returns a strategy that retries without waiting.
     *
     * @param maxRetries number of retries per campaign
     * @return immediate retry strategy
     */
    static BackoffStrategy immediate(int maxRetries) {
        return fixedDelay(maxRetries, Duration.ZERO);
    }

    /**
     * Returns a strategy with the same delay before every retry.
     *
     * @param maxRetries number of retries per campaign
     * @param delay delay before each retry
     * @return fixed delay strategy
     */
    static BackoffStrategy fixedDelay(int maxRetries, Duration delay) {
        return builder()
                .maxRetries(maxRetries)
                .initialDelay(delay)
                .maxDelay(delay)
                .backoffMultiplier(1.0)
                .build();
    }

    /**
     * Returns a strategy whose n-th retry waits {@code n * step}.
     *
     * @param maxRetries number of retries per campaign
     * @param step delay increment
     * @return linear strategy
     */
    static BackoffStrategy linear(int maxRetries, Duration step) {
        requireRetries(maxRetries);
        Objects.requireNonNull(step, "step");
        if (step.isNegative()) {
            throw new IllegalArgumentException("step must not be negative");
        }
        return () -> new CountingSchedule(maxRetries) {
            @Override
            Duration delayFor(int retry) {
                return step.multipliedBy(retry + 1L);
            }
        };
    }

    /**
     * Returns a strategy with exponential backoff.
     *
     * @param maxRetries number of retries per campaign
     * @param initialDelay delay before the first retry
     * @param maxDelay maximum delay cap
     * @return exponential backoff strategy
     */
    static BackoffStrategy exponentialBackoff(
            int maxRetries, Duration initialDelay, Duration maxDelay) {
        return builder()
                .maxRetries(maxRetries)
                .initialDelay(initialDelay)
                .maxDelay(maxDelay)
                .backoffMultiplier(2.0)
                .build();
    }

    /**
     * Returns a strategy with exponential backoff and jitter.
     *
     * <p>Jitter spreads the reconnects of many clients that lost the same endpoint at once.
     *
     * @param maxRetries number of retries per campaign
     * @param initialDelay delay before the first retry
     * @param maxDelay maximum delay cap
     * @param jitterFactor jitter factor (0.0-1.0, e.g., 0.2 for ±20%)
     * @return exponential backoff with jitter strategy
     */
    static BackoffStrategy exponentialBackoffWithJitter(
            int maxRetries, Duration initialDelay, Duration maxDelay, double jitterFactor) {
        return builder()
                .maxRetries(maxRetries)
                .initialDelay(initialDelay)
                .maxDelay(maxDelay)
                .backoffMultiplier(2.0)
                .jitterFactor(jitterFactor)
                .build();
    }

    /**
     * Returns a strategy that never gives up, waiting {@code delay} before every retry.
     *
     * <p>A campaign driven by this strategy only ends once a sink is created (and, for a delivery,
     * accepts the event). The calling thread stays blocked until then.
     *
     * @param delay delay before each retry
     * @return unbounded strategy
     */
    static BackoffStrategy forever(Duration delay) {
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
        return () -> () -> Optional.of(delay);
    }

    /**
     * Returns a builder for custom strategy configuration.
     *
     * @return new builder
     */
    static Builder builder() {
        return new Builder();
    }

    private static void requireRetries(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
    }

    /** Builder for multiplicative backoff strategies. */
    final class Builder {
        private int maxRetries = DEFAULT_RETRIES;
        private long initialDelayMillis = 100;
        private long maxDelayMillis = 30_000;
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.0;

        private Builder() {}

        /**
         * Sets the number of retries each schedule allows.
         *
         * @param maxRetries max retries (must be >= 0)
         * @return this builder
         */
        public Builder maxRetries(int maxRetries) {
            requireRetries(maxRetries);
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Sets the delay before the first retry.
         *
         * @param delay initial delay, a whole number of milliseconds
         * @return this builder
         */
        public Builder initialDelay(Duration delay) {
            this.initialDelayMillis = requireMillis(delay, "initialDelay");
            return this;
        }

        /**
         * Sets the maximum delay cap.
         *
         * @param maxDelay maximum delay, a whole number of milliseconds
         * @return this builder
         */
        public Builder maxDelay(Duration maxDelay) {
            this.maxDelayMillis = requireMillis(maxDelay, "maxDelay");
            return this;
        }

        private static long requireMillis(Duration delay, String name) {
            Objects.requireNonNull(delay, name);
            if (delay.isNegative()) {
                throw new IllegalArgumentException(name + " must not be negative");
            }
            if (delay.compareTo(Sleeper.MAX_SLEEP) > 0) {
                throw new IllegalArgumentException(name + " is too large: " + delay);
            }
            if (delay.toNanosPart() % 1_000_000 != 0) {
                throw new IllegalArgumentException(
                        name + " must be a whole number of milliseconds: " + delay);
            }
            return delay.toMillis();
        }

        /**
         * Sets the backoff multiplier.
         *
         * @param multiplier multiplier (1.0 = fixed delay, 2.0 = double each time)
         * @return this builder
         */
        public Builder backoffMultiplier(double multiplier) {
            if (multiplier < 1.0) {
                throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
            }
            this.backoffMultiplier = multiplier;
            return this;
        }

        /**
         * Sets the jitter factor.
         *
         * @param jitter jitter factor (0.0-1.0)
         * @return this builder
         */
        public Builder jitterFactor(double jitter) {
            if (jitter < 0 || jitter > 1.0) {
                throw new IllegalArgumentException("jitterFactor must be 0.0-1.0");
            }
            this.jitterFactor = jitter;
            return this;
        }

        /**
         * Builds the strategy.
         *
         * @return new strategy
         */
        public BackoffStrategy build() {
            int retries = maxRetries;
            long initial = initialDelayMillis;
            long cap = maxDelayMillis;
            double multiplier = backoffMultiplier;
            double jitterFactor = this.jitterFactor;
            return () -> new CountingSchedule(retries) {
                @Override
                Duration delayFor(int retry) {
                    long delay;
                    if (multiplier <= 1.0) {
                        delay = initial;
                    } else {
                        delay = (long) (initial * Math.pow(multiplier, retry));
                    }
                    delay = Math.min(delay, cap);

                    if (jitterFactor > 0) {
                        double jitter =
                                ThreadLocalRandom.current().nextDouble(-jitterFactor, jitterFactor);
                        delay = Math.max(0, (long) (delay * (1 + jitter)));
                    }
                    return Duration.ofMillis(delay);
                }
            };
        }
    }
}
