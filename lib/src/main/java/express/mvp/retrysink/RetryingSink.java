package express.mvp.retrysink;

import express.mvp.retrysink.backoff.BackoffSchedule;
import express.mvp.retrysink.backoff.BackoffStrategy;
import express.mvp.retrysink.backoff.Sleeper;
import express.mvp.retrysink.error.ErrorClassifier;
import express.mvp.retrysink.error.RetryExhaustedException;
import express.mvp.retrysink.lifecycle.ConnectionState;
import express.mvp.retrysink.lifecycle.ConnectionStateListener;
import express.mvp.retrysink.lifecycle.ConnectionStateMachine;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sink decorator that transparently reconnects a failure-prone sink.
 *
 * <p>A {@code RetryingSink} owns at most one live sink created by a {@link SinkFactory}. When that
 * sink rejects an event, or when there is no sink yet, the decorator drops it and runs a
 * <em>reconnection campaign</em>: it asks the {@link BackoffStrategy} for one fresh {@link
 * BackoffSchedule} and then, for every entry of that schedule, sleeps for the entry's delay,
 * creates a new sink and re-delivers the same event to it. A sink that rejects the event during
 * the campaign is dropped as well and the campaign goes on with the next entry of the <em>same</em>
 * schedule, so reconnects and re-deliveries share a single budget per {@link #accept(Object)} call.
 *
 * <p>When the schedule runs out the call fails with a {@link RetryExhaustedException} holding the
 * last factory error and the last sink error. The event is not retried any further. Failures are
 * not sticky: the next call starts a brand-new campaign with a brand-new schedule.
 *
 * <h2>First Attempt</h2>
 *
 * <p>The very first construction attempt of a {@code RetryingSink}'s lifetime is made without
 * waiting, ahead of the first schedule entry. Every later attempt waits its full scheduled delay. A
 * campaign whose schedule is empty still makes one attempt, without waiting.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * BackoffStrategy strategy =
 *     BackoffStrategy.exponentialBackoff(5, Duration.ofMillis(200), Duration.ofSeconds(5));
 * RetryingSink<LogRecord, JsonTcpSink> sink = RetryingSink.builder(new JsonTcpSinkFactory(config))
 *     .strategy(strategy)
 *     .connectNow(true)   // fail fast if the collector is down at startup
 *     .name("collector")
 *     .build();
 *
 * try {
 *     sink.accept(record);
 * } catch (RetryExhaustedException e) {
 *     // the record is lost, the next call tries again
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is thread-safe. Every {@link #accept(Object)} and {@link #close()} call holds one
 * exclusive lock for its whole duration, including backoff sleeps and blocking sink creation, so
 * concurrent callers are served one at a time. Hosts that must not block their logging threads
 * should drive the sink from a single dispatch thread.
 *
 * <p>Calls are not re-entrant. Calling {@link #accept(Object)} or {@link #close()} from code that
 * runs inside a call on the same thread (the wrapped sink, the factory, a state listener or a log
 * handler fed by this class's own logger) fails with {@link IllegalStateException}.
 *
 * @param <E> the event type
 * @param <S> the type of the wrapped sink
 * @see BackoffStrategy
 * @see RetryExhaustedException
 */
public final class RetryingSink<E, S extends Sink<E, ?>>
        implements Sink<E, RetryExhaustedException> {

    private static final Logger LOGGER = Logger.getLogger(RetryingSink.class.getName());

    /** Default name used in log messages. */
    public static final String DEFAULT_NAME = "retrying-sink";

    private final SinkFactory<? extends S, ?> factory;
    private final BackoffStrategy strategy;
    private final Sleeper sleeper;
    private final String name;

    /** Guards {@link #current} for the whole duration of a call. */
    private final ReentrantLock lock = new ReentrantLock();

    private final ConnectionStateMachine stateMachine;

    /** The live sink, null when disconnected. Guarded by {@link #lock}. */
    private S current;

    /** Set once the first connection attempt has started. Never reset. */
    private volatile boolean everConnected;

    private RetryingSink(Builder<E, S> builder) {
        this.factory = builder.factory;
        this.strategy = builder.strategy;
        this.sleeper = builder.sleeper;
        this.name = builder.name;
        this.stateMachine = new ConnectionStateMachine(name);
        for (ConnectionStateListener listener : builder.listeners) {
            stateMachine.addListener(listener);
        }
    }

    /**
     * Creates a retrying sink.
     *
     * @param factory creates the wrapped sinks
     * @param strategy backoff strategy, null for {@link BackoffStrategy#defaultStrategy()}
     * @param connectNow true to connect before returning
     * @param <E> the event type
     * @param <S> the type of the wrapped sink
     * @return the new sink
     * @throws RetryExhaustedException if {@code connectNow} is set and no sink could be created
     */
    public static <E, S extends Sink<E, ?>> RetryingSink<E, S> create(
            SinkFactory<? extends S, ?> factory, BackoffStrategy strategy, boolean connectNow)
            throws RetryExhaustedException {
        return RetryingSink.<E, S>builder(factory)
                .strategy(strategy)
                .connectNow(connectNow)
                .build();
    }

    /**
     * Returns a builder for a sink wrapping sinks created by {@code factory}.
     *
     * @param factory creates the wrapped sinks
     * @param <E> the event type
     * @param <S> the type of the wrapped sink
     * @return new builder
     */
    public static <E, S extends Sink<E, ?>> Builder<E, S> builder(
            SinkFactory<? extends S, ?> factory) {
        return new Builder<>(factory);
    }

    /**
     * Delivers an event, reconnecting as needed.
     *
     * <p>Blocks the calling thread for as long as the reconnection campaign runs.
     *
     * @param event the event to deliver
     * @throws RetryExhaustedException if the campaign ran out of backoff entries
     * @throws IllegalStateException if this sink has been closed, or on a re-entrant call
     */
    @Override
    public void accept(E event) throws RetryExhaustedException {
        rejectReentry();
        lock.lock();
        try {
            if (stateMachine.getState().isClosed()) {
                throw new IllegalStateException(name + " is closed");
            }
            Exception sinkError = null;
            S sink = current;
            if (sink != null) {
                try {
                    sink.accept(event);
                    return;
                } catch (Exception e) {
                    sinkError = e;
                    if (LOGGER.isLoggable(Level.FINE)) {
                        LOGGER.fine(name + ": sink failed, reconnecting: "
                                + ErrorClassifier.describe(e));
                    }
                    discardCurrent(e);
                }
            }
            connect(event, false, sinkError);
        } catch (RuntimeException | Error e) {
            abandon(e);
            throw e;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases the held sink, if any.
     *
     * <p>Idempotent. Any later {@link #accept(Object)} fails with {@link IllegalStateException}.
     *
     * @throws IllegalStateException on a re-entrant call
     */
    @Override
    public void close() {
        rejectReentry();
        lock.lock();
        try {
            if (stateMachine.getState().isClosed()) {
                return;
            }
            S sink = current;
            current = null;
            stateMachine.transitionTo(ConnectionState.CLOSED, null);
            if (sink != null) {
                closeQuietly(sink);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the current connection state.
     *
     * @return the state
     */
    public ConnectionState state() {
        return stateMachine.getState();
    }

    /**
     * Checks if a live sink is held.
     *
     * @return true if connected
     */
    public boolean isConnected() {
        return stateMachine.getState().isConnected();
    }

    /**
     * Checks if a connection attempt has ever been started.
     *
     * @return true once the first attempt has begun, successful or not
     */
    public boolean hasEverConnected() {
        return everConnected;
    }

    /**
     * Returns the name used in log messages.
     *
     * @return the name
     */
    public String name() {
        return name;
    }

    /** Eager connection made while building. Holds only a factory error on failure. */
    private void connectNow() throws RetryExhaustedException {
        lock.lock();
        try {
            connect(null, true, null);
        } catch (RuntimeException | Error e) {
            abandon(e);
            throw e;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs one reconnection campaign. Must be called with the lock held and no sink present.
     *
     * @param event the pending event, ignored when {@code connectOnly}
     * @param connectOnly stop as soon as a sink has been created
     * @param sinkError failure of the held sink that triggered this campaign, may be null
     */
    private void connect(E event, boolean connectOnly, Exception sinkError)
            throws RetryExhaustedException {

        BackoffSchedule schedule =
                Objects.requireNonNull(strategy.newSchedule(), "strategy returned null schedule");
        if (!everConnected) {
            everConnected = true;
            schedule = BackoffSchedule.prependZero(schedule);
        }

        Exception lastFactoryError = null;
        Exception lastSinkError = sinkError;
        int attempts = 0;

        // An empty schedule still gets its single attempt
        Optional<Duration> delay = schedule.nextDelay();
        if (delay.isEmpty()) {
            delay = Optional.of(Duration.ZERO);
        }

        while (delay.isPresent()) {
            if (stateMachine.getState() != ConnectionState.CONNECTING) {
                stateMachine.transitionTo(ConnectionState.CONNECTING, lastSinkError);
            }
            try {
                sleeper.sleep(delay.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                stateMachine.transitionTo(ConnectionState.DISCONNECTED, e);
                LOGGER.log(Level.WARNING, name + ": interrupted while waiting to reconnect", e);
                throw interrupted(e, lastFactoryError, lastSinkError, attempts);
            }

            attempts++;
            S sink;
            try {
                sink = factory.create();
                if (sink == null) {
                    throw new NullPointerException("sink factory returned null");
                }
            } catch (Exception e) {
                lastFactoryError = e;
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine(name + ": attempt " + attempts + " failed to create sink: "
                            + ErrorClassifier.describe(e));
                }
                delay = schedule.nextDelay();
                continue;
            }

            current = sink;
            stateMachine.transitionTo(ConnectionState.CONNECTED, null);
            if (connectOnly) {
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine(name + ": connected after " + attempts + " attempt(s)");
                }
                return;
            }

            try {
                sink.accept(event);
                if (LOGGER.isLoggable(Level.INFO)) {
                    LOGGER.info(name + ": reconnected after " + attempts + " attempt(s)");
                }
                return;
            } catch (Exception e) {
                lastSinkError = e;
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine(name + ": attempt " + attempts + " failed to deliver: "
                            + ErrorClassifier.describe(e));
                }
                discardCurrent(e);
            }
            delay = schedule.nextDelay();
        }

        if (stateMachine.getState() == ConnectionState.CONNECTING) {
            stateMachine.transitionTo(
                    ConnectionState.DISCONNECTED,
                    lastSinkError != null ? lastSinkError : lastFactoryError);
        }
        RetryExhaustedException exhausted =
                new RetryExhaustedException(lastFactoryError, lastSinkError, attempts);
        LOGGER.log(Level.WARNING, name + ": giving up, " + exhausted.getMessage());
        throw exhausted;
    }

    private void rejectReentry() {
        if (lock.isHeldByCurrentThread()) {
            throw new IllegalStateException(name + ": re-entrant call on the same thread");
        }
    }

    /** Drops the held sink. Must be called with the lock held. */
    private void discardCurrent(Throwable cause) {
        S sink = current;
        current = null;
        stateMachine.transitionTo(ConnectionState.DISCONNECTED, cause);
        if (sink != null) {
            closeQuietly(sink);
        }
    }

    /** Restores a consistent state after an unexpected failure escaped a call. */
    private void abandon(Throwable cause) {
        ConnectionState state = stateMachine.getState();
        if (state == ConnectionState.CONNECTED) {
            discardCurrent(cause);
        } else if (state == ConnectionState.CONNECTING) {
            stateMachine.transitionTo(ConnectionState.DISCONNECTED, cause);
        }
    }

    private void closeQuietly(S sink) {
        try {
            sink.close();
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, name + ": failed to close discarded sink", e);
        }
    }

    private static RetryExhaustedException interrupted(
            InterruptedException interrupt,
            Exception lastFactoryError,
            Exception lastSinkError,
            int attempts) {
        RetryExhaustedException exhausted;
        if (lastFactoryError == null && lastSinkError == null) {
            exhausted = new RetryExhaustedException(interrupt, null, attempts);
        } else {
            exhausted = new RetryExhaustedException(lastFactoryError, lastSinkError, attempts);
            exhausted.addSuppressed(interrupt);
        }
        return exhausted;
    }

    @Override
    public String toString() {
        return "RetryingSink[" + name + ":" + stateMachine.getState() + "]";
    }

    /**
     * Builder for {@link RetryingSink}.
     *
     * @param <E> the event type
     * @param <S> the type of the wrapped sink
     */
    public static final class Builder<E, S extends Sink<E, ?>> {
        private final SinkFactory<? extends S, ?> factory;
        private BackoffStrategy strategy = BackoffStrategy.defaultStrategy();
        private boolean connectNow;
        private Sleeper sleeper = Sleeper.system();
        private String name = DEFAULT_NAME;
        private final List<ConnectionStateListener> listeners = new ArrayList<>();

        private Builder(SinkFactory<? extends S, ?> factory) {
            this.factory = Objects.requireNonNull(factory, "factory");
        }

        /**
         * Sets the backoff strategy.
         *
         * @param strategy the strategy, null for {@link BackoffStrategy#defaultStrategy()}
         * @return this builder
         */
        public Builder<E, S> strategy(BackoffStrategy strategy) {
            this.strategy = strategy != null ? strategy : BackoffStrategy.defaultStrategy();
            return this;
        }

        /**
         * Sets whether {@link #build()} connects before returning.
         *
         * <p>When false (the default) the first sink is created lazily by the first {@link
         * RetryingSink#accept(Object)} call.
         *
         * @param connectNow true to connect eagerly
         * @return this builder
         */
        public Builder<E, S> connectNow(boolean connectNow) {
            this.connectNow = connectNow;
            return this;
        }

        /**
         * Sets how backoff delays are waited out.
         *
         * @param sleeper the sleeper
         * @return this builder
         */
        public Builder<E, S> sleeper(Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
            return this;
        }

        /**
         * Sets the name used in log messages.
         *
         * @param name the name
         * @return this builder
         */
        public Builder<E, S> name(String name) {
            this.name = Objects.requireNonNull(name, "name");
            return this;
        }

        /**
         * Registers a connection state listener.
         *
         * @param listener the listener
         * @return this builder
         */
        public Builder<E, S> listener(ConnectionStateListener listener) {
            listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        /**
         * Builds the sink.
         *
         * @return new sink
         * @throws RetryExhaustedException if {@link #connectNow(boolean)} is set and the initial
         *     campaign could not create a sink; the exception then carries only a factory error
         */
        public RetryingSink<E, S> build() throws RetryExhaustedException {
            RetryingSink<E, S> sink = new RetryingSink<>(this);
            if (connectNow) {
                sink.connectNow();
            }
            return sink;
        }
    }
}
