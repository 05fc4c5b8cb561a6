package express.mvp.retrysink;

import static express.mvp.retrysink.Scenario.Action.FACTORY_ERROR;
import static express.mvp.retrysink.Scenario.Action.FACTORY_SUCCESS;
import static express.mvp.retrysink.Scenario.Action.LOG_ERROR;
import static express.mvp.retrysink.Scenario.Action.LOG_SUCCESS;
import static express.mvp.retrysink.Scenario.strategy;
import static org.junit.jupiter.api.Assertions.*;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.retrysink.Scenario.CreateError;
import express.mvp.retrysink.Scenario.LoggerError;
import express.mvp.retrysink.Scenario.ScriptedSink;
import express.mvp.retrysink.backoff.BackoffStrategy;
import express.mvp.retrysink.error.RetryExhaustedException;
import express.mvp.retrysink.lifecycle.ConnectionState;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link RetryingSink}.
 *
 * <p>Most tests drive a {@link Scenario}: a planned list of factory and sink outcomes that must be
 * requested in exactly that order.
 */
@DisplayName("RetryingSink")
@SuppressFBWarnings(
        value = {"RV_RETURN_VALUE_IGNORED_NO_SIDE_EFFECT"},
        justification = "SpotBugs rules are intentionally relaxed for test scaffolding.")
class RetryingSinkTest {

    private RecordingSleeper sleeper;
    private Scenario scenario;

    @BeforeEach
    void setUp() {
        sleeper = new RecordingSleeper();
    }

    @AfterEach
    void tearDown() {
        if (scenario != null) {
            scenario.assertFinished();
        }
    }

    private RetryingSink<String, ScriptedSink> sink(
            Scenario scenario, BackoffStrategy strategy, boolean connectNow)
            throws RetryExhaustedException {
        this.scenario = scenario;
        return RetryingSink.<String, ScriptedSink>builder(scenario.factory())
                .strategy(strategy)
                .connectNow(connectNow)
                .sleeper(sleeper)
                .build();
    }

    private static List<Duration> seconds(long... values) {
        List<Duration> delays = new ArrayList<>();
        for (long value : values) {
            delays.add(Duration.ofSeconds(value));
        }
        return delays;
    }

    @Nested
    @DisplayName("Without failures")
    class NoFailureTests {

        @Test
        @DisplayName("Connects eagerly and forwards every event")
        void noFail() throws Exception {
            RetryingSink<String, ScriptedSink> sink =
                    sink(Scenario.of(FACTORY_SUCCESS, LOG_SUCCESS, LOG_SUCCESS), strategy(0), true);

            sink.accept("Msg 1");
            sink.accept("Msg 2");

            assertEquals(List.of("Msg 1", "Msg 2"), scenario.delivered());
            assertTrue(sleeper.delays().stream().allMatch(Duration::isZero));
        }

        @Test
        @DisplayName("Connects lazily on the first event")
        void noFailDelayed() throws Exception {
            RetryingSink<String, ScriptedSink> sink =
                    sink(
                            Scenario.of(FACTORY_SUCCESS, LOG_SUCCESS, LOG_SUCCESS),
                            strategy(0),
                            false);
            assertEquals(0, scenario.factoryCalls());

            sink.accept("Msg 1");
            sink.accept("Msg 2");

            assertEquals(List.of("Msg 1", "Msg 2"), scenario.delivered());
            assertEquals(1, scenario.factoryCalls());
            assertTrue(sleeper.delays().stream().allMatch(Duration::isZero));
        }

        @Test
        @DisplayName("connectNow creates the sink while building")
        void connectNow() throws Exception {
            RetryingSink<String, ScriptedSink> sink =
                    sink(Scenario.of(FACTORY_SUCCESS), strategy(0), true);

            assertTrue(sink.isConnected());
            assertTrue(sink.hasEverConnected());
            assertEquals(1, scenario.factoryCalls());
        }

        @Test
        @DisplayName("No sink is created if nothing is delivered")
        void noConnect() throws Exception {
            RetryingSink<String, ScriptedSink> sink = sink(Scenario.of(), strategy(0), false);

            assertEquals(0, scenario.factoryCalls());
            assertEquals(ConnectionState.DISCONNECTED, sink.state());
            assertFalse(sink.hasEverConnected());
        }

        @Test
        @DisplayName("create() mirrors the builder")
        void createFactoryMethod() throws Exception {
            scenario = Scenario.of(FACTORY_SUCCESS, LOG_SUCCESS);
            RetryingSink<String, ScriptedSink> sink =
                    RetryingSink.create(scenario.factory(), strategy(0), true);

            sink.accept("hello");

            assertEquals(List.of("hello"), scenario.delivered());
        }
    }

    @Nested
    @DisplayName("Retries")
    class RetryTests {

        @Test
        @DisplayName("Reconnects across several events")
        void retries() throws Exception {
            RetryingSink<String, ScriptedSink> sink =
                    sink(
                            Scenario.of(
                                    // First message
                                    FACTORY_ERROR,
                                    FACTORY_SUCCESS,
                                    LOG_ERROR,
                                    FACTORY_SUCCESS,
                                    LOG_SUCCESS,
                                    // Second message
                                    LOG_ERROR,
                                    FACTORY_ERROR,
                                    FACTORY_SUCCESS,
                                    LOG_SUCCESS,
                                    // Third message
                                    LOG_ERROR,
                                    FACTORY_ERROR,
                                    FACTORY_SUCCESS,
                                    LOG_ERROR,
                                    FACTORY_SUCCESS,
                                    LOG_SUCCESS),
                            strategy(3),
                            false);

            sink.accept("Msg 1");
            sink.accept("Msg 2");
            sink.accept("Msg 3");

            assertEquals(List.of("Msg 1", "Msg 2", "Msg 3"), scenario.delivered());
            assertTrue(sink.isConnected());
        }

        @Test
        @DisplayName("One campaign survives factory and delivery failures")
        void singleCampaignRecovers() throws Exception {
            AtomicInteger schedules = new AtomicInteger();
            BackoffStrategy counting =
                    () -> {
                        schedules.incrementAndGet();
                        return strategy(3).newSchedule();
                    };
            RetryingSink<String, ScriptedSink> sink =
                    sink(
                            Scenario.of(
                                    FACTORY_ERROR,
                                    FACTORY_SUCCESS,
                                    LOG_ERROR,
                                    FACTORY_SUCCESS,
                                    LOG_SUCCESS),
                            counting,
                            false);

            sink.accept("event");

            assertEquals(1, schedules.get(), "One schedule per campaign");
            assertEquals(3, scenario.factoryCalls());
            assertEquals(3, sleeper.delays().size());
            List<ScriptedSink> created = scenario.created();
            assertEquals(List.of("event"), created.get(created.size() - 1).accepted());
        }

        @Test
        @DisplayName("Failed delivery attempts close the discarded sinks")
        void closesDiscardedSinks() throws Exception {
            RetryingSink<String, ScriptedSink> sink =
                    sink(
                            Scenario.of(
                                    FACTORY_SUCCESS,
                                    LOG_ERROR,
                                    FACTORY_SUCCESS,
                                    LOG_ERROR,
                                    FACTORY_SUCCESS,
                                    LOG_SUCCESS),
                            strategy(2),
                            false);

            sink.accept("event");

            List<ScriptedSink> created = scenario.created();
            assertEquals(3, created.size());
            assertTrue(created.get(0).isClosed());
            assertTrue(created.get(1).isClosed());
            assertFalse(created.get(2).isClosed());
            assertEquals(1, scenario.maxLiveSinks());
            assertEquals(1, scenario.liveSinks());
        }

        @Test
        @DisplayName("Each accepted event reaches its final sink exactly once")
        void deliveredExactlyOnce() throws Exception {
            RetryingSink<String, ScriptedSink> sink =
                    sink(
                            Scenario.of(
                                    FACTORY_SUCCESS,
                                    LOG_ERROR,
                                    FACTORY_SUCCESS,
                                    LOG_SUCCESS,
                                    LOG_SUCCESS),
                            strategy(1),
                            true);

            sink.accept("a");
            sink.accept("b");

            List<ScriptedSink> created = scenario.created();
            assertEquals(List.of(), created.get(0).accepted());
            assertEquals(List.of("a", "b"), created.get(1).accepted());
        }
    }

    @Nested
    @DisplayName("Giving up")
    class GiveUpTests {

        @Test
        @DisplayName("Gives up connecting while building")
        void giveUpInitial() {
            RetryExhaustedException e =
                    assertThrows(
                            RetryExhaustedException.class,
                            () ->
                                    sink(
                                            Scenario.of(
                                                    FACTORY_ERROR, FACTORY_ERROR, FACTORY_ERROR),
                                            strategy(2),
                                            true));

            assertTrue(e.factoryError(CreateError.class).isPresent());
            assertTrue(e.sinkError().isEmpty());
            assertEquals(3, e.attempts());
            assertInstanceOf(CreateError.class, e.getCause());
        }

        @Test
        @DisplayName("Gives up on one event but tries again on the next")
        void giveUp() throws Exception {
            RetryingSink<String, ScriptedSink> sink =
                    sink(
                            Scenario.of(
                                    // Initial connect
                                    FACTORY_SUCCESS,
                                    // Fail on first message
                                    LOG_ERROR,
                                    FACTORY_ERROR,
                                    FACTORY_ERROR,
                                    // Second message
                                    FACTORY_SUCCESS,
                                    LOG_SUCCESS),
                            strategy(2),
                            true);

            RetryExhaustedException e =
                    assertThrows(RetryExhaustedException.class, () -> sink.accept("Failed"));
            assertTrue(e.sinkError(LoggerError.class).isPresent());
            assertTrue(e.factoryError(CreateError.class).isPresent());
            assertEquals(2, e.attempts());
            assertEquals(ConnectionState.DISCONNECTED, sink.state());

            sink.accept("Successful");
            assertEquals(List.of("Successful"), scenario.delivered());
        }

        @Test
        @DisplayName("Gives up sanely when the lazy first connection cannot deliver")
        void giveUpDelayed() throws Exception {
            RetryingSink<String, ScriptedSink> sink =
                    sink(
                            Scenario.of(
                                    FACTORY_SUCCESS,
                                    LOG_ERROR,
                                    FACTORY_ERROR,
                                    FACTORY_ERROR,
                                    FACTORY_SUCCESS,
                                    LOG_SUCCESS),
                            strategy(2),
                            false);

            RetryExhaustedException e =
                    assertThrows(RetryExhaustedException.class, () -> sink.accept("Failed"));
            assertEquals(3, e.attempts());
            assertTrue(e.sinkError().isPresent());
            assertTrue(e.factoryError().isPresent());
            assertEquals(0, scenario.liveSinks());

            sink.accept("Successful");
            assertEquals(List.of("Successful"), scenario.delivered());
        }

        @Test
        @DisplayName("Factory-only failures leave the sink error absent")
        void factoryOnlyFailures() throws Exception {
            RetryingSink<String, ScriptedSink> sink =
                    sink(
                            Scenario.of(
                                    FACTORY_ERROR,
                                    FACTORY_ERROR,
                                    FACTORY_ERROR,
                                    FACTORY_ERROR,
                                    FACTORY_ERROR),
                            strategy(2),
                            false);

            RetryExhaustedException first =
                    assertThrows(RetryExhaustedException.class, () -> sink.accept("one"));
            assertEquals(3, first.attempts(), "First campaign gets an extra immediate attempt");
            assertTrue(first.sinkError().isEmpty());

            RetryExhaustedException second =
                    assertThrows(RetryExhaustedException.class, () -> sink.accept("two"));
            assertEquals(2, second.attempts());
            assertTrue(second.factoryError(CreateError.class).isPresent());
            assertTrue(second.sinkError().isEmpty());
        }

        @Test
        @DisplayName("An empty schedule makes exactly one attempt per campaign")
        void emptyScheduleGivesUp() throws Exception {
            RetryingSink<String, ScriptedSink> sink =
                    sink(
                            Scenario.of(
                                    FACTORY_ERROR, FACTORY_ERROR, FACTORY_SUCCESS, LOG_SUCCESS),
                            BackoffStrategy.noRetry(),
                            false);

            RetryExhaustedException first =
                    assertThrows(RetryExhaustedException.class, () -> sink.accept("a"));
            RetryExhaustedException second =
                    assertThrows(RetryExhaustedException.class, () -> sink.accept("b"));
            assertEquals(1, first.attempts());
            assertEquals(1, second.attempts());
            sink.accept("c");

            assertEquals(List.of("c"), scenario.delivered());
            assertTrue(sleeper.delays().stream().allMatch(Duration::isZero));
        }

        @Test
        @DisplayName("Each campaign after a failure draws a fresh schedule")
        void freshScheduleAfterFailure() throws Exception {
            AtomicInteger schedules = new AtomicInteger();
            BackoffStrategy counting =
                    () -> {
                        schedules.incrementAndGet();
                        return strategy(1).newSchedule();
                    };
            RetryingSink<String, ScriptedSink> sink =
                    sink(
                            Scenario.of(
                                    FACTORY_ERROR,
                                    FACTORY_ERROR,
                                    FACTORY_ERROR,
                                    FACTORY_SUCCESS,
                                    LOG_SUCCESS),
                            counting,
                            false);

            assertThrows(RetryExhaustedException.class, () -> sink.accept("lost"));
            assertThrows(RetryExhaustedException.class, () -> sink.accept("lost too"));
            sink.accept("kept");

            assertEquals(3, schedules.get());
            assertEquals(List.of("kept"), scenario.delivered());
        }
    }

    @Nested
    @DisplayName("Backoff delays")
    class DelayTests {

        private final AtomicInteger attempts = new AtomicInteger();

        private RetryingSink<String, Sink<String, IOException>> alwaysFailing()
                throws RetryExhaustedException {
            SinkFactory<Sink<String, IOException>, IOException> factory =
                    () -> {
                        attempts.incrementAndGet();
                        throw new IOException("Connection refused");
                    };
            return RetryingSink.<String, Sink<String, IOException>>builder(factory)
                    .sleeper(sleeper)
                    .build();
        }

        @Test
        @DisplayName("Only the first attempt ever made skips its delay")
        void zeroDelayOnce() throws Exception {
            RetryingSink<String, Sink<String, IOException>> sink = alwaysFailing();

            assertThrows(RetryExhaustedException.class, () -> sink.accept("first"));
            assertEquals(seconds(0, 1, 2, 3, 4), sleeper.delays());
            assertEquals(5, attempts.get());

            sleeper.clear();
            assertThrows(RetryExhaustedException.class, () -> sink.accept("second"));
            assertEquals(seconds(1, 2, 3, 4), sleeper.delays());
            assertEquals(9, attempts.get());
        }

        @Test
        @DisplayName("Eager connection spends the immediate attempt")
        void eagerConnectUsesImmediateAttempt() throws Exception {
            RetryingSink<String, ScriptedSink> sink =
                    sink(
                            Scenario.of(FACTORY_SUCCESS, LOG_ERROR, FACTORY_SUCCESS, LOG_SUCCESS),
                            BackoffStrategy.defaultStrategy(),
                            true);
            assertEquals(seconds(0), sleeper.delays());

            sleeper.clear();
            sink.accept("event");

            assertEquals(seconds(1), sleeper.delays());
        }

        @Test
        @DisplayName("Null strategy falls back to the default")
        void nullStrategyUsesDefault() throws Exception {
            RetryingSink<String, ScriptedSink> sink =
                    sink(
                            Scenario.of(
                                    FACTORY_ERROR,
                                    FACTORY_ERROR,
                                    FACTORY_ERROR,
                                    FACTORY_ERROR,
                                    FACTORY_ERROR),
                            null,
                            false);

            RetryExhaustedException e =
                    assertThrows(RetryExhaustedException.class, () -> sink.accept("x"));
            assertEquals(5, e.attempts(), "Four scheduled retries after the immediate attempt");
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("close() releases the held sink and rejects later events")
        void closeReleasesSink() throws Exception {
            RetryingSink<String, ScriptedSink> sink =
                    sink(Scenario.of(FACTORY_SUCCESS, LOG_SUCCESS), strategy(0), false);
            sink.accept("event");

            sink.close();
            sink.close();

            assertTrue(scenario.created().get(0).isClosed());
            assertEquals(ConnectionState.CLOSED, sink.state());
            assertThrows(IllegalStateException.class, () -> sink.accept("late"));
        }

        @Test
        @DisplayName("Calls from inside the wrapped sink are rejected")
        void reentrantCallsRejected() throws Exception {
            AtomicReference<RetryingSink<String, Sink<String, RuntimeException>>> outer =
                    new AtomicReference<>();
            List<String> delivered = new ArrayList<>();
            List<Exception> rejected = new ArrayList<>();
            AtomicInteger created = new AtomicInteger();
            Sink<String, RuntimeException> inner =
                    event -> {
                        try {
                            outer.get().accept("nested:" + event);
                        } catch (IllegalStateException | RetryExhaustedException e) {
                            rejected.add(e);
                        }
                        try {
                            outer.get().close();
                        } catch (IllegalStateException e) {
                            rejected.add(e);
                        }
                        delivered.add(event);
                    };
            RetryingSink<String, Sink<String, RuntimeException>> sink =
                    RetryingSink.<String, Sink<String, RuntimeException>>builder(
                                    () -> {
                                        created.incrementAndGet();
                                        return inner;
                                    })
                            .strategy(strategy(0))
                            .sleeper(sleeper)
                            .build();
            outer.set(sink);

            sink.accept("event");

            assertEquals(List.of("event"), delivered);
            assertEquals(2, rejected.size());
            assertTrue(rejected.stream().allMatch(e -> e instanceof IllegalStateException));
            assertEquals(1, created.get());
            assertEquals(ConnectionState.CONNECTED, sink.state());
        }

        @Test
        @DisplayName("Listeners observe every transition")
        void listenersObserveTransitions() throws Exception {
            List<String> transitions = Collections.synchronizedList(new ArrayList<>());
            scenario =
                    Scenario.of(
                            FACTORY_ERROR,
                            FACTORY_SUCCESS,
                            LOG_ERROR,
                            FACTORY_SUCCESS,
                            LOG_SUCCESS);
            RetryingSink<String, ScriptedSink> sink =
                    RetryingSink.<String, ScriptedSink>builder(scenario.factory())
                            .strategy(strategy(3))
                            .sleeper(sleeper)
                            .name("audit")
                            .listener((prev, curr, cause) -> transitions.add(prev + "->" + curr))
                            .build();

            sink.accept("event");

            assertEquals(
                    List.of(
                            "Disconnected->Connecting",
                            "Connecting->Connected",
                            "Connected->Disconnected",
                            "Disconnected->Connecting",
                            "Connecting->Connected"),
                    transitions);
            assertTrue(sink.toString().contains("audit"));
        }

        @Test
        @DisplayName("Errors propagate and leave the sink disconnected")
        void errorsPropagate() throws Exception {
            AtomicInteger created = new AtomicInteger();
            AtomicInteger closed = new AtomicInteger();
            SinkFactory<Sink<String, RuntimeException>, RuntimeException> factory =
                    () -> {
                        created.incrementAndGet();
                        return new Sink<>() {
                            @Override
                            public void accept(String event) {
                                if (event.equals("boom")) {
                                    throw new StackOverflowError("injected");
                                }
                            }

                            @Override
                            public void close() {
                                closed.incrementAndGet();
                            }
                        };
                    };
            RetryingSink<String, Sink<String, RuntimeException>> sink =
                    RetryingSink.<String, Sink<String, RuntimeException>>builder(factory)
                            .sleeper(sleeper)
                            .connectNow(true)
                            .build();

            assertThrows(StackOverflowError.class, () -> sink.accept("boom"));
            assertEquals(ConnectionState.DISCONNECTED, sink.state());
            assertEquals(1, closed.get());

            sink.accept("fine");
            assertEquals(2, created.get());
        }

        @Test
        @DisplayName("Interrupt ends the campaign and keeps the interrupt status")
        void interruptEndsCampaign() {
            AtomicInteger sleeps = new AtomicInteger();
            SinkFactory<Sink<String, IOException>, IOException> factory =
                    () -> {
                        throw new IOException("Connection refused");
                    };
            try {
                RetryingSink<String, Sink<String, IOException>> sink =
                        RetryingSink.<String, Sink<String, IOException>>builder(factory)
                                .sleeper(
                                        delay -> {
                                            if (sleeps.incrementAndGet() == 2) {
                                                throw new InterruptedException();
                                            }
                                        })
                                .build();

                RetryExhaustedException e =
                        assertThrows(RetryExhaustedException.class, () -> sink.accept("event"));
                assertEquals(1, e.attempts());
                assertTrue(e.factoryError(IOException.class).isPresent());
                assertInstanceOf(InterruptedException.class, e.getSuppressed()[0]);
                assertTrue(Thread.currentThread().isInterrupted());
                assertEquals(ConnectionState.DISCONNECTED, sink.state());
            } catch (RetryExhaustedException e) {
                fail("Lazy sink must not connect while building", e);
            } finally {
                Thread.interrupted();
            }
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("Concurrent callers never see more than one live sink")
        void atMostOneLiveSink() throws Exception {
            int threads = 8;
            int eventsPerThread = 50;
            AtomicInteger live = new AtomicInteger();
            AtomicInteger maxLive = new AtomicInteger();
            Map<String, Integer> received = new ConcurrentHashMap<>();

            SinkFactory<Sink<String, IOException>, IOException> factory =
                    () -> {
                        maxLive.accumulateAndGet(live.incrementAndGet(), Math::max);
                        AtomicInteger calls = new AtomicInteger();
                        return new Sink<>() {
                            @Override
                            public void accept(String event) throws IOException {
                                if (calls.incrementAndGet() % 5 == 0) {
                                    throw new IOException("Connection reset");
                                }
                                received.merge(event, 1, Integer::sum);
                            }

                            @Override
                            public void close() {
                                live.decrementAndGet();
                            }
                        };
                    };
            RetryingSink<String, Sink<String, IOException>> sink =
                    RetryingSink.<String, Sink<String, IOException>>builder(factory)
                            .strategy(BackoffStrategy.immediate(3))
                            .sleeper(sleeper)
                            .build();

            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(
                        executor.submit(
                                () -> {
                                    start.await();
                                    for (int i = 0; i < eventsPerThread; i++) {
                                        sink.accept(thread + "-" + i);
                                    }
                                    return null;
                                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
            executor.shutdown();
            assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

            assertEquals(1, maxLive.get());
            assertEquals(threads * eventsPerThread, received.size());
            assertTrue(received.values().stream().allMatch(count -> count == 1));
        }
    }
}
