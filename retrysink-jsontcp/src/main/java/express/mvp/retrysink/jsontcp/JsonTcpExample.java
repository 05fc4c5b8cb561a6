package express.mvp.retrysink.jsontcp;

import express.mvp.retrysink.RetryingSink;
import express.mvp.retrysink.backoff.BackoffStrategy;
import express.mvp.retrysink.error.RetryExhaustedException;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Ships this process's {@code java.util.logging} output as JSON lines to a TCP collector.
 *
 * <p>Usage: {@code JsonTcpExample [host] [port]}, defaulting to {@code 127.0.0.1 1234}. Try it
 * with {@code nc -lk 1234} and restart the listener between messages to watch the sink
 * reconnect. Exits with status 1 if the collector cannot be reached at startup.
 */
public final class JsonTcpExample {

    private static final Logger LOGGER = Logger.getLogger(JsonTcpExample.class.getName());

    private JsonTcpExample() {}

    /**
     * Runs the example.
     *
     * @param args optional host and port
     * @throws InterruptedException if interrupted between messages
     */
    public static void main(String[] args) throws InterruptedException {
        String version = JsonTcpExample.class.getPackage().getImplementationVersion();
        JsonTcpSinkConfig config =
                JsonTcpSinkConfig.builder()
                        .host(args.length > 0 ? args[0] : "127.0.0.1")
                        .port(args.length > 1 ? Integer.parseInt(args[1]) : 1234)
                        .staticField("application", "retry-sink-example")
                        .staticField("version", version != null ? version : "dev")
                        .build();

        RetryingSink<LogRecord, JsonTcpSink> sink;
        try {
            sink =
                    RetryingSink.<LogRecord, JsonTcpSink>builder(new JsonTcpSinkFactory(config))
                            .strategy(BackoffStrategy.defaultStrategy())
                            .connectNow(true)
                            .name("json-tcp")
                            .build();
        } catch (RetryExhaustedException e) {
            System.err.println("Failed to connect to " + config + ": " + e.getMessage());
            System.exit(1);
            return;
        }

        SinkHandler handler = new SinkHandler(sink);
        Logger root = Logger.getLogger("");
        root.addHandler(handler);
        try {
            LOGGER.info("Everything is set up");
            for (int i = 1; i <= 5; i++) {
                LOGGER.log(Level.INFO, "Message {0} of 5", i);
                Thread.sleep(1_000);
            }
        } finally {
            root.removeHandler(handler);
            handler.close();
        }
    }
}
