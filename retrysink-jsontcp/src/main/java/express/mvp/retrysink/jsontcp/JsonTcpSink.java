package express.mvp.retrysink.jsontcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.retrysink.Sink;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Writes {@link LogRecord}s as JSON objects to a TCP connection.
 *
 * <p>Each record becomes one JSON object, optionally followed by a newline, and is flushed
 * immediately. A broken connection surfaces as an {@link IOException} from {@link
 * #accept(LogRecord)}; the sink is then unusable and should be replaced, which is exactly what
 * {@link express.mvp.retrysink.RetryingSink} does.
 *
 * <h2>Output Format</h2>
 *
 * <pre>
 * {"ts":"2024-05-01T10:15:30.123Z","level":"INFO","logger":"app","msg":"Started","app":"billing"}
 * </pre>
 *
 * <p>A record with a {@linkplain LogRecord#getThrown() throwable} also gets an {@code "error"} key.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is not thread-safe.
 */
public final class JsonTcpSink implements Sink<LogRecord, IOException> {

    private static final Logger LOGGER = Logger.getLogger(JsonTcpSink.class.getName());

    /** Shared mapper, thread-safe once configured. */
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Used only for {@link SimpleFormatter#formatMessage(LogRecord)}. */
    private static final SimpleFormatter MESSAGE_FORMATTER = new SimpleFormatter();

    private final Socket socket;
    private final OutputStream out;
    private final JsonTcpSinkConfig config;

    /**
     * Wraps an already connected socket.
     *
     * @param socket connected socket, owned by this sink from now on
     * @param config output configuration
     * @throws IOException if the socket's output stream cannot be obtained
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "The sink takes ownership of the socket.")
    public JsonTcpSink(Socket socket, JsonTcpSinkConfig config) throws IOException {
        this.socket = socket;
        this.config = config;
        this.out = new BufferedOutputStream(socket.getOutputStream());
    }

    /**
     * Opens a connection to the configured collector.
     *
     * @param config the configuration
     * @return a connected sink
     * @throws IOException if the connection cannot be established
     */
    public static JsonTcpSink connect(JsonTcpSinkConfig config) throws IOException {
        Socket socket = new Socket();
        try {
            socket.setTcpNoDelay(true);
            socket.connect(
                    new InetSocketAddress(config.host(), config.port()),
                    Math.toIntExact(config.connectTimeout().toMillis()));
            return new JsonTcpSink(socket, config);
        } catch (IOException | RuntimeException e) {
            try {
                socket.close();
            } catch (IOException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }
    }

    @Override
    public void accept(LogRecord record) throws IOException {
        out.write(MAPPER.writeValueAsBytes(toJson(record)));
        if (config.newlines()) {
            out.write('\n');
        }
        out.flush();
    }

    /**
     * Builds the JSON object written for a record.
     *
     * @param record the record
     * @return the JSON object
     */
    ObjectNode toJson(LogRecord record) {
        ObjectNode node = MAPPER.createObjectNode();
        if (config.defaultKeys()) {
            node.put("ts", record.getInstant().toString());
            node.put("level", record.getLevel().getName());
            node.put("logger", record.getLoggerName());
            node.put("msg", MESSAGE_FORMATTER.formatMessage(record));
        }
        Throwable thrown = record.getThrown();
        if (thrown != null) {
            node.put("error", thrown.toString());
        }
        for (Map.Entry<String, Object> field : config.staticFields().entrySet()) {
            node.set(field.getKey(), MAPPER.valueToTree(field.getValue()));
        }
        return node;
    }

    /** Closes the connection. */
    @Override
    public void close() {
        try {
            socket.close();
        } catch (IOException e) {
            LOGGER.log(Level.FINE, "Failed to close connection to " + config, e);
        }
    }

    @Override
    public String toString() {
        return "JsonTcpSink[" + socket.getRemoteSocketAddress() + "]";
    }
}
