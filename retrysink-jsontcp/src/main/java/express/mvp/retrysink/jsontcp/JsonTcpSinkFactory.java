package express.mvp.retrysink.jsontcp;

import express.mvp.retrysink.SinkFactory;
import java.io.IOException;
import java.util.Objects;

/**
 * Opens a new {@link JsonTcpSink} connection on every call.
 *
 * <pre>{@code
 * RetryingSink<LogRecord, JsonTcpSink> sink =
 *     RetryingSink.create(new JsonTcpSinkFactory(config), null, true);
 * }</pre>
 */
public final class JsonTcpSinkFactory implements SinkFactory<JsonTcpSink, IOException> {

    private final JsonTcpSinkConfig config;

    /**
     * Creates a factory.
     *
     * @param config connection and output configuration
     */
    public JsonTcpSinkFactory(JsonTcpSinkConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public JsonTcpSink create() throws IOException {
        return JsonTcpSink.connect(config);
    }

    @Override
    public String toString() {
        return "JsonTcpSinkFactory[" + config.host() + ":" + config.port() + "]";
    }
}
