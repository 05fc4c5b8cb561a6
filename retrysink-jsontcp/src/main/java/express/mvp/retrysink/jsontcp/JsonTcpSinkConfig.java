package express.mvp.retrysink.jsontcp;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for {@link JsonTcpSink}.
 *
 * <table border="1">
 *   <caption>JSON-over-TCP sink parameters</caption>
 *   <tr><th>Parameter</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>host</td><td>127.0.0.1</td><td>Collector host</td></tr>
 *   <tr><td>port</td><td>1234</td><td>Collector port</td></tr>
 *   <tr><td>connectTimeout</td><td>5s</td><td>TCP connection timeout</td></tr>
 *   <tr><td>newlines</td><td>true</td><td>Terminate every object with a newline</td></tr>
 *   <tr><td>defaultKeys</td><td>true</td><td>Add ts, level, logger and msg keys</td></tr>
 *   <tr><td>staticFields</td><td>none</td><td>Fields added to every object</td></tr>
 * </table>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * JsonTcpSinkConfig config = JsonTcpSinkConfig.builder()
 *     .host("logs.internal")
 *     .port(5170)
 *     .staticField("application", "billing")
 *     .staticField("version", "1.4.2")
 *     .build();
 * }</pre>
 *
 * @see JsonTcpSinkFactory
 */
public final class JsonTcpSinkConfig {

    private final String host;
    private final int port;
    private final Duration connectTimeout;
    private final boolean newlines;
    private final boolean defaultKeys;
    private final Map<String, Object> staticFields;

    private JsonTcpSinkConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.connectTimeout = builder.connectTimeout;
        this.newlines = builder.newlines;
        this.defaultKeys = builder.defaultKeys;
        this.staticFields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.staticFields));
    }

    /**
     * Creates a new builder with default values.
     *
     * @return new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the collector host.
     *
     * @return the host name or address
     */
    public String host() {
        return host;
    }

    /**
     * Returns the collector port.
     *
     * @return the TCP port
     */
    public int port() {
        return port;
    }

    /**
     * Returns the TCP connection timeout.
     *
     * @return the timeout, {@link Duration#ZERO} for none
     */
    public Duration connectTimeout() {
        return connectTimeout;
    }

    /**
     * Returns whether each object is followed by a newline.
     *
     * @return true for newline-delimited JSON
     */
    public boolean newlines() {
        return newlines;
    }

    /**
     * Returns whether the default keys are written.
     *
     * @return true to write ts, level, logger and msg
     */
    public boolean defaultKeys() {
        return defaultKeys;
    }

    /**
     * Returns the fields added to every object.
     *
     * @return unmodifiable map in insertion order
     */
    public Map<String, Object> staticFields() {
        return staticFields;
    }

    @Override
    public String toString() {
        return "JsonTcpSinkConfig[" + host + ":" + port + "]";
    }

    /** Builder for {@link JsonTcpSinkConfig}. */
    public static final class Builder {
        private String host = "127.0.0.1";
        private int port = 1234;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private boolean newlines = true;
        private boolean defaultKeys = true;
        private final Map<String, Object> staticFields = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Sets the collector host.
         *
         * @param host host name or address
         * @return this builder
         */
        public Builder host(String host) {
            this.host = Objects.requireNonNull(host, "host");
            return this;
        }

        /**
         * Sets the collector port.
         *
         * @param port TCP port (1-65535)
         * @return this builder
         */
        public Builder port(int port) {
            if (port < 1 || port > 65_535) {
                throw new IllegalArgumentException("port must be 1-65535");
            }
            this.port = port;
            return this;
        }

        /**
         * Sets the TCP connection timeout.
         *
         * @param timeout the timeout, {@link Duration#ZERO} for none
         * @return this builder
         */
        public Builder connectTimeout(Duration timeout) {
            Objects.requireNonNull(timeout, "timeout");
            if (timeout.isNegative()) {
                throw new IllegalArgumentException("connectTimeout must not be negative");
            }
            this.connectTimeout = timeout;
            return this;
        }

        /**
         * Sets whether each object is followed by a newline.
         *
         * @param newlines true for newline-delimited JSON
         * @return this builder
         */
        public Builder newlines(boolean newlines) {
            this.newlines = newlines;
            return this;
        }

        /**
         * Sets whether the default keys are written.
         *
         * @param defaultKeys true to write ts, level, logger and msg
         * @return this builder
         */
        public Builder defaultKeys(boolean defaultKeys) {
            this.defaultKeys = defaultKeys;
            return this;
        }

        /**
         * Adds a field written into every object.
         *
         * @param key field name
         * @param value field value, serialized by Jackson
         * @return this builder
         */
        public Builder staticField(String key, Object value) {
            staticFields.put(Objects.requireNonNull(key, "key"), value);
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return new configuration
         */
        public JsonTcpSinkConfig build() {
            return new JsonTcpSinkConfig(this);
        }
    }
}
