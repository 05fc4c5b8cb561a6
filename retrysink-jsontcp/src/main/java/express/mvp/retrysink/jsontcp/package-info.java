/**
 * Newline-delimited JSON over TCP for {@code java.util.logging}.
 *
 * <p>{@link express.mvp.retrysink.jsontcp.JsonTcpSinkFactory} opens {@link
 * express.mvp.retrysink.jsontcp.JsonTcpSink} connections, {@link
 * express.mvp.retrysink.RetryingSink} keeps one of them alive, and {@link
 * express.mvp.retrysink.jsontcp.SinkHandler} feeds it from the logging framework. See {@link
 * express.mvp.retrysink.jsontcp.JsonTcpExample} for the wiring.
 */
package express.mvp.retrysink.jsontcp;
