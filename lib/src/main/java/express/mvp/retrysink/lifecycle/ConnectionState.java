package express.mvp.retrysink.lifecycle;

/**
 * States of the sink slot owned by a {@link express.mvp.retrysink.RetryingSink}.
 *
 * <h2>State Diagram</h2>
 *
 * <pre>
 *                     campaign starts
 * ┌──────────────┐ ─────────────────▶ ┌────────────┐  sink created  ┌───────────┐
 * │ DISCONNECTED │                    │ CONNECTING │ ─────────────▶ │ CONNECTED │
 * └──────────────┘ ◀───────────────── └────────────┘                └───────────┘
 *        ▲            campaign exhausted                                  │
 *        └────────────────────────────────────────────────────────────────┘
 *                              sink rejected an event
 *
 *             close() from any state ──▶ CLOSED (terminal)
 * </pre>
 *
 * <ul>
 *   <li>{@link #DISCONNECTED}: No sink is held
 *   <li>{@link #CONNECTING}: A campaign is sleeping or creating a sink
 *   <li>{@link #CONNECTED}: A live sink is held
 *   <li>{@link #CLOSED}: Terminal, the held sink has been released
 * </ul>
 *
 * @see ConnectionStateMachine
 */
public enum ConnectionState {

    /** No sink is held. Initial state. */
    DISCONNECTED("Disconnected"),

    /**
     * A reconnection campaign is in progress.
     *
     * <p>Left for {@link #CONNECTED} when a sink is created, or for {@link #DISCONNECTED} when the
     * campaign runs out of backoff entries.
     */
    CONNECTING("Connecting"),

    /** A live sink is held and events are forwarded to it. */
    CONNECTED("Connected"),

    /** Terminal state. No transitions are allowed from here. */
    CLOSED("Closed");

    private final String displayName;

    ConnectionState(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Returns a human-readable name for this state.
     *
     * @return the display name
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Checks if a sink is held.
     *
     * @return true only in {@link #CONNECTED} state
     */
    public boolean isConnected() {
        return this == CONNECTED;
    }

    /**
     * Checks if this is the terminal state.
     *
     * @return true only in {@link #CLOSED} state
     */
    public boolean isClosed() {
        return this == CLOSED;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
