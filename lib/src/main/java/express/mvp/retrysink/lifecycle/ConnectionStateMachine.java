package express.mvp.retrysink.lifecycle;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * State machine tracking the sink slot of a {@link express.mvp.retrysink.RetryingSink}.
 *
 * <p>This class enforces valid state transitions and notifies listeners of state changes.
 *
 * <h2>Valid Transitions</h2>
 *
 * <pre>
 * DISCONNECTED → CONNECTING, CLOSED
 * CONNECTING   → CONNECTED, DISCONNECTED, CLOSED
 * CONNECTED    → DISCONNECTED, CLOSED
 * CLOSED       → (terminal, no transitions)
 * </pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>The state is published through a volatile field so that observers on other threads see the
 * latest value. Transitions themselves are made by the owner while it holds its lock.
 *
 * @see ConnectionState
 * @see ConnectionStateListener
 */
public final class ConnectionStateMachine {

    private static final Logger LOGGER = Logger.getLogger(ConnectionStateMachine.class.getName());

    private static final Set<ConnectionState> FROM_DISCONNECTED =
            EnumSet.of(ConnectionState.CONNECTING, ConnectionState.CLOSED);

    private static final Set<ConnectionState> FROM_CONNECTING =
            EnumSet.of(
                    ConnectionState.CONNECTED,
                    ConnectionState.DISCONNECTED,
                    ConnectionState.CLOSED);

    private static final Set<ConnectionState> FROM_CONNECTED =
            EnumSet.of(ConnectionState.DISCONNECTED, ConnectionState.CLOSED);

    /** Current state. */
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;

    /** Registered state change listeners. */
    private final List<ConnectionStateListener> listeners = new CopyOnWriteArrayList<>();

    /** Identifier used in log messages. */
    private final String name;

    /**
     * Creates a new state machine in {@link ConnectionState#DISCONNECTED} state.
     *
     * @param name identifier used in log messages
     */
    public ConnectionStateMachine(String name) {
        this.name = name;
    }

    /**
     * Returns the current state.
     *
     * @return the current state
     */
    public ConnectionState getState() {
        return state;
    }

    /**
     * Registers a listener for state change events.
     *
     * @param listener the listener to register
     */
    public void addListener(ConnectionStateListener listener) {
        listeners.add(listener);
    }

    /**
     * Removes a previously registered listener.
     *
     * @param listener the listener to remove
     * @return true if the listener was found and removed
     */
    public boolean removeListener(ConnectionStateListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Transitions to a new state.
     *
     * @param newState the desired new state
     * @param cause the failure behind the transition (may be null)
     * @throws IllegalStateException if the transition is not valid from the current state
     */
    public void transitionTo(ConnectionState newState, Throwable cause) {
        ConnectionState previous = state;
        if (!isValidTransition(previous, newState)) {
            throw new IllegalStateException(
                    "Invalid transition for " + name + ": " + previous + " -> " + newState);
        }
        state = newState;
        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest(name + ": " + previous + " -> " + newState);
        }
        notifyListeners(previous, newState, cause);
    }

    /**
     * Checks if a transition from one state to another is valid.
     *
     * @param from the source state
     * @param to the target state
     * @return true if the transition is allowed
     */
    public static boolean isValidTransition(ConnectionState from, ConnectionState to) {
        if (from == to) {
            return false; // No self-transitions
        }

        return switch (from) {
            case DISCONNECTED -> FROM_DISCONNECTED.contains(to);
            case CONNECTING -> FROM_CONNECTING.contains(to);
            case CONNECTED -> FROM_CONNECTED.contains(to);
            case CLOSED -> false;
        };
    }

    /** Notifies all listeners of a state change. */
    private void notifyListeners(
            ConnectionState previous, ConnectionState current, Throwable cause) {

        for (ConnectionStateListener listener : listeners) {
            try {
                listener.onStateChanged(previous, current, cause);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Connection state listener failed for " + name, e);
            }
        }
    }

    @Override
    public String toString() {
        return "ConnectionStateMachine[" + name + ":" + state + "]";
    }
}
