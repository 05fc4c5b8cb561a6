package express.mvp.retrysink.error;

/**
 * Broad kinds of sink and factory failures.
 *
 * <p>Categories describe a failure for diagnostics only. {@link
 * express.mvp.retrysink.RetryingSink} retries every failure the same way, whatever its category.
 *
 * <ul>
 *   <li><b>NETWORK:</b> Connection refused, reset, unreachable host
 *   <li><b>TRANSIENT:</b> Timeouts, interrupted waits, busy peers
 *   <li><b>RESOURCE:</b> Exhausted memory, descriptors or executors
 *   <li><b>PROTOCOL:</b> Malformed output or unexpected peer behavior
 *   <li><b>FATAL:</b> Security and linkage problems that no reconnect fixes
 *   <li><b>UNKNOWN:</b> Anything else
 * </ul>
 *
 * @see ErrorClassifier
 */
public enum ErrorCategory {

    /** Network connectivity issue. */
    NETWORK("Network", true),

    /** Temporary condition likely to clear on its own. */
    TRANSIENT("Transient", true),

    /** Resource exhaustion. */
    RESOURCE("Resource", true),

    /** Protocol or encoding problem. */
    PROTOCOL("Protocol", false),

    /** Unrecoverable problem. */
    FATAL("Fatal", false),

    /** Unclassified failure. */
    UNKNOWN("Unknown", true);

    private final String displayName;
    private final boolean likelyTransient;

    ErrorCategory(String displayName, boolean likelyTransient) {
        this.displayName = displayName;
        this.likelyTransient = likelyTransient;
    }

    /**
     * Returns a human-readable name for this category.
     *
     * @return the display name
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Checks if failures of this category usually go away after a reconnect.
     *
     * @return true for NETWORK, TRANSIENT, RESOURCE and UNKNOWN
     */
    public boolean isLikelyTransient() {
        return likelyTransient;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
