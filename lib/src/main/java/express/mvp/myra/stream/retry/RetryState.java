package express.mvp.myra.stream.retry;

/**
 * Lifecycle states of a {@link RetryStream}.
 *
 * <h2>State Diagram</h2>
 *
 * <pre>
 *                 listen                 error, budget left
 * ┌────────┐  ─────────▶  ┌────────────┐ ─────────────────▶ ┌──────────┐
 * │  IDLE  │              │ ATTEMPTING │                    │ RETRYING │
 * └────────┘              └────────────┘ ◀───────────────── └──────────┘
 *                           │        │        next attempt
 *                      done │        │ error, budget spent
 *                           ▼        ▼
 *                   ┌───────────┐  ┌────────┐
 *                   │ SUCCEEDED │  │ FAILED │
 *                   └───────────┘  └────────┘
 * </pre>
 *
 * <p>{@link #CANCELLED} can be entered from every non-terminal state.
 *
 * @see RetryStateMachine
 */
public enum RetryState {

    /** Not yet listened to. */
    IDLE("Idle", false),

    /** A source created for the current attempt is being listened to. */
    ATTEMPTING("Attempting", false),

    /** The last attempt failed and a new one is about to start. */
    RETRYING("Retrying", false),

    /** An attempt completed; the stream is closed. */
    SUCCEEDED("Succeeded", true),

    /** The budget ran out; the aggregated error was emitted and the stream closed. */
    FAILED("Failed", true),

    /** The listener cancelled; no further attempts are made. */
    CANCELLED("Cancelled", true);

    private final String displayName;
    private final boolean terminal;

    RetryState(String displayName, boolean terminal) {
        this.displayName = displayName;
        this.terminal = terminal;
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
     * Checks if this is a terminal state.
     *
     * @return true for SUCCEEDED, FAILED and CANCELLED
     */
    public boolean isTerminal() {
        return terminal;
    }

    /**
     * Checks if an upstream source may be active in this state.
     *
     * @return true only in {@link #ATTEMPTING}
     */
    public boolean isAttempting() {
        return this == ATTEMPTING;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
