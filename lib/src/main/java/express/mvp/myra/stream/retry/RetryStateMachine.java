package express.mvp.myra.stream.retry;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * State machine for the lifecycle of a {@link RetryStream}.
 *
 * <p>This class enforces valid state transitions and notifies listeners of state changes.
 *
 * <h2>Valid Transitions</h2>
 *
 * <pre>
 * IDLE       → ATTEMPTING, CANCELLED
 * ATTEMPTING → RETRYING, SUCCEEDED, FAILED, CANCELLED
 * RETRYING   → ATTEMPTING, CANCELLED
 * SUCCEEDED  → (terminal)
 * FAILED     → (terminal)
 * CANCELLED  → (terminal)
 * </pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Transitions use atomic compare-and-set, and listeners may be registered from any thread.
 * Listeners are called on the thread performing the transition.
 *
 * @see RetryState
 * @see RetryStateListener
 */
public final class RetryStateMachine {

    private static final Logger LOGGER = Logger.getLogger(RetryStateMachine.class.getName());

    private static final Set<RetryState> FROM_IDLE =
            EnumSet.of(RetryState.ATTEMPTING, RetryState.CANCELLED);

    private static final Set<RetryState> FROM_ATTEMPTING =
            EnumSet.of(
                    RetryState.RETRYING,
                    RetryState.SUCCEEDED,
                    RetryState.FAILED,
                    RetryState.CANCELLED);

    private static final Set<RetryState> FROM_RETRYING =
            EnumSet.of(RetryState.ATTEMPTING, RetryState.CANCELLED);

    private final AtomicReference<RetryState> state = new AtomicReference<>(RetryState.IDLE);

    private final List<RetryStateListener> listeners = new CopyOnWriteArrayList<>();

    /** Name used in log messages. */
    private final String name;

    /**
     * Creates a state machine in {@link RetryState#IDLE}.
     *
     * @param name name used in log messages
     */
    public RetryStateMachine(String name) {
        this.name = name;
    }

    /**
     * Returns the current state.
     *
     * @return the current state
     */
    public RetryState getState() {
        return state.get();
    }

    /**
     * Checks whether a terminal state has been reached.
     *
     * @return true once SUCCEEDED, FAILED or CANCELLED
     */
    public boolean isTerminal() {
        return state.get().isTerminal();
    }

    /**
     * Registers a listener for state changes.
     *
     * @param listener the listener to register
     */
    public void addListener(RetryStateListener listener) {
        listeners.add(listener);
    }

    /**
     * Removes a previously registered listener.
     *
     * @param listener the listener to remove
     * @return true if the listener was found and removed
     */
    public boolean removeListener(RetryStateListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Attempts to transition to a new state.
     *
     * @param newState the desired state
     * @return true if the transition was valid and applied
     */
    public boolean transitionTo(RetryState newState) {
        return transitionTo(newState, null);
    }

    /**
     * Attempts to transition to a new state with a cause.
     *
     * @param newState the desired state
     * @param cause the reason for the transition (may be null)
     * @return true if the transition was valid and applied
     */
    public boolean transitionTo(RetryState newState, Throwable cause) {
        while (true) {
            RetryState current = state.get();
            if (!isValidTransition(current, newState)) {
                return false;
            }
            if (state.compareAndSet(current, newState)) {
                LOGGER.log(Level.FINEST, "{0}: {1} -> {2}", new Object[] {name, current, newState});
                notifyListeners(current, newState, cause);
                return true;
            }
        }
    }

    /**
     * Checks if a transition from one state to another is valid.
     *
     * @param from the source state
     * @param to the target state
     * @return true if the transition is allowed
     */
    public static boolean isValidTransition(RetryState from, RetryState to) {
        return switch (from) {
            case IDLE -> FROM_IDLE.contains(to);
            case ATTEMPTING -> FROM_ATTEMPTING.contains(to);
            case RETRYING -> FROM_RETRYING.contains(to);
            case SUCCEEDED, FAILED, CANCELLED -> false;
        };
    }

    /**
     * Returns the set of valid target states from a given state.
     *
     * @param from the source state
     * @return set of valid target states
     */
    public static Set<RetryState> getValidTransitions(RetryState from) {
        return switch (from) {
            case IDLE -> EnumSet.copyOf(FROM_IDLE);
            case ATTEMPTING -> EnumSet.copyOf(FROM_ATTEMPTING);
            case RETRYING -> EnumSet.copyOf(FROM_RETRYING);
            case SUCCEEDED, FAILED, CANCELLED -> EnumSet.noneOf(RetryState.class);
        };
    }

    private void notifyListeners(RetryState previous, RetryState current, Throwable cause) {
        for (RetryStateListener listener : listeners) {
            try {
                listener.onStateChanged(previous, current, cause);
            } catch (Exception e) {
                LOGGER.log(Level.WARNING, "Retry state listener failed", e);
            }
        }
    }

    @Override
    public String toString() {
        return "RetryStateMachine[" + name + ":" + state.get() + "]";
    }
}
