package express.mvp.myra.stream;

import java.util.concurrent.CompletionStage;

/**
 * Handle to an active listen on an {@link EventStream}.
 *
 * <p>Pauses nest: a subscription paused twice needs two resumes before events flow again. Calling
 * {@link #cancel()} ends the subscription; no callback is invoked afterwards and every other
 * method becomes a no-op.
 */
public interface StreamSubscription {

    /** Requests that the stream stop delivering events until resumed. */
    void pause();

    /**
     * Pauses until the given signal completes.
     *
     * <p>The subscription resumes once when {@code resumeSignal} completes, normally or
     * exceptionally. A {@code null} signal behaves like {@link #pause()}.
     *
     * @param resumeSignal completion that triggers the matching resume (may be null)
     */
    default void pause(CompletionStage<?> resumeSignal) {
        pause();
        if (resumeSignal != null) {
            resumeSignal.whenComplete((ignored, error) -> resume());
        }
    }

    /** Undoes one {@link #pause()}. Has no effect if the subscription is not paused. */
    void resume();

    /** Cancels the subscription. Idempotent. */
    void cancel();

    /**
     * Checks whether the subscription is currently paused.
     *
     * @return true if at least one pause is outstanding
     */
    boolean isPaused();
}
