package express.mvp.myra.stream.retry;

/**
 * Callback interface for {@link RetryStream} state changes.
 *
 * <p>Useful for metrics and diagnostics: every attempt start, every retry and the terminal outcome
 * is reported here.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RetryStream<String> stream = RetryStream.builder(this::openFeed)
 *     .maxRetries(5)
 *     .listener((previous, current, cause) -> {
 *         if (current == RetryState.RETRYING) {
 *             retries.increment();
 *         }
 *     })
 *     .build();
 * }</pre>
 *
 * @see RetryStateMachine
 */
@FunctionalInterface
public interface RetryStateListener {

    /**
     * Called when the retry state changes.
     *
     * <p>Invoked synchronously during the transition. Implementations should be quick and must not
     * call back into the stream.
     *
     * @param previousState the state before the transition
     * @param currentState the new state
     * @param cause the attempt's error for RETRYING, the {@link RetryError} for FAILED, otherwise
     *     null
     */
    void onStateChanged(RetryState previousState, RetryState currentState, Throwable cause);
}
