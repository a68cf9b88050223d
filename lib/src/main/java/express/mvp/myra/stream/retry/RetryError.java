package express.mvp.myra.stream.retry;

import express.mvp.myra.stream.StreamException;
import java.util.List;

/**
 * Terminal error emitted by a {@link RetryStream} whose retry budget ran out.
 *
 * <p>It carries every failure, in attempt order, together with the configured retry count. Each
 * recorded error is attached as a suppressed exception and the last one is the cause, so a
 * printed stack trace shows the whole history.
 *
 * <p>Only bounded retry streams can produce this error. A stream that was cancelled, or whose
 * source completed, never does.
 */
public class RetryError extends StreamException {

    private final int count;

    private final transient List<FailedAttempt> errors;

    /**
     * Creates the error for an exhausted budget.
     *
     * @param count the configured number of retries
     * @param errors the failures, in attempt order; must not be empty
     */
    public RetryError(int count, List<FailedAttempt> errors) {
        super(
                "Received an error after attempting " + count + " retries",
                errors.isEmpty() ? null : errors.get(errors.size() - 1).error());
        this.count = count;
        this.errors = List.copyOf(errors);
        for (int i = 0; i < this.errors.size() - 1; i++) {
            addSuppressed(this.errors.get(i).error());
        }
    }

    /**
     * Returns the number of retries that were allowed.
     *
     * @return the retry count
     */
    public int count() {
        return count;
    }

    /**
     * Returns the failures that led to this error, in attempt order.
     *
     * @return an unmodifiable list with {@code count() + 1} entries
     */
    public List<FailedAttempt> errors() {
        return errors;
    }
}
