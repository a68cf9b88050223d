package express.mvp.myra.stream.retry;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import java.util.Objects;

/**
 * One entry of a {@link RetryStream}'s error log: the error that ended an attempt.
 *
 * <p>The stack trace is captured when the entry is recorded, so later changes to the error's
 * trace do not affect the log.
 */
public final class FailedAttempt {

    private final int retryStep;
    private final Throwable error;
    private final List<StackTraceElement> stackTrace;

    /**
     * Creates an entry for the attempt made at {@code retryStep}.
     *
     * @param retryStep zero for the first attempt, one for the first retry, and so on
     * @param error the error that ended the attempt
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Throwable is kept for diagnostics and cannot be safely copied.")
    public FailedAttempt(int retryStep, Throwable error) {
        this.retryStep = retryStep;
        this.error = Objects.requireNonNull(error, "error");
        this.stackTrace = List.of(error.getStackTrace());
    }

    /**
     * Returns the step of the failed attempt.
     *
     * @return zero for the first attempt
     */
    public int retryStep() {
        return retryStep;
    }

    /**
     * Returns the error that ended the attempt.
     *
     * @return the error
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "Throwable is exposed for diagnostics and cannot be safely copied.")
    public Throwable error() {
        return error;
    }

    /**
     * Returns the error's stack trace as it was when the failure was recorded.
     *
     * @return the stack trace, possibly empty
     */
    public List<StackTraceElement> stackTrace() {
        return stackTrace;
    }

    @Override
    public String toString() {
        return "FailedAttempt[step=" + retryStep + ", error=" + error + "]";
    }
}
