package express.mvp.myra.stream.retry;

import java.util.OptionalInt;

/**
 * The number of retries a {@link RetryStream} may make after its first attempt.
 *
 * <p>A bounded budget of {@code count} allows at most {@code count + 1} attempts in total. An
 * unbounded budget retries for as long as the source keeps failing, so a source that never
 * succeeds is re-created forever.
 *
 * <h2>Built-in Budgets</h2>
 *
 * <ul>
 *   <li>{@link #unbounded()} - Retry indefinitely
 *   <li>{@link #noRetry()} - A single attempt, no retries
 *   <li>{@link #of(int)} - At most {@code count} retries
 * </ul>
 *
 * @see RetryStream
 */
public final class RetryBudget {

    private static final RetryBudget UNBOUNDED = new RetryBudget(-1);

    private static final RetryBudget NO_RETRY = new RetryBudget(0);

    /** Allowed retries, or -1 when unbounded. */
    private final int count;

    private RetryBudget(int count) {
        this.count = count;
    }

    /**
     * Returns a budget that never runs out.
     *
     * @return the unbounded budget
     */
    public static RetryBudget unbounded() {
        return UNBOUNDED;
    }

    /**
     * Returns a budget that allows the first attempt only.
     *
     * @return the zero-retry budget
     */
    public static RetryBudget noRetry() {
        return NO_RETRY;
    }

    /**
     * Returns a budget of {@code count} retries.
     *
     * @param count retries allowed after the first attempt
     * @return the bounded budget
     * @throws IllegalArgumentException if count is negative
     */
    public static RetryBudget of(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0 but was " + count);
        }
        return count == 0 ? NO_RETRY : new RetryBudget(count);
    }

    /**
     * Returns a budget from a nullable count, where {@code null} means unbounded.
     *
     * @param count retries allowed, or null
     * @return the matching budget
     */
    public static RetryBudget ofNullable(Integer count) {
        return count == null ? UNBOUNDED : of(count);
    }

    /**
     * Checks whether this budget is unbounded.
     *
     * @return true if retries never run out
     */
    public boolean isUnbounded() {
        return count < 0;
    }

    /**
     * Returns the retry count.
     *
     * @return the count, or empty when unbounded
     */
    public OptionalInt count() {
        return isUnbounded() ? OptionalInt.empty() : OptionalInt.of(count);
    }

    /**
     * Returns the maximum number of attempts, including the first.
     *
     * @return max attempts, or empty when unbounded
     */
    public OptionalInt maxAttempts() {
        return isUnbounded() ? OptionalInt.empty() : OptionalInt.of(count + 1);
    }

    /**
     * Checks whether a failure at the given retry step exhausts this budget.
     *
     * <p>The step is zero for the first attempt and grows by one with every retry, so a budget of
     * {@code count} is exhausted exactly when a failure happens at step {@code count}.
     *
     * @param retryStep the step of the attempt that failed
     * @return true if no further attempt may be made
     */
    public boolean isExhaustedAt(int retryStep) {
        return !isUnbounded() && retryStep == count;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof RetryBudget other && count == other.count;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(count);
    }

    @Override
    public String toString() {
        return isUnbounded() ? "RetryBudget[unbounded]" : "RetryBudget[count=" + count + "]";
    }
}
