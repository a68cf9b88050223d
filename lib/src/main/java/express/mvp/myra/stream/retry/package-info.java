/**
 * Re-subscription of failing streams.
 *
 * <p>{@link express.mvp.myra.stream.retry.RetryStream} re-creates its source after every error
 * until an attempt completes or the {@link express.mvp.myra.stream.retry.RetryBudget} runs out.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.myra.stream.retry.RetryStream} - The retrying operator
 *   <li>{@link express.mvp.myra.stream.retry.RetryBudget} - How many retries are allowed
 *   <li>{@link express.mvp.myra.stream.retry.RetryError} - Emitted when the budget runs out
 *   <li>{@link express.mvp.myra.stream.retry.RetryStateMachine} - Lifecycle of one retry stream
 * </ul>
 *
 * <h2>Lifecycle</h2>
 *
 * <ol>
 *   <li><b>IDLE:</b> Not yet listened to
 *   <li><b>ATTEMPTING:</b> Listening to a fresh source
 *   <li><b>RETRYING:</b> The last source failed, a new one is requested
 *   <li><b>SUCCEEDED / FAILED / CANCELLED:</b> Terminal
 * </ol>
 */
package express.mvp.myra.stream.retry;
