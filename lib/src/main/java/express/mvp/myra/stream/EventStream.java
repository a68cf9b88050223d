package express.mvp.myra.stream;

import java.util.function.Consumer;

/**
 * A push-based source of data events, terminated by at most one error or completion.
 *
 * <p>Listening starts the flow of events. Each callback is optional; a {@code null} callback means
 * the corresponding event is ignored. Streams are single-subscription: listening a second time
 * throws {@link IllegalStateException}.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * EventStream<String> stream = EventStreams.fromIterable(List.of("a", "b"));
 *
 * StreamSubscription subscription = stream.listen(
 *     item -> System.out.println(item),
 *     error -> error.printStackTrace(),
 *     () -> System.out.println("done"),
 *     false);
 * }</pre>
 *
 * <h2>Threading</h2>
 *
 * <p>Callbacks for one subscription are never invoked concurrently. Implementations may deliver
 * events synchronously from within {@code listen}, so callers must be prepared to receive events
 * before the subscription handle is returned. A caller that may need to pause or cancel during
 * that window passes an {@code onSubscribe} callback, which receives the handle before the first
 * event wherever the implementation can provide it.
 *
 * @param <T> the type of data events
 * @see StreamSubscription
 * @see EventStreams
 */
public interface EventStream<T> {

    /**
     * Starts listening to this stream.
     *
     * @param onData invoked for each data event (may be null)
     * @param onError invoked for an error event (may be null)
     * @param onDone invoked once when the stream completes (may be null)
     * @param cancelOnError whether the subscription cancels itself after delivering an error
     * @return the subscription controlling the flow of events
     * @throws IllegalStateException if this stream has already been listened to
     */
    StreamSubscription listen(
            Consumer<? super T> onData,
            Consumer<? super Throwable> onError,
            Runnable onDone,
            boolean cancelOnError);

    /**
     * Starts listening and hands the subscription to {@code onSubscribe} as early as possible.
     *
     * <p>Streams published by a {@link StreamController} call {@code onSubscribe} before any
     * event is delivered, so a pause or cancel issued from a data callback reaches a source that
     * is still emitting inside {@code listen}. The default implementation calls it once
     * {@link #listen(Consumer, Consumer, Runnable, boolean)} has returned.
     *
     * @param onSubscribe receives the subscription (may be null)
     * @param onData invoked for each data event (may be null)
     * @param onError invoked for an error event (may be null)
     * @param onDone invoked once when the stream completes (may be null)
     * @param cancelOnError whether the subscription cancels itself after delivering an error
     * @return the subscription controlling the flow of events
     * @throws IllegalStateException if this stream has already been listened to
     */
    default StreamSubscription listen(
            Consumer<? super StreamSubscription> onSubscribe,
            Consumer<? super T> onData,
            Consumer<? super Throwable> onError,
            Runnable onDone,
            boolean cancelOnError) {
        StreamSubscription subscription = listen(onData, onError, onDone, cancelOnError);
        if (onSubscribe != null) {
            onSubscribe.accept(subscription);
        }
        return subscription;
    }

    /**
     * Starts listening with error, completion and cancel-on-error defaults.
     *
     * @param onData invoked for each data event (may be null)
     * @return the subscription
     */
    default StreamSubscription listen(Consumer<? super T> onData) {
        return listen(onData, null, null, false);
    }

    /**
     * Starts listening without cancelling on error.
     *
     * @param onData invoked for each data event (may be null)
     * @param onError invoked for an error event (may be null)
     * @param onDone invoked once when the stream completes (may be null)
     * @return the subscription
     */
    default StreamSubscription listen(
            Consumer<? super T> onData, Consumer<? super Throwable> onError, Runnable onDone) {
        return listen(onData, onError, onDone, false);
    }
}
