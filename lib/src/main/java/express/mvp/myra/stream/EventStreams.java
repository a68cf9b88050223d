package express.mvp.myra.stream;

import express.mvp.myra.stream.retry.RetryStream;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Factory methods for common {@link EventStream} sources.
 *
 * <p>All streams returned here are single-subscription and deliver events synchronously from
 * within {@code listen}. Iterable-backed streams honour pause: they stop pulling from the iterator
 * while paused and continue on resume.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * EventStream<Integer> flaky = EventStreams.concat(
 *     EventStreams.just(1),
 *     EventStreams.error(new IllegalStateException("boom")));
 *
 * EventStreams.retry(() -> flaky(), 3).listen(System.out::println);
 * }</pre>
 */
public final class EventStreams {

    private EventStreams() {
        // Utility class
    }

    /**
     * Creates a stream that emits each element of {@code values} and then completes.
     *
     * <p>If iteration throws, the stream emits the exception as an error and ends without a
     * completion event.
     *
     * @param values the elements to emit
     * @param <T> the element type
     * @return a new stream
     */
    public static <T> EventStream<T> fromIterable(Iterable<? extends T> values) {
        Objects.requireNonNull(values, "values");
        return new IterableStream<T>(values).controller.stream();
    }

    /**
     * Creates a stream that emits the given values and then completes.
     *
     * @param values the values to emit
     * @param <T> the element type
     * @return a new stream
     */
    @SafeVarargs
    public static <T> EventStream<T> just(T... values) {
        return fromIterable(Arrays.asList(values));
    }

    /**
     * Creates a stream that completes without emitting.
     *
     * @param <T> the element type
     * @return a new stream
     */
    public static <T> EventStream<T> empty() {
        return fromIterable(List.of());
    }

    /**
     * Creates a stream that emits a single error and then completes.
     *
     * @param error the error to emit
     * @param <T> the element type
     * @return a new stream
     */
    public static <T> EventStream<T> error(Throwable error) {
        Objects.requireNonNull(error, "error");
        return new ErrorStream<T>(error).controller.stream();
    }

    /**
     * Creates a stream that emits every event of each source in order.
     *
     * <p>Each source is listened to only after the previous one has completed. Errors are passed
     * through without ending the concatenation.
     *
     * @param sources the streams to concatenate
     * @param <T> the element type
     * @return a new stream
     */
    @SafeVarargs
    public static <T> EventStream<T> concat(EventStream<? extends T>... sources) {
        return new ConcatStream<T>(List.of(sources)).stream();
    }

    /**
     * Creates a stream that re-creates and re-listens to a source until it completes.
     *
     * @param factory creates a fresh source for each attempt
     * @param <T> the element type
     * @return a stream retrying indefinitely
     * @see RetryStream
     */
    public static <T> RetryStream<T> retry(Supplier<? extends EventStream<T>> factory) {
        return new RetryStream<>(factory);
    }

    /**
     * Creates a stream that re-creates and re-listens to a source at most {@code count} times.
     *
     * @param factory creates a fresh source for each attempt
     * @param count number of retries after the first attempt
     * @param <T> the element type
     * @return a stream retrying at most {@code count} times
     * @see RetryStream
     */
    public static <T> RetryStream<T> retry(Supplier<? extends EventStream<T>> factory, int count) {
        return new RetryStream<>(factory, count);
    }

    /** Pulls from an iterator while the listener is running. */
    private static final class IterableStream<T> {

        private final Iterable<? extends T> values;
        private final StreamController<T> controller;

        private Iterator<? extends T> iterator;
        private boolean draining;
        private boolean cancelled;

        IterableStream(Iterable<? extends T> values) {
            this.values = values;
            this.controller =
                    StreamController.<T>builder()
                            .onListen(this::drain)
                            .onResume(this::drain)
                            .onCancel(() -> cancelled = true)
                            .build();
        }

        private void drain() {
            if (draining) {
                return;
            }
            draining = true;
            try {
                if (iterator == null) {
                    iterator = values.iterator();
                }
                while (!cancelled && !controller.isClosed() && !controller.isPaused()) {
                    boolean hasNext;
                    T next = null;
                    try {
                        hasNext = iterator.hasNext();
                        if (hasNext) {
                            next = iterator.next();
                        }
                    } catch (RuntimeException e) {
                        // Iteration cannot continue, so no completion follows the error.
                        cancelled = true;
                        controller.addError(e);
                        return;
                    }
                    if (!hasNext) {
                        controller.close();
                        return;
                    }
                    controller.add(next);
                }
            } finally {
                draining = false;
            }
        }
    }

    /** Emits one error, then completes. */
    private static final class ErrorStream<T> {

        private final StreamController<T> controller;

        ErrorStream(Throwable error) {
            this.controller =
                    StreamController.<T>builder().onListen(() -> emit(error)).build();
        }

        private void emit(Throwable error) {
            controller.addError(error);
            controller.close();
        }
    }
}
