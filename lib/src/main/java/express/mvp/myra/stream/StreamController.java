package express.mvp.myra.stream;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Synchronous, single-subscription sink that publishes events to one {@link EventStream} listener.
 *
 * <p>Events added with {@link #add}, {@link #addError} and {@link #close} are delivered to the
 * listener immediately, on the calling thread. Events are buffered, in order, while the listener
 * is paused or before anyone has listened, and flushed when the listener resumes or arrives.
 * A listener's {@code onSubscribe} callback runs before {@code onListen}, so the listener can
 * pause or cancel a source that emits synchronously from that hook.
 *
 * <h2>Lifecycle Hooks</h2>
 *
 * <table border="1">
 *   <caption>Controller hooks</caption>
 *   <tr><th>Hook</th><th>Invoked when</th></tr>
 *   <tr><td>onListen</td><td>the stream is listened to</td></tr>
 *   <tr><td>onPause</td><td>the listener goes from running to paused</td></tr>
 *   <tr><td>onResume</td><td>the listener goes from paused to running</td></tr>
 *   <tr><td>onCancel</td><td>the listener cancels, or is cancelled by an error</td></tr>
 * </table>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * StreamController<Integer> controller = StreamController.<Integer>builder()
 *     .onListen(() -> producer.start())
 *     .onCancel(() -> producer.stop())
 *     .build();
 *
 * controller.stream().listen(System.out::println);
 * controller.add(1);
 * controller.close();
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>This class is not thread-safe. All events and subscription calls must come from one thread
 * at a time.
 *
 * @param <T> the type of data events
 */
public final class StreamController<T> {

    private static final Logger LOGGER = Logger.getLogger(StreamController.class.getName());

    private final Runnable onListen;
    private final Runnable onPause;
    private final Runnable onResume;
    private final Runnable onCancel;

    private final EventStream<T> stream = new ControllerStream();

    /** Events added before the first listen. */
    private final Deque<Signal<T>> backlog = new ArrayDeque<>();

    private ControllerSubscription subscription;

    private boolean closed;

    private StreamController(Builder<T> builder) {
        this.onListen = builder.onListen;
        this.onPause = builder.onPause;
        this.onResume = builder.onResume;
        this.onCancel = builder.onCancel;
    }

    /** Creates a controller without lifecycle hooks. */
    public StreamController() {
        this(new Builder<>());
    }

    /**
     * Creates a new builder for a controller with lifecycle hooks.
     *
     * @param <T> the type of data events
     * @return a new builder
     */
    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    /**
     * Returns the stream published by this controller.
     *
     * @return the single-subscription stream
     */
    public EventStream<T> stream() {
        return stream;
    }

    /**
     * Sends a data event.
     *
     * @param value the data event
     * @throws IllegalStateException if the controller is closed
     */
    public void add(T value) {
        checkOpen();
        dispatch(Signal.data(value));
    }

    /**
     * Sends an error event.
     *
     * @param error the error
     * @throws NullPointerException if error is null
     * @throws IllegalStateException if the controller is closed
     */
    public void addError(Throwable error) {
        Objects.requireNonNull(error, "error");
        checkOpen();
        dispatch(Signal.error(error));
    }

    /** Closes the controller and sends the completion event. Closing twice is allowed. */
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        dispatch(Signal.done());
    }

    /**
     * Checks whether the controller has been closed.
     *
     * @return true after {@link #close()}
     */
    public boolean isClosed() {
        return closed;
    }

    /**
     * Checks whether the stream has a listener that has not cancelled.
     *
     * @return true while a subscription is active
     */
    public boolean hasListener() {
        return subscription != null && !subscription.cancelled && !subscription.finished;
    }

    /**
     * Checks whether the current listener is paused.
     *
     * @return true if a listener exists and is paused
     */
    public boolean isPaused() {
        return subscription != null && subscription.isPaused();
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Cannot add event after closing");
        }
    }

    private void dispatch(Signal<T> signal) {
        if (subscription == null) {
            backlog.add(signal);
        } else {
            subscription.offer(signal);
        }
    }

    private StreamSubscription subscribe(
            Consumer<? super StreamSubscription> onSubscribe,
            Consumer<? super T> onData,
            Consumer<? super Throwable> onError,
            Runnable onDone,
            boolean cancelOnError) {
        if (subscription != null) {
            throw new IllegalStateException("Stream has already been listened to");
        }
        ControllerSubscription s =
                new ControllerSubscription(onData, onError, onDone, cancelOnError);
        s.pending.addAll(backlog);
        backlog.clear();
        subscription = s;
        if (onSubscribe != null) {
            onSubscribe.accept(s);
        }
        if (!s.cancelled) {
            runHook(onListen);
            s.flush();
        }
        return s;
    }

    private static void runHook(Runnable hook) {
        if (hook != null) {
            hook.run();
        }
    }

    /** Hands the subscription out before {@code onListen} runs. */
    private final class ControllerStream implements EventStream<T> {

        @Override
        public StreamSubscription listen(
                Consumer<? super T> onData,
                Consumer<? super Throwable> onError,
                Runnable onDone,
                boolean cancelOnError) {
            return subscribe(null, onData, onError, onDone, cancelOnError);
        }

        @Override
        public StreamSubscription listen(
                Consumer<? super StreamSubscription> onSubscribe,
                Consumer<? super T> onData,
                Consumer<? super Throwable> onError,
                Runnable onDone,
                boolean cancelOnError) {
            return subscribe(onSubscribe, onData, onError, onDone, cancelOnError);
        }
    }

    /** The listener side of the controller. */
    private final class ControllerSubscription implements StreamSubscription {

        private final Consumer<? super T> onData;
        private final Consumer<? super Throwable> onError;
        private final Runnable onDone;
        private final boolean cancelOnError;

        /** Events waiting for the listener to resume. */
        private final Deque<Signal<T>> pending = new ArrayDeque<>();

        private int pauseCount;
        private boolean cancelled;
        private boolean finished;
        private boolean flushing;

        ControllerSubscription(
                Consumer<? super T> onData,
                Consumer<? super Throwable> onError,
                Runnable onDone,
                boolean cancelOnError) {
            this.onData = onData;
            this.onError = onError;
            this.onDone = onDone;
            this.cancelOnError = cancelOnError;
        }

        void offer(Signal<T> signal) {
            if (cancelled || finished) {
                return;
            }
            pending.add(signal);
            flush();
        }

        void flush() {
            if (flushing) {
                return;
            }
            flushing = true;
            try {
                while (pauseCount == 0 && !cancelled && !finished && !pending.isEmpty()) {
                    deliver(pending.poll());
                }
            } finally {
                flushing = false;
            }
        }

        private void deliver(Signal<T> signal) {
            switch (signal.kind) {
                case DATA -> {
                    if (onData != null) {
                        onData.accept(signal.value);
                    }
                }
                case ERROR -> {
                    if (cancelOnError) {
                        cancel();
                    }
                    if (onError != null) {
                        onError.accept(signal.error);
                    } else {
                        LOGGER.log(Level.WARNING, "Unhandled stream error", signal.error);
                    }
                }
                case DONE -> {
                    finished = true;
                    pending.clear();
                    if (onDone != null) {
                        onDone.run();
                    }
                }
            }
        }

        @Override
        public void pause() {
            if (cancelled || finished) {
                return;
            }
            if (pauseCount++ == 0) {
                runHook(onPause);
            }
        }

        @Override
        public void resume() {
            if (cancelled || finished || pauseCount == 0) {
                return;
            }
            if (--pauseCount == 0) {
                runHook(onResume);
                flush();
            }
        }

        @Override
        public void cancel() {
            if (cancelled || finished) {
                return;
            }
            cancelled = true;
            pending.clear();
            runHook(onCancel);
        }

        @Override
        public boolean isPaused() {
            return pauseCount > 0 && !cancelled && !finished;
        }
    }

    /** A buffered data, error or completion event. */
    private static final class Signal<T> {

        enum Kind {
            DATA,
            ERROR,
            DONE
        }

        final Kind kind;
        final T value;
        final Throwable error;

        private Signal(Kind kind, T value, Throwable error) {
            this.kind = kind;
            this.value = value;
            this.error = error;
        }

        static <T> Signal<T> data(T value) {
            return new Signal<>(Kind.DATA, value, null);
        }

        static <T> Signal<T> error(Throwable error) {
            return new Signal<>(Kind.ERROR, null, error);
        }

        static <T> Signal<T> done() {
            return new Signal<>(Kind.DONE, null, null);
        }
    }

    /**
     * Builder for {@link StreamController}.
     *
     * @param <T> the type of data events
     */
    public static final class Builder<T> {

        private Runnable onListen;
        private Runnable onPause;
        private Runnable onResume;
        private Runnable onCancel;

        private Builder() {}

        /**
         * Sets the hook invoked when the stream is listened to.
         *
         * @param onListen the hook (may be null)
         * @return this builder
         */
        public Builder<T> onListen(Runnable onListen) {
            this.onListen = onListen;
            return this;
        }

        /**
         * Sets the hook invoked when the listener pauses.
         *
         * @param onPause the hook (may be null)
         * @return this builder
         */
        public Builder<T> onPause(Runnable onPause) {
            this.onPause = onPause;
            return this;
        }

        /**
         * Sets the hook invoked when the listener resumes.
         *
         * @param onResume the hook (may be null)
         * @return this builder
         */
        public Builder<T> onResume(Runnable onResume) {
            this.onResume = onResume;
            return this;
        }

        /**
         * Sets the hook invoked when the listener cancels.
         *
         * @param onCancel the hook (may be null)
         * @return this builder
         */
        public Builder<T> onCancel(Runnable onCancel) {
            this.onCancel = onCancel;
            return this;
        }

        /**
         * Builds the controller.
         *
         * @return a new controller
         */
        public StreamController<T> build() {
            return new StreamController<>(this);
        }
    }
}
