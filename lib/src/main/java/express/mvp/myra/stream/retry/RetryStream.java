package express.mvp.myra.stream.retry;

import express.mvp.myra.stream.EventStream;
import express.mvp.myra.stream.StreamController;
import express.mvp.myra.stream.StreamSubscription;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A stream that re-creates and re-listens to a source until the source completes.
 *
 * <p>Each attempt asks the factory for a fresh source. Data events are passed through unchanged. A
 * completion from any attempt closes this stream. An error ends the attempt: it is recorded, and
 * if the {@link RetryBudget} allows, the next attempt starts immediately. When a bounded budget
 * runs out, a single {@link RetryError} carrying every recorded failure is emitted and the stream
 * closes. Individual attempt errors are never delivered to the listener.
 *
 * <p>Every error triggers a retry; there is no filtering by error type.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RetryStream<Quote> quotes = RetryStream.builder(() -> feed.open("EURUSD"))
 *     .maxRetries(3)
 *     .name("eurusd-feed")
 *     .build();
 *
 * quotes.listen(
 *     quote -> book.update(quote),
 *     error -> alert(((RetryError) error).errors()),
 *     () -> log.info("feed finished"),
 *     false);
 * }</pre>
 *
 * <h2>Attempt Ordering</h2>
 *
 * <p>At most one source is listened to at a time, and a new attempt starts only after the previous
 * subscription has been cancelled. Restarts go through a work-in-progress counter, so a source
 * that fails synchronously inside {@code listen} is retried in a loop instead of by recursion.
 *
 * <h2>Pause and Cancel</h2>
 *
 * <p>Pause and resume are forwarded to the active attempt; a source started while the listener is
 * paused is paused straight away. Each attempt takes its source's subscription before the first
 * event where the source offers it, so a pause or cancel issued from a data callback also reaches
 * a source that is still emitting inside {@code listen}. Cancel stops the active attempt and
 * prevents any further one. Errors arriving after cancel are dropped and no {@link RetryError} is
 * emitted.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Not thread-safe. Like any {@link EventStream}, events for one subscription must be delivered
 * serially. Only the lifecycle is safe to observe from other threads: {@link #state()} and the
 * {@link RetryStateListener}s are backed by {@link RetryStateMachine}, which is thread-safe.
 *
 * @param <T> the element type
 * @see RetryBudget
 * @see RetryError
 */
public final class RetryStream<T> implements EventStream<T> {

    private static final Logger LOGGER = Logger.getLogger(RetryStream.class.getName());

    private final Supplier<? extends EventStream<T>> streamFactory;

    private final RetryBudget budget;

    private final String name;

    private final RetryStateMachine stateMachine;

    /** One entry per failed attempt, in order. */
    private final List<FailedAttempt> errors = new ArrayList<>();

    /** Pending restarts; non-zero while the attempt loop is running. */
    private final AtomicInteger wip = new AtomicInteger();

    private int retryStep;

    private StreamController<T> controller;

    private Attempt active;

    /**
     * Creates a stream that retries indefinitely.
     *
     * @param streamFactory creates a fresh source for each attempt
     */
    public RetryStream(Supplier<? extends EventStream<T>> streamFactory) {
        this(builder(streamFactory));
    }

    /**
     * Creates a stream that retries at most {@code count} times.
     *
     * @param streamFactory creates a fresh source for each attempt
     * @param count number of retries after the first attempt
     * @throws IllegalArgumentException if count is negative
     */
    public RetryStream(Supplier<? extends EventStream<T>> streamFactory, int count) {
        this(builder(streamFactory).maxRetries(count));
    }

    private RetryStream(Builder<T> builder) {
        this.streamFactory = builder.streamFactory;
        this.budget = builder.budget;
        this.name = builder.name;
        this.stateMachine = new RetryStateMachine(name);
        for (RetryStateListener listener : builder.listeners) {
            stateMachine.addListener(listener);
        }
    }

    /**
     * Creates a builder for a retry stream.
     *
     * @param streamFactory creates a fresh source for each attempt
     * @param <T> the element type
     * @return a new builder with an unbounded budget
     */
    public static <T> Builder<T> builder(Supplier<? extends EventStream<T>> streamFactory) {
        return new Builder<>(streamFactory);
    }

    @Override
    public StreamSubscription listen(
            Consumer<? super T> onData,
            Consumer<? super Throwable> onError,
            Runnable onDone,
            boolean cancelOnError) {
        return listen(null, onData, onError, onDone, cancelOnError);
    }

    @Override
    public StreamSubscription listen(
            Consumer<? super StreamSubscription> onSubscribe,
            Consumer<? super T> onData,
            Consumer<? super Throwable> onError,
            Runnable onDone,
            boolean cancelOnError) {
        if (controller == null) {
            controller =
                    StreamController.<T>builder()
                            .onListen(this::resubscribe)
                            .onPause(this::pauseActive)
                            .onResume(this::resumeActive)
                            .onCancel(this::cancel)
                            .build();
        }
        return controller.stream().listen(onSubscribe, onData, onError, onDone, cancelOnError);
    }

    /**
     * Returns the retry budget.
     *
     * @return the budget
     */
    public RetryBudget budget() {
        return budget;
    }

    /**
     * Returns the name used in log messages.
     *
     * @return the name
     */
    public String name() {
        return name;
    }

    /**
     * Returns the current lifecycle state.
     *
     * @return the state
     */
    public RetryState state() {
        return stateMachine.getState();
    }

    /**
     * Returns the number of retries started so far.
     *
     * @return zero during the first attempt
     */
    public int retryStep() {
        return retryStep;
    }

    /**
     * Returns the failures recorded so far, in attempt order.
     *
     * @return an unmodifiable snapshot of the error log
     */
    public List<FailedAttempt> errors() {
        return List.copyOf(errors);
    }

    /**
     * Registers a listener for lifecycle changes.
     *
     * @param listener the listener
     */
    public void addStateListener(RetryStateListener listener) {
        stateMachine.addListener(Objects.requireNonNull(listener, "listener"));
    }

    private void resubscribe() {
        if (wip.getAndIncrement() != 0) {
            return;
        }
        try {
            do {
                if (!stateMachine.transitionTo(RetryState.ATTEMPTING)) {
                    wip.set(0);
                    return;
                }
                LOGGER.log(Level.FINE, "{0}: starting attempt {1}", new Object[] {name, retryStep});
                Attempt attempt = new Attempt(retryStep);
                active = attempt;
                attempt.start();
            } while (wip.decrementAndGet() != 0);
        } catch (RuntimeException | Error e) {
            wip.set(0);
            throw e;
        }
    }

    private void pauseActive() {
        Attempt attempt = active;
        if (attempt != null) {
            attempt.pause();
        }
    }

    private void resumeActive() {
        Attempt attempt = active;
        if (attempt != null) {
            attempt.resume();
        }
    }

    private void cancel() {
        if (!stateMachine.transitionTo(RetryState.CANCELLED)) {
            return;
        }
        LOGGER.log(
                Level.FINE,
                "{0}: cancelled after {1} failed attempt(s)",
                new Object[] {name, errors.size()});
        Attempt attempt = active;
        active = null;
        if (attempt != null) {
            attempt.stop();
        }
    }

    private void onAttemptFailed(Attempt attempt, Throwable error) {
        errors.add(new FailedAttempt(attempt.step, error));
        LOGGER.log(Level.FINE, name + ": attempt " + attempt.step + " failed", error);

        if (budget.isExhaustedAt(retryStep)) {
            RetryError retryError = new RetryError(budget.count().getAsInt(), errors);
            LOGGER.log(
                    Level.FINE,
                    "{0}: giving up after {1} attempt(s)",
                    new Object[] {name, errors.size()});
            stateMachine.transitionTo(RetryState.FAILED, retryError);
            controller.addError(retryError);
            controller.close();
        } else {
            retryStep++;
            stateMachine.transitionTo(RetryState.RETRYING, error);
            resubscribe();
        }
    }

    private void onAttemptCompleted() {
        if (stateMachine.transitionTo(RetryState.SUCCEEDED)) {
            LOGGER.log(Level.FINE, "{0}: completed at attempt {1}", new Object[] {name, retryStep});
            controller.close();
        }
    }

    /** A single listen on one source created by the factory. */
    private final class Attempt {

        private final int step;

        private StreamSubscription subscription;

        /** Set once this attempt has errored, completed or been stopped. */
        private boolean finished;

        Attempt(int step) {
            this.step = step;
        }

        void start() {
            EventStream<T> source;
            try {
                source =
                        Objects.requireNonNull(
                                streamFactory.get(), "stream factory returned null");
            } catch (RuntimeException e) {
                onError(e);
                return;
            }
            source.listen(this::onSubscribe, this::onData, this::onError, this::onDone, false);
        }

        private void onSubscribe(StreamSubscription s) {
            if (finished) {
                // Handle arrived after the source had already ended or been stopped.
                s.cancel();
                return;
            }
            subscription = s;
            if (controller.isPaused()) {
                s.pause();
            }
        }

        private void onData(T value) {
            if (!finished) {
                controller.add(value);
            }
        }

        private void onError(Throwable error) {
            if (error == null) {
                error = new NullPointerException("source emitted a null error");
            }
            if (finished) {
                if (state() == RetryState.CANCELLED) {
                    LOGGER.log(Level.FINE, name + ": ignoring error after cancel", error);
                }
                return;
            }
            finished = true;
            if (subscription != null) {
                subscription.cancel();
            }
            active = null;
            onAttemptFailed(this, error);
        }

        private void onDone() {
            if (finished) {
                return;
            }
            finished = true;
            active = null;
            onAttemptCompleted();
        }

        void pause() {
            if (subscription != null) {
                subscription.pause();
            }
        }

        void resume() {
            if (subscription != null) {
                subscription.resume();
            }
        }

        void stop() {
            finished = true;
            if (subscription != null) {
                subscription.cancel();
            }
        }
    }

    /**
     * Builder for {@link RetryStream}.
     *
     * @param <T> the element type
     */
    public static final class Builder<T> {

        private final Supplier<? extends EventStream<T>> streamFactory;
        private RetryBudget budget = RetryBudget.unbounded();
        private String name = "retry-stream";
        private final List<RetryStateListener> listeners = new ArrayList<>();

        private Builder(Supplier<? extends EventStream<T>> streamFactory) {
            this.streamFactory = Objects.requireNonNull(streamFactory, "streamFactory");
        }

        /**
         * Limits the number of retries after the first attempt.
         *
         * @param count retries allowed
         * @return this builder
         * @throws IllegalArgumentException if count is negative
         */
        public Builder<T> maxRetries(int count) {
            this.budget = RetryBudget.of(count);
            return this;
        }

        /**
         * Sets the retry budget.
         *
         * @param budget the budget
         * @return this builder
         */
        public Builder<T> budget(RetryBudget budget) {
            this.budget = Objects.requireNonNull(budget, "budget");
            return this;
        }

        /**
         * Sets the name used in log messages.
         *
         * @param name the name
         * @return this builder
         */
        public Builder<T> name(String name) {
            this.name = Objects.requireNonNull(name, "name");
            return this;
        }

        /**
         * Adds a lifecycle listener.
         *
         * @param listener the listener
         * @return this builder
         */
        public Builder<T> listener(RetryStateListener listener) {
            listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        /**
         * Builds the stream.
         *
         * @return a new retry stream
         */
        public RetryStream<T> build() {
            return new RetryStream<>(this);
        }
    }
}
