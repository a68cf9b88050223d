package express.mvp.myra.stream;

import java.util.List;

/**
 * Listens to a fixed list of sources one after another.
 *
 * <p>Sources that complete synchronously inside {@code listen} are advanced past in a loop rather
 * than by nested calls.
 *
 * @param <T> the element type
 */
final class ConcatStream<T> {

    private final List<EventStream<? extends T>> sources;
    private final StreamController<T> controller;

    private int index;
    private Segment active;
    private boolean cancelled;
    private boolean advancing;
    private boolean advanceRequested;

    ConcatStream(List<EventStream<? extends T>> sources) {
        this.sources = sources;
        this.controller =
                StreamController.<T>builder()
                        .onListen(this::advance)
                        .onPause(this::pauseActive)
                        .onResume(this::resumeActive)
                        .onCancel(this::cancel)
                        .build();
    }

    EventStream<T> stream() {
        return controller.stream();
    }

    private void advance() {
        advanceRequested = true;
        if (advancing) {
            return;
        }
        advancing = true;
        try {
            while (advanceRequested && !cancelled) {
                advanceRequested = false;
                if (index == sources.size()) {
                    controller.close();
                    return;
                }
                Segment segment = new Segment();
                active = segment;
                segment.start(sources.get(index++));
            }
        } finally {
            advancing = false;
        }
    }

    private void pauseActive() {
        if (active != null && active.subscription != null) {
            active.subscription.pause();
        }
    }

    private void resumeActive() {
        if (active != null && active.subscription != null) {
            active.subscription.resume();
        }
    }

    private void cancel() {
        cancelled = true;
        if (active != null) {
            active.stop();
        }
    }

    /** One source's listen. */
    private final class Segment {

        private StreamSubscription subscription;
        private boolean finished;

        void start(EventStream<? extends T> source) {
            source.listen(this::onSubscribe, this::onData, this::onError, this::onDone, false);
        }

        private void onSubscribe(StreamSubscription s) {
            if (finished) {
                if (cancelled) {
                    s.cancel();
                }
                return;
            }
            subscription = s;
            if (controller.isPaused()) {
                s.pause();
            }
        }

        private void onData(T value) {
            if (!finished && !cancelled) {
                controller.add(value);
            }
        }

        private void onError(Throwable error) {
            if (!finished && !cancelled) {
                controller.addError(error);
            }
        }

        private void onDone() {
            if (finished) {
                return;
            }
            finished = true;
            advance();
        }

        void stop() {
            finished = true;
            if (subscription != null) {
                subscription.cancel();
            }
        }
    }
}
