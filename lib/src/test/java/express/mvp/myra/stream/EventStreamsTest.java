package express.mvp.myra.stream;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link EventStreams}. */
@DisplayName("EventStreams")
class EventStreamsTest {

    @Nested
    @DisplayName("fromIterable")
    class FromIterableTests {

        @Test
        @DisplayName("Emits all elements then completes")
        void emitsAllThenCompletes() {
            Recorder<String> recorder = new Recorder<>();

            recorder.listenTo(EventStreams.fromIterable(List.of("a", "b", "c")));

            assertEquals(List.of("a", "b", "c"), recorder.data);
            assertEquals(1, recorder.doneCount);
        }

        @Test
        @DisplayName("Emits into a paused sink in order once it resumes")
        void emitsIntoPausedSink() {
            StreamController<Integer> sink = new StreamController<>();
            List<Integer> received = new ArrayList<>();
            StreamSubscription subscription = sink.stream().listen(received::add);
            subscription.pause();

            EventStreams.fromIterable(List.of(1, 2, 3))
                    .listen(sink::add, sink::addError, sink::close);

            assertTrue(received.isEmpty());
            subscription.resume();
            assertEquals(List.of(1, 2, 3), received);
        }

        @Test
        @DisplayName("just emits its arguments")
        void justEmitsArguments() {
            Recorder<String> recorder = new Recorder<>();

            recorder.listenTo(EventStreams.just("x", "y"));

            assertEquals(List.of("x", "y"), recorder.data);
        }

        @Test
        @DisplayName("Iteration failure is emitted as an error without completion")
        void iterationFailure_emitsError() {
            IllegalStateException failure = new IllegalStateException("broken iterator");
            Iterable<Integer> broken =
                    () ->
                            new Iterator<>() {
                                private int index;

                                @Override
                                public boolean hasNext() {
                                    return true;
                                }

                                @Override
                                public Integer next() {
                                    if (index == 2) {
                                        throw failure;
                                    }
                                    return index++;
                                }
                            };
            Recorder<Integer> recorder = new Recorder<>();

            recorder.listenTo(EventStreams.fromIterable(broken));

            assertEquals(List.of(0, 1), recorder.data);
            assertEquals(List.of(failure), recorder.errors);
            assertEquals(0, recorder.doneCount);
        }

        @Test
        @DisplayName("Listener exceptions propagate to the caller")
        void listenerExceptionPropagates() {
            EventStream<Integer> stream = EventStreams.just(1);

            assertThrows(
                    IllegalArgumentException.class,
                    () ->
                            stream.listen(
                                    value -> {
                                        throw new IllegalArgumentException("listener");
                                    }));
        }
    }

    @Nested
    @DisplayName("error and empty")
    class ErrorAndEmptyTests {

        @Test
        @DisplayName("error emits the error then completes")
        void errorEmitsThenCompletes() {
            RuntimeException failure = new RuntimeException();
            Recorder<Object> recorder = new Recorder<>();

            recorder.listenTo(EventStreams.error(failure));

            assertEquals(List.of(failure), recorder.errors);
            assertEquals(1, recorder.doneCount);
        }

        @Test
        @DisplayName("empty completes immediately")
        void emptyCompletes() {
            Recorder<Object> recorder = new Recorder<>();

            recorder.listenTo(EventStreams.empty());

            assertTrue(recorder.data.isEmpty());
            assertEquals(1, recorder.doneCount);
        }
    }

    @Nested
    @DisplayName("concat")
    class ConcatTests {

        @Test
        @DisplayName("Emits sources in order and passes errors through")
        void emitsInOrder() {
            RuntimeException failure = new RuntimeException();
            Recorder<Integer> recorder = new Recorder<>();

            recorder.listenTo(
                    EventStreams.concat(
                            EventStreams.just(1, 2),
                            EventStreams.error(failure),
                            EventStreams.just(3)));

            assertEquals(List.of(1, 2, 3), recorder.data);
            assertEquals(List.of(failure), recorder.errors);
            assertEquals(1, recorder.doneCount);
        }

        @Test
        @DisplayName("Cancel stops the active source")
        void cancelStopsActiveSource() {
            StreamController<Integer> first = new StreamController<>();
            StreamController<Integer> second = new StreamController<>();
            Recorder<Integer> recorder = new Recorder<>();
            StreamSubscription subscription =
                    recorder.listenTo(EventStreams.concat(first.stream(), second.stream()));

            first.add(1);
            subscription.cancel();
            first.add(2);
            first.close();

            assertEquals(List.of(1), recorder.data);
            assertFalse(first.hasListener());
            assertFalse(second.hasListener());
        }

        @Test
        @DisplayName("Pause is forwarded to the active source")
        void pauseForwarded() {
            StreamController<Integer> source = new StreamController<>();
            StreamSubscription subscription = EventStreams.concat(source.stream()).listen(null);

            subscription.pause();
            assertTrue(source.isPaused());

            subscription.resume();
            assertFalse(source.isPaused());
        }
    }
}
