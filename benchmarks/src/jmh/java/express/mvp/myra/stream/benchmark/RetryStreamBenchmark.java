package express.mvp.myra.stream.benchmark;

import express.mvp.myra.stream.EventStream;
import express.mvp.myra.stream.EventStreams;
import express.mvp.myra.stream.retry.RetryStream;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

/**
 * Micro-benchmark for {@link RetryStream} pass-through and restart cost.
 *
 * <p>Scenarios:
 * <ul>
 *   <li>Plain iterable stream - baseline
 *   <li>Retry stream whose first attempt succeeds - pass-through overhead
 *   <li>Retry stream whose source fails {@code failures} times first - restart overhead
 * </ul>
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@State(Scope.Thread)
@Warmup(iterations = 3, time = 2, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 2, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class RetryStreamBenchmark {

    private static final IllegalStateException FAILURE = new IllegalStateException("boom");

    @Param({"16", "1024"})
    private int items;

    @Param({"1", "8"})
    private int failures;

    private List<Integer> payload;

    @Setup(Level.Trial)
    public void setup() {
        payload = IntStream.range(0, items).boxed().collect(Collectors.toList());
    }

    @Benchmark
    public void baseline(Blackhole bh) {
        EventStreams.fromIterable(payload).listen(bh::consume, bh::consume, () -> bh.consume(1));
    }

    @Benchmark
    public void retryPassThrough(Blackhole bh) {
        EventStreams.retry(() -> EventStreams.fromIterable(payload), 3)
                .listen(bh::consume, bh::consume, () -> bh.consume(1));
    }

    @Benchmark
    public void retryAfterFailures(Blackhole bh) {
        int[] attempts = new int[1];
        RetryStream<Integer> stream =
                EventStreams.retry(
                        () -> {
                            EventStream<Integer> source =
                                    attempts[0] < failures
                                            ? EventStreams.error(FAILURE)
                                            : EventStreams.fromIterable(payload);
                            attempts[0]++;
                            return source;
                        });
        stream.listen(bh::consume, bh::consume, () -> bh.consume(1));
    }
}
