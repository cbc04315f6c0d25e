package throttle.benchmarks.java;

import org.openjdk.jmh.annotations.*;
import throttle.core.algorithms.token_bucket.ThrottleEvaluator;
import throttle.core.clock.ClockReading;
import throttle.core.clock.SystemClock;
import throttle.core.model.Bucket;
import throttle.core.model.Knobs;
import throttle.core.model.ThrottleRequest;
import throttle.java.store.memory.InMemoryThrottleStore;

import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * JMH Benchmarks for throttle evaluation and running counters.
 *
 * Measures throughput (ops/sec):
 * - evaluator: pure evaluation on loaded state (no store)
 * - singleKey: all requests to one throttle in the in-memory store (high contention)
 * - multiKey: rotating through 1000 throttles (low contention)
 * - parallel: 8 threads on one throttle
 * - counterIncrement: running counter updates on one key
 *
 * Run (test classpath):
 *   java -cp target/test-classes:target/classes:&lt;deps&gt; org.openjdk.jmh.Main Throttle
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@State(Scope.Benchmark)
public class ThrottleBenchmark {

    private InMemoryThrottleStore store;
    private ThrottleRequest hotRequest;
    private Knobs knobs;
    private Optional<Bucket> bucket;
    private ClockReading now;

    @Setup
    public void setup() {
        store = new InMemoryThrottleStore(SystemClock.instance(), 10_000);
        knobs = new Knobs(1_000_000, 1, 1);
        hotRequest = new ThrottleRequest("user1", knobs, 1, 0);
        bucket = Optional.of(new Bucket(500_000, 1_000));
        now = new ClockReading(1_000, 250_000);
    }

    @TearDown
    public void tearDown() {
        store.close();
    }

    /**
     * Pure evaluation, no locking or storage.
     */
    @Benchmark
    public ThrottleEvaluator.Evaluation evaluator() {
        return ThrottleEvaluator.evaluate(knobs, bucket, now, 1);
    }

    @Benchmark
    public boolean singleKey() {
        return store.evaluate(hotRequest).allowed();
    }

    @Benchmark
    public boolean multiKey() {
        String name = "user:" + ThreadLocalRandom.current().nextInt(1000);
        return store.evaluate(new ThrottleRequest(name, knobs, 1, 0)).allowed();
    }

    @Benchmark
    @Threads(8)
    public boolean parallel() {
        return store.evaluate(hotRequest).allowed();
    }

    @Benchmark
    public void counterIncrement() {
        store.increment("jobs", 60, 5, 1);
    }
}
