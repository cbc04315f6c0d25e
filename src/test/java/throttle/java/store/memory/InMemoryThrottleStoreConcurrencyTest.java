package throttle.java.store.memory;

import org.junit.jupiter.api.Test;
import throttle.core.clock.ManualClock;
import throttle.core.model.Knobs;
import throttle.core.model.ThrottleRequest;

import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrency tests for InMemoryThrottleStore.
 *
 * Focus:
 * - No lost updates when many threads evaluate the same throttle
 * - Independent throttles do not interfere
 * - Counter increments are never lost
 */
class InMemoryThrottleStoreConcurrencyTest {

    @Test
    void testConcurrent_sameThrottleNeverOverAllows() throws InterruptedException {
        ManualClock clock = ManualClock.atSeconds(1000, 0);
        InMemoryThrottleStore store = new InMemoryThrottleStore(clock, 1000);
        ThrottleRequest request = new ThrottleRequest("shared", new Knobs(10, 1, 10), 1, 0); // capacity 100

        int numThreads = 10;
        int callsPerThread = 20;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);
        AtomicInteger allowCount = new AtomicInteger(0);
        AtomicInteger rejectCount = new AtomicInteger(0);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        for (int i = 0; i < numThreads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int j = 0; j < callsPerThread; j++) {
                        if (store.evaluate(request).allowed()) {
                            allowCount.incrementAndGet();
                        } else {
                            rejectCount.incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(5, TimeUnit.SECONDS), "Test timed out");
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS), "Executor did not terminate");

        assertEquals(100, allowCount.get());
        assertEquals(100, rejectCount.get());
        assertEquals(0L, store.snapshot("shared").tokens());
    }

    @Test
    void testConcurrent_distinctThrottlesAreIsolated() throws InterruptedException {
        ManualClock clock = ManualClock.atSeconds(1000, 0);
        InMemoryThrottleStore store = new InMemoryThrottleStore(clock, 1000);

        int numKeys = 8;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numKeys);
        ConcurrentHashMap<String, AtomicInteger> allowed = new ConcurrentHashMap<>();

        ExecutorService executor = Executors.newFixedThreadPool(numKeys);
        for (int i = 0; i < numKeys; i++) {
            String name = "key" + i;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    ThrottleRequest request = new ThrottleRequest(name, new Knobs(5, 1, 2), 1, 0); // capacity 10
                    for (int j = 0; j < 25; j++) {
                        if (store.evaluate(request).allowed()) {
                            allowed.computeIfAbsent(name, k -> new AtomicInteger()).incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(5, TimeUnit.SECONDS), "Test timed out");
        executor.shutdown();

        assertEquals(numKeys, allowed.size());
        allowed.values().forEach(count -> assertEquals(10, count.get()));
    }

    @Test
    void testConcurrent_counterIncrementsAreNotLost() throws InterruptedException {
        ManualClock clock = ManualClock.atSeconds(1000, 0);
        InMemoryThrottleStore store = new InMemoryThrottleStore(clock, 1000);

        int numThreads = 8;
        int incrementsPerThread = 500;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        for (int i = 0; i < numThreads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int j = 0; j < incrementsPerThread; j++) {
                        store.increment("jobs", 60, 5, 1);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS), "Test timed out");
        executor.shutdown();

        assertEquals(List.of(16L), store.buckets("jobs", 60, 5).liveBuckets());
        assertEquals(4000.0, store.counterValues(List.of("jobs:16")).get("jobs:16").doubleValue(), 1e-9);
    }
}
