package throttle.java.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import throttle.core.clock.ManualClock;
import throttle.core.model.KnobUpdate;
import throttle.core.model.ThrottleResult;
import throttle.java.store.memory.InMemoryThrottleStore;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ThrottleWaiterTest {

    private ManualClock clock;
    private Throttles throttles;
    private List<Duration> sleeps;
    private ThrottleWaiter waiter;

    @BeforeEach
    void setUp() {
        clock = ManualClock.atSeconds(1000, 0);
        throttles = new Throttles(new InMemoryThrottleStore(clock, 100), FailurePolicy.PROPAGATE, false);
        sleeps = new ArrayList<>();
        // sleeping moves the store clock instead of blocking
        waiter = new ThrottleWaiter(throttles, duration -> {
            sleeps.add(duration);
            clock.advanceMicros(duration.toNanos() / 1_000L);
        });
    }

    @Test
    void returnsImmediately_whenAllowed() throws InterruptedException {
        ThrottleResult result = waiter.await("t", ThrottleOptions.of(1));

        assertTrue(result.allowed());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void sleepsUntilNextWindow_thenAllows() throws InterruptedException {
        ThrottleOptions options = ThrottleOptions.of(1); // capacity 5 per 5s window
        for (int i = 0; i < 5; i++) {
            assertTrue(throttles.throttle("t", options).allowed());
        }

        ThrottleResult result = waiter.await("t", options);

        assertTrue(result.allowed());
        assertEquals(List.of(Duration.ofSeconds(5)), sleeps);
        assertEquals(4, result.tokens());
    }

    @Test
    void givesUpAfterMaxWait() throws InterruptedException {
        throttles.set("t", new KnobUpdate(0.0, 1.0, 5L, null));

        ThrottleResult result = waiter.await("t", ThrottleOptions.of(10), Duration.ofSeconds(12));

        assertFalse(result.allowed());
        assertEquals(List.of(Duration.ofSeconds(5), Duration.ofSeconds(5), Duration.ofSeconds(2)), sleeps);
    }

    @Test
    void zeroMaxWait_evaluatesOnce() throws InterruptedException {
        throttles.set("t", new KnobUpdate(0.0, 1.0, 5L, null));

        ThrottleResult result = waiter.await("t", ThrottleOptions.of(10), Duration.ZERO);

        assertFalse(result.allowed());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void toDuration_keepsMicrosAndHasFloor() {
        assertEquals(Duration.ofNanos(7_999_999_000L), ThrottleWaiter.toDuration(new BigDecimal("7.999999")));
        assertEquals(Duration.ofMillis(1), ThrottleWaiter.toDuration(new BigDecimal("0.000000")));
    }
}
