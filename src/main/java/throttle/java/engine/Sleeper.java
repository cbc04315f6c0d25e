package throttle.java.engine;

import java.time.Duration;

/**
 * Blocks the calling thread. Replaced in tests so waiting loops run instantly.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(Duration duration) throws InterruptedException;

    static Sleeper system() {
        return duration -> Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
    }
}
