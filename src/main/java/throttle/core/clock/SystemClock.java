package throttle.core.clock;

import java.time.Instant;

/**
 * Wall clock of the local process.
 * Only the in-memory store uses it: within one JVM it is the shared clock every caller sees.
 */
public final class SystemClock implements Clock {
    private static final SystemClock INSTANCE = new SystemClock();

    public static SystemClock instance() {
        return INSTANCE;
    }

    @Override
    public long nowMicros() {
        Instant now = Instant.now();
        return now.getEpochSecond() * ClockReading.MICROS_PER_SECOND + now.getNano() / 1_000L;
    }
}
