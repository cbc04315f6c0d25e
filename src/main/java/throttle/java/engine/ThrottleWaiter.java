package throttle.java.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import throttle.core.model.ThrottleResult;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Blocks until a throttle allows the request.
 *
 * <p>Each denial sleeps for the returned {@code secondsUntilCapacity} before evaluating again.
 * Without a maximum wait this may block forever, e.g. for a throttle whose knobs deny everything.
 */
public final class ThrottleWaiter {

    private static final Logger LOG = LoggerFactory.getLogger(ThrottleWaiter.class);

    private static final Duration MIN_SLEEP = Duration.ofMillis(1);

    private final Throttles throttles;
    private final Sleeper sleeper;

    public ThrottleWaiter(Throttles throttles) {
        this(throttles, Sleeper.system());
    }

    public ThrottleWaiter(Throttles throttles, Sleeper sleeper) {
        if (throttles == null) throw new IllegalArgumentException("throttles cannot be null");
        if (sleeper == null) throw new IllegalArgumentException("sleeper cannot be null");
        this.throttles = throttles;
        this.sleeper = sleeper;
    }

    /**
     * Waits without limit.
     */
    public ThrottleResult await(String name, ThrottleOptions options) throws InterruptedException {
        return await(name, options, null);
    }

    /**
     * Evaluates until allowed or until {@code maxWait} has been spent sleeping.
     *
     * @param maxWait Upper bound on time spent sleeping, null for none
     * @return The allowing result, or the last rejection when maxWait ran out
     * @throws InterruptedException if interrupted while sleeping
     */
    public ThrottleResult await(String name, ThrottleOptions options, Duration maxWait) throws InterruptedException {
        if (maxWait != null && maxWait.isNegative()) {
            throw new IllegalArgumentException("maxWait must be >= 0");
        }
        Duration waited = Duration.ZERO;
        ThrottleResult result = throttles.throttle(name, options);
        while (!result.allowed()) {
            if (maxWait != null && waited.compareTo(maxWait) >= 0) {
                LOG.debug("Gave up on {} after {}", name, waited);
                break;
            }
            Duration sleep = toDuration(result.secondsUntilCapacity());
            if (maxWait != null && waited.plus(sleep).compareTo(maxWait) > 0) {
                sleep = maxWait.minus(waited);
            }
            sleeper.sleep(sleep);
            waited = waited.plus(sleep);
            result = throttles.throttle(name, options);
        }
        return result;
    }

    static Duration toDuration(BigDecimal seconds) {
        long micros = seconds.movePointRight(6).longValue();
        Duration duration = Duration.ofNanos(micros * 1_000L);
        return duration.compareTo(MIN_SLEEP) < 0 ? MIN_SLEEP : duration;
    }
}
