package throttle.core.algorithms.token_bucket;

import throttle.core.clock.ClockReading;
import throttle.core.model.Bucket;
import throttle.core.model.ThrottleMode;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Windowed Token Bucket:
 * - capacity: ceil(rps * burst * window)
 * - refill happens only in whole windows: each elapsed window adds ceil(rps * window) tokens
 * - the window start ("refreshed") advances by whole windows, so the phase set on first use is kept
 *
 * A fresh bucket starts full. A denied request never consumes tokens.
 *
 * Pure computation: the caller reads the stored bucket, calls {@link #check} and persists the result
 * inside one atomic unit of the shared store.
 */
public final class WindowedTokenBucket {
    private final double rps;
    private final double burst;
    private final long window;
    private final long capacity;

    public WindowedTokenBucket(ThrottleMode.RateLimited mode) {
        this.rps = mode.rps();
        this.burst = mode.burst();
        this.window = mode.window();
        this.capacity = (long) Math.ceil(rps * burst * window);
    }

    public BucketCheck check(Optional<Bucket> stored, long now, long requestedTokens) {
        if (requestedTokens <= 0) throw new IllegalArgumentException("requestedTokens <= 0");

        long lastTokens = stored.map(Bucket::tokens).orElse(capacity);
        long lastRefreshed = stored.map(Bucket::refreshed).orElse(0L);

        long age = Math.max(0L, now - lastRefreshed);
        long elapsedWindows = age / window;
        // refill never exceeds capacity, so the sum below cannot overflow
        long addTokens = (long) Math.min(capacity, Math.ceil(elapsedWindows * rps * window));

        long filledTokens = addTokens >= capacity - lastTokens ? capacity : lastTokens + addTokens;
        boolean allowed = filledTokens >= requestedTokens;

        long refreshed;
        if (addTokens > 0 && lastRefreshed == 0) {
            // first refill anchors the window to now
            refreshed = now;
        } else if (addTokens > 0) {
            refreshed = lastRefreshed + elapsedWindows * window;
        } else {
            refreshed = lastRefreshed;
        }

        long newTokens = allowed ? Math.max(0L, filledTokens - requestedTokens) : filledTokens;
        return new BucketCheck(allowed, refreshed, filledTokens, newTokens);
    }

    /**
     * Decimal countdown to the next window boundary, using the store clock's microseconds so that
     * concurrent callers converge on the same wait.
     */
    public BigDecimal secondsUntilCapacity(ClockReading now, long refreshed) {
        long diff = Math.max(0L, now.seconds() - refreshed);
        BigDecimal whole = BigDecimal.valueOf(window - diff - 1);
        BigDecimal fraction = BigDecimal.valueOf(ClockReading.MICROS_PER_SECOND - now.microseconds())
            .movePointLeft(6);
        return whole.add(fraction);
    }

    /**
     * Bucket TTL: twice the useful burst horizon.
     */
    public long ttlSeconds() {
        return (long) Math.ceil(burst * window * 2);
    }

    public long capacity() {
        return capacity;
    }

    /**
     * @param allowed whether the requested tokens fit
     * @param refreshed window start to persist
     * @param filledTokens tokens after refill, before deduction
     * @param newTokens tokens to persist
     */
    public record BucketCheck(boolean allowed, long refreshed, long filledTokens, long newTokens) {
        public Bucket updated() {
            return new Bucket(newTokens, refreshed);
        }
    }
}
