package throttle.core.algorithms.running_counter;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableSet;

/**
 * Running Counter window arithmetic:
 * - time is cut into fixed buckets of {@code interval} seconds, addressed by floor(now / interval)
 * - a counter keeps {@code periods} buckets; anything at or below current - periods is outside the horizon
 * - accumulators and the bucket index expire together after periods * interval + 60 seconds
 *
 * The extra minute lets readers that just listed the live buckets still fetch their values.
 */
public final class CounterWindow {

    public static final long READ_GRACE_SECONDS = 60L;

    private final long interval;
    private final int periods;

    public CounterWindow(long intervalSeconds, int periods) {
        if (intervalSeconds <= 0) throw new IllegalArgumentException("interval must be > 0");
        if (periods <= 0) throw new IllegalArgumentException("periods must be > 0");
        this.interval = intervalSeconds;
        this.periods = periods;
    }

    public long bucketAt(long nowSeconds) {
        return Math.floorDiv(nowSeconds, interval);
    }

    /**
     * Highest bucket index that is already outside the retention horizon.
     */
    public long maxExpiredBucket(long currentBucket) {
        return currentBucket - periods;
    }

    /**
     * Removes every index at or below the horizon from {@code index}.
     *
     * @return the pruned indices
     */
    public List<Long> prune(NavigableSet<Long> index, long currentBucket) {
        NavigableSet<Long> expired = index.headSet(maxExpiredBucket(currentBucket), true);
        List<Long> removed = new ArrayList<>(expired);
        expired.clear();
        return removed;
    }

    public long expirySeconds() {
        return periods * interval + READ_GRACE_SECONDS;
    }

    public long interval() {
        return interval;
    }

    public int periods() {
        return periods;
    }
}
