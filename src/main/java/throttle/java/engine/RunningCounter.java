package throttle.java.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import throttle.core.model.CounterBuckets;
import throttle.java.store.ThrottleStore;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Windowed running counters over a shared {@link ThrottleStore}.
 *
 * <p>A counter keeps one accumulator per {@code interval}-second bucket and forgets buckets older
 * than {@code periods} intervals. Counter keys are stored as {@code counter:<key>}.
 */
public final class RunningCounter {

    private static final Logger LOG = LoggerFactory.getLogger(RunningCounter.class);

    private final ThrottleStore store;
    private final String keyPrefix;

    public RunningCounter(ThrottleStore store) {
        this(store, ThrottleDefaults.COUNTER_KEY_PREFIX);
    }

    public RunningCounter(ThrottleStore store, String keyPrefix) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (keyPrefix == null || keyPrefix.isEmpty()) {
            throw new IllegalArgumentException("keyPrefix must not be empty");
        }
        this.store = store;
        this.keyPrefix = keyPrefix;
    }

    public void update(String key, long intervalSeconds, int periods) {
        update(key, intervalSeconds, periods, 1.0);
    }

    /**
     * Adds {@code amount} to the bucket containing "now".
     */
    public void update(String key, long intervalSeconds, int periods, double amount) {
        store.increment(key(key), intervalSeconds, periods, amount);
    }

    /**
     * Live bucket indices, oldest first.
     */
    public CounterBuckets buckets(String key, long intervalSeconds, int periods) {
        return store.buckets(key(key), intervalSeconds, periods);
    }

    /**
     * Reads the value of every live bucket and their sum.
     */
    public CounterCounts counts(String key, long intervalSeconds, int periods) {
        String counterKey = key(key);
        CounterBuckets live = store.buckets(counterKey, intervalSeconds, periods);
        List<String> bucketKeys = live.bucketKeys(counterKey);
        Map<String, Double> values = store.counterValues(bucketKeys);

        Map<Long, Double> counts = new LinkedHashMap<>();
        double total = 0.0;
        for (int i = 0; i < bucketKeys.size(); i++) {
            double value = values.getOrDefault(bucketKeys.get(i), 0.0);
            counts.put(live.liveBuckets().get(i), value);
            total += value;
        }
        LOG.debug("Counter {}: {} live buckets, total {}", counterKey, counts.size(), total);
        return new CounterCounts(live.currentBucket(), counts, total);
    }

    private String key(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key must not be empty");
        }
        return keyPrefix + ":" + key;
    }
}
