package throttle.core.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Live buckets of a running counter.
 *
 * @param currentBucket bucket index that contains "now"
 * @param liveBuckets bucket indices still inside the retention horizon, ascending
 */
public record CounterBuckets(long currentBucket, List<Long> liveBuckets) {

    public CounterBuckets {
        liveBuckets = List.copyOf(liveBuckets);
    }

    /**
     * Storage keys of the live accumulators, {@code <key>:<bucket>}.
     */
    public List<String> bucketKeys(String key) {
        List<String> keys = new ArrayList<>(liveBuckets.size());
        for (long bucket : liveBuckets) {
            keys.add(bucketKey(key, bucket));
        }
        return keys;
    }

    public static String bucketKey(String key, long bucket) {
        return key + ":" + bucket;
    }
}
