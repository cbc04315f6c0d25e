package throttle.java.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Values of a running counter's live buckets.
 *
 * @param currentBucket bucket index that contains "now"
 * @param buckets bucket index to accumulated value, ascending; expired or missing accumulators read as 0
 * @param total sum of all bucket values
 */
public record CounterCounts(long currentBucket, Map<Long, Double> buckets, double total) {

    public CounterCounts {
        buckets = Collections.unmodifiableMap(new LinkedHashMap<>(buckets));
    }
}
