package throttle.core.algorithms.token_bucket;

import throttle.core.clock.ClockReading;
import throttle.core.model.Bucket;
import throttle.core.model.Knobs;
import throttle.core.model.ThrottleMode;
import throttle.core.model.ThrottleResult;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Full throttle evaluation on already-loaded state: sentinel short-circuits, then the windowed token bucket.
 *
 * <p>Stores call this while holding their atomic unit open; the returned {@link Evaluation} says what
 * (if anything) must be written back.
 */
public final class ThrottleEvaluator {

    private ThrottleEvaluator() {
        // Utility class, no instantiation
    }

    public static Evaluation evaluate(Knobs effective, Optional<Bucket> stored, ClockReading now, long requestedTokens) {
        ThrottleMode mode = ThrottleMode.of(effective);

        if (mode instanceof ThrottleMode.Denied denied) {
            return Evaluation.untouched(ThrottleResult.reject(0, BigDecimal.valueOf(denied.window())));
        }
        if (mode instanceof ThrottleMode.Unlimited) {
            return Evaluation.untouched(ThrottleResult.allow(1, BigDecimal.ZERO));
        }

        WindowedTokenBucket bucket = new WindowedTokenBucket((ThrottleMode.RateLimited) mode);
        WindowedTokenBucket.BucketCheck check = bucket.check(stored, now.seconds(), requestedTokens);
        BigDecimal seconds = bucket.secondsUntilCapacity(now, check.refreshed());

        ThrottleResult result = check.allowed()
            ? ThrottleResult.allow(check.newTokens(), seconds)
            : ThrottleResult.reject(check.newTokens(), seconds);
        return new Evaluation(result, Optional.of(check.updated()), bucket.ttlSeconds());
    }

    /**
     * @param result decision returned to the caller
     * @param updatedBucket bucket to persist, empty on the sentinel paths
     * @param bucketTtlSeconds TTL to set on the persisted bucket
     */
    public record Evaluation(ThrottleResult result, Optional<Bucket> updatedBucket, long bucketTtlSeconds) {
        static Evaluation untouched(ThrottleResult result) {
            return new Evaluation(result, Optional.empty(), 0L);
        }
    }
}
