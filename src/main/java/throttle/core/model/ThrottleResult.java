package throttle.core.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Outcome of one throttle evaluation.
 *
 * @param decision ALLOW or REJECT
 * @param tokens tokens left in the bucket after this request
 * @param secondsUntilCapacity decimal seconds until the next window boundary, six fractional digits
 */
public record ThrottleResult(
    Decision decision,
    long tokens,
    BigDecimal secondsUntilCapacity
) {
    public static final int SECONDS_SCALE = 6;

    public ThrottleResult {
        if (decision == null) throw new IllegalArgumentException("decision cannot be null");
        if (secondsUntilCapacity == null) throw new IllegalArgumentException("secondsUntilCapacity cannot be null");
        secondsUntilCapacity = secondsUntilCapacity.setScale(SECONDS_SCALE, RoundingMode.HALF_EVEN);
    }

    public static ThrottleResult allow(long tokens, BigDecimal secondsUntilCapacity) {
        return new ThrottleResult(Decision.ALLOW, tokens, secondsUntilCapacity);
    }

    public static ThrottleResult reject(long tokens, BigDecimal secondsUntilCapacity) {
        return new ThrottleResult(Decision.REJECT, tokens, secondsUntilCapacity);
    }

    public boolean allowed() {
        return decision == Decision.ALLOW;
    }
}
