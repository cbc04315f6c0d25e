package throttle.java.engine;

import throttle.core.model.Knobs;
import throttle.core.model.ThrottleRequest;

/**
 * Per-call throttle settings. The rate, burst and window act as defaults and are overridden by stored knobs.
 *
 * @param rps requests per second; 0 denies everything, -1 allows everything
 * @param burst burst multiplier
 * @param window window in seconds
 * @param requestedTokens tokens consumed by an allowed request
 * @param knobsTtlSeconds TTL refreshed on stored knobs at every call, 0 leaves it alone
 */
public record ThrottleOptions(
    double rps,
    double burst,
    long window,
    long requestedTokens,
    long knobsTtlSeconds
) {
    public ThrottleOptions {
        if (requestedTokens <= 0) throw new IllegalArgumentException("requestedTokens must be > 0");
        if (knobsTtlSeconds < 0 || knobsTtlSeconds > ThrottleRequest.MAX_KNOBS_TTL_SECONDS) {
            throw new IllegalArgumentException("knobsTtlSeconds must be in [0, " + ThrottleRequest.MAX_KNOBS_TTL_SECONDS + "]");
        }
    }

    /**
     * Options with every setting but the rate at its default.
     */
    public static ThrottleOptions of(double rps) {
        return new ThrottleOptions(
            rps,
            ThrottleDefaults.BURST,
            ThrottleDefaults.WINDOW_SECONDS,
            ThrottleDefaults.REQUESTED_TOKENS,
            ThrottleDefaults.KNOBS_TTL_SECONDS
        );
    }

    public ThrottleOptions withBurst(double burst) {
        return new ThrottleOptions(rps, burst, window, requestedTokens, knobsTtlSeconds);
    }

    public ThrottleOptions withWindow(long window) {
        return new ThrottleOptions(rps, burst, window, requestedTokens, knobsTtlSeconds);
    }

    public ThrottleOptions withRequestedTokens(long requestedTokens) {
        return new ThrottleOptions(rps, burst, window, requestedTokens, knobsTtlSeconds);
    }

    public ThrottleOptions withKnobsTtl(long knobsTtlSeconds) {
        return new ThrottleOptions(rps, burst, window, requestedTokens, knobsTtlSeconds);
    }

    public Knobs knobs() {
        return new Knobs(rps, burst, window);
    }
}
