package throttle.core.model;

/**
 * Operator change to a throttle's knobs. Null fields are left as stored, but must already exist.
 *
 * @param rps new rate; >= 0, or -1 for unlimited
 * @param burst new burst multiplier, > 0
 * @param window new window in seconds, > 0
 * @param ttlSeconds TTL for the knobs record, null or 0 leaves it alone
 */
public record KnobUpdate(Double rps, Double burst, Long window, Long ttlSeconds) {

    public KnobUpdate {
        if (rps != null && (!Double.isFinite(rps) || (rps < 0 && rps != Knobs.RPS_ALLOW_ALL))) {
            throw new IllegalArgumentException("\"" + rps + "\" is not a valid rps. Use a value >= 0, or -1 for unlimited");
        }
        if (burst != null && !(burst > 0 && Double.isFinite(burst))) {
            throw new IllegalArgumentException("\"" + burst + "\" is not a valid burst. Burst must be > 0");
        }
        if (window != null && window <= 0) {
            throw new IllegalArgumentException("\"" + window + "\" is not a valid window. Window must be > 0");
        }
        if (ttlSeconds != null && (ttlSeconds < 0 || ttlSeconds > ThrottleRequest.MAX_KNOBS_TTL_SECONDS)) {
            throw new IllegalArgumentException("ttlSeconds must be in [0, " + ThrottleRequest.MAX_KNOBS_TTL_SECONDS + "]");
        }
    }

    public static KnobUpdate of(Knobs knobs) {
        return new KnobUpdate(knobs.rps(), knobs.burst(), knobs.window(), null);
    }

    public KnobUpdate withTtl(long seconds) {
        return new KnobUpdate(rps, burst, window, seconds);
    }

    public boolean hasTtl() {
        return ttlSeconds != null && ttlSeconds > 0;
    }
}
