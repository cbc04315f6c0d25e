package throttle.core.model;

/**
 * Effective behaviour of a throttle for one evaluation, resolved once from its knobs.
 */
public sealed interface ThrottleMode permits ThrottleMode.Denied, ThrottleMode.Unlimited, ThrottleMode.RateLimited {

    /**
     * rps == 0: every request is denied and told to wait a full window.
     */
    record Denied(long window) implements ThrottleMode {
    }

    /**
     * rps == -1: every request is allowed.
     */
    record Unlimited() implements ThrottleMode {
    }

    /**
     * Regular token bucket.
     */
    record RateLimited(double rps, double burst, long window) implements ThrottleMode {
        public RateLimited {
            if (window <= 0) {
                throw new InvalidConfigurationException("window must be > 0, got: " + window);
            }
            if (!Double.isFinite(burst) || burst <= 0) {
                throw new InvalidConfigurationException("burst must be > 0, got: " + burst);
            }
            if (!Double.isFinite(rps) || rps < 0) {
                throw new InvalidConfigurationException("rps must be a finite value >= 0, 0 or -1, got: " + rps);
            }
        }
    }

    static ThrottleMode of(Knobs knobs) {
        if (knobs.rps() == Knobs.RPS_DENY_ALL) {
            return new Denied(knobs.window());
        }
        if (knobs.rps() == Knobs.RPS_ALLOW_ALL) {
            return new Unlimited();
        }
        return new RateLimited(knobs.rps(), knobs.burst(), knobs.window());
    }
}
