package throttle.java.engine;

import java.time.Duration;

/**
 * Values applied when a caller leaves a throttle or counter setting out.
 */
public final class ThrottleDefaults {

    public static final double BURST = 1.0;
    public static final long WINDOW_SECONDS = 5L;
    public static final long REQUESTED_TOKENS = 1L;
    public static final long KNOBS_TTL_SECONDS = Duration.ofDays(7).toSeconds();

    public static final String THROTTLE_KEY_PREFIX = "throttle:";
    public static final String COUNTER_KEY_PREFIX = "counter";

    private ThrottleDefaults() {
        // Constants only
    }
}
