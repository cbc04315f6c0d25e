package throttle.core.model;

/**
 * Tunable settings of a throttle: rate, burst multiplier and window.
 *
 * <p>The same record carries caller defaults and the values stored under {@code <name>:knobs}.
 * Values are not validated here because an operator may write anything into the store;
 * {@link ThrottleMode#of(Knobs)} decides what they mean.
 *
 * @param rps requests per second; 0 always denies, -1 always allows
 * @param burst burst multiplier
 * @param window window size in seconds
 */
public record Knobs(double rps, double burst, long window) {

    public static final double RPS_DENY_ALL = 0;
    public static final double RPS_ALLOW_ALL = -1;

    public static final String FIELD_RPS = "rps";
    public static final String FIELD_BURST = "burst";
    public static final String FIELD_WINDOW = "window";
}
