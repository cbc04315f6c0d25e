package throttle.core.clock;

/**
 * One clock sample: whole epoch seconds plus the microseconds elapsed within that second.
 */
public record ClockReading(long seconds, long microseconds) {

    public static final long MICROS_PER_SECOND = 1_000_000L;

    public ClockReading {
        if (seconds < 0) throw new IllegalArgumentException("seconds < 0");
        if (microseconds < 0 || microseconds >= MICROS_PER_SECOND) {
            throw new IllegalArgumentException("microseconds out of range: " + microseconds);
        }
    }

    public static ClockReading ofEpochMicros(long epochMicros) {
        return new ClockReading(
            Math.floorDiv(epochMicros, MICROS_PER_SECOND),
            Math.floorMod(epochMicros, MICROS_PER_SECOND)
        );
    }
}
