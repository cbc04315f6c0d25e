package throttle.core.clock;

/**
 * Source of "now" for the atomic store operations.
 *
 * Readings are epoch based (not monotonic nanos) because bucket timestamps are
 * persisted and compared across processes.
 */
public interface Clock {

    /**
     * @return microseconds since the Unix epoch
     */
    long nowMicros();

    /**
     * Splits the current instant into whole seconds and the microseconds within that second,
     * the same shape Redis TIME returns.
     */
    default ClockReading read() {
        return ClockReading.ofEpochMicros(nowMicros());
    }
}
