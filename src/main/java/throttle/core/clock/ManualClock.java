package throttle.core.clock;

public final class ManualClock implements Clock {
    private volatile long nowMicros;

    public ManualClock(long startMicros) {
        this.nowMicros = startMicros;
    }

    public static ManualClock atSeconds(long seconds, long microseconds) {
        return new ManualClock(seconds * ClockReading.MICROS_PER_SECOND + microseconds);
    }

    @Override
    public long nowMicros() {
        return nowMicros;
    }

    public synchronized void advanceMicros(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        nowMicros += delta;
    }

    public void advanceSeconds(long seconds) {
        advanceMicros(seconds * ClockReading.MICROS_PER_SECOND);
    }

    public void setMicros(long value) {
        nowMicros = value;
    }

    public void set(long seconds, long microseconds) {
        setMicros(seconds * ClockReading.MICROS_PER_SECOND + microseconds);
    }
}
