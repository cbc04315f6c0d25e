package throttle.core.model;

/**
 * Raw stored values of one throttle. Any field is null when it is not stored.
 */
public record ThrottleSnapshot(
    Long tokens,
    Long refreshed,
    Double rps,
    Double burst,
    Long window
) {
    public static ThrottleSnapshot empty() {
        return new ThrottleSnapshot(null, null, null, null, null);
    }

    public boolean hasKnobs() {
        return rps != null || burst != null || window != null;
    }
}
