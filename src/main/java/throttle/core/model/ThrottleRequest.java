package throttle.core.model;

/**
 * Arguments of one throttle evaluation.
 *
 * @param name storage key of the throttle bucket; knobs live at {@code name + ":knobs"}
 * @param defaults knobs used when none are stored for this throttle
 * @param requestedTokens tokens deducted when the request is allowed
 * @param knobsTtlSeconds TTL applied to stored knobs on read, 0 leaves their TTL alone
 */
public record ThrottleRequest(
    String name,
    Knobs defaults,
    long requestedTokens,
    long knobsTtlSeconds
) {
    public static final String KNOBS_SUFFIX = ":knobs";

    /**
     * Upper bound for any knobs TTL: ten years.
     */
    public static final long MAX_KNOBS_TTL_SECONDS = 10L * 365 * 24 * 60 * 60;

    public ThrottleRequest {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("name must not be empty");
        if (defaults == null) throw new IllegalArgumentException("defaults cannot be null");
        if (requestedTokens <= 0) throw new IllegalArgumentException("requestedTokens must be > 0");
        if (knobsTtlSeconds < 0 || knobsTtlSeconds > MAX_KNOBS_TTL_SECONDS) {
            throw new IllegalArgumentException("knobsTtlSeconds must be in [0, " + MAX_KNOBS_TTL_SECONDS + "]");
        }
    }

    public String knobsKey() {
        return knobsKey(name);
    }

    public static String knobsKey(String name) {
        return name + KNOBS_SUFFIX;
    }
}
