package throttle.core.model;

/**
 * Persisted token bucket state of one throttle.
 *
 * @param tokens tokens currently in the bucket
 * @param refreshed start of the current window in epoch seconds, 0 if the bucket was never refilled
 */
public record Bucket(long tokens, long refreshed) {
    public Bucket {
        if (tokens < 0) throw new IllegalArgumentException("tokens < 0");
        if (refreshed < 0) throw new IllegalArgumentException("refreshed < 0");
    }
}
