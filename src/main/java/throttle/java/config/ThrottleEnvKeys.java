package throttle.java.config;

/**
 * Canonical environment variable names read by the throttle server.
 */
public final class ThrottleEnvKeys {
    public static final String THROTTLE_GRPC_PORT = "THROTTLE_GRPC_PORT";

    public static final String THROTTLE_STORE = "THROTTLE_STORE";
    public static final String THROTTLE_REDIS_URL = "THROTTLE_REDIS_URL";
    public static final String THROTTLE_REDIS_TIMEOUT_MS = "THROTTLE_REDIS_TIMEOUT_MS";
    public static final String THROTTLE_MEMORY_MAX_KEYS = "THROTTLE_MEMORY_MAX_KEYS";

    public static final String THROTTLE_FAILURE_POLICY = "THROTTLE_FAILURE_POLICY";
    public static final String THROTTLE_KNOBS_TTL_SECONDS = "THROTTLE_KNOBS_TTL_SECONDS";
    public static final String THROTTLE_PERSIST_DEFAULTS = "THROTTLE_PERSIST_DEFAULTS";

    private ThrottleEnvKeys() {
    }
}
