package throttle.java.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import throttle.core.model.ThrottleRequest;
import throttle.java.engine.FailurePolicy;
import throttle.java.engine.StoreType;
import throttle.java.engine.ThrottleDefaults;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Runtime settings of the throttle server.
 *
 * @param port gRPC listen port
 * @param storeType backing store
 * @param redisUrl Redis connection string, used with {@link StoreType#REDIS}
 * @param redisTimeout maximum wait for one Redis round trip
 * @param memoryMaxKeys key limit of the in-memory store before LRU eviction
 * @param failurePolicy behaviour of Evaluate while the store is unavailable
 * @param knobsTtlSeconds knobs TTL used when a request does not carry one
 * @param persistDefaults whether request defaults are stored as knobs when none exist
 */
public record ThrottleServerConfig(
    int port,
    StoreType storeType,
    String redisUrl,
    Duration redisTimeout,
    int memoryMaxKeys,
    FailurePolicy failurePolicy,
    long knobsTtlSeconds,
    boolean persistDefaults
) {
    private static final Logger LOG = LoggerFactory.getLogger(ThrottleServerConfig.class);

    public static final int DEFAULT_PORT = 9090;
    public static final String DEFAULT_REDIS_URL = "redis://localhost:6379";
    public static final int DEFAULT_REDIS_TIMEOUT_MS = 2000;
    public static final int DEFAULT_MEMORY_MAX_KEYS = 100_000;

    public ThrottleServerConfig {
        if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
        if (storeType == null) throw new IllegalArgumentException("storeType cannot be null");
        if (redisUrl == null || redisUrl.isBlank()) throw new IllegalArgumentException("redisUrl must not be empty");
        if (redisTimeout == null || redisTimeout.isZero() || redisTimeout.isNegative()) {
            throw new IllegalArgumentException("redisTimeout must be > 0");
        }
        if (memoryMaxKeys <= 0) throw new IllegalArgumentException("memoryMaxKeys must be > 0");
        if (failurePolicy == null) throw new IllegalArgumentException("failurePolicy cannot be null");
        if (knobsTtlSeconds < 0 || knobsTtlSeconds > ThrottleRequest.MAX_KNOBS_TTL_SECONDS) {
            throw new IllegalArgumentException("knobsTtlSeconds must be in [0, " + ThrottleRequest.MAX_KNOBS_TTL_SECONDS + "]");
        }
    }

    public static ThrottleServerConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * Reads the configuration from an environment map.
     *
     * @throws IllegalArgumentException if the store type or failure policy names are unknown
     */
    public static ThrottleServerConfig fromEnv(Map<String, String> env) {
        ThrottleServerConfig config = new ThrottleServerConfig(
            EnvVars.getIntClamped(env, ThrottleEnvKeys.THROTTLE_GRPC_PORT, DEFAULT_PORT, 0, 65535),
            StoreType.parse(EnvVars.getOrDefault(env, ThrottleEnvKeys.THROTTLE_STORE, StoreType.REDIS.name())),
            EnvVars.getOrDefault(env, ThrottleEnvKeys.THROTTLE_REDIS_URL, DEFAULT_REDIS_URL),
            Duration.ofMillis(EnvVars.getIntClamped(
                env, ThrottleEnvKeys.THROTTLE_REDIS_TIMEOUT_MS, DEFAULT_REDIS_TIMEOUT_MS, 1, 60_000)),
            EnvVars.getIntClamped(
                env, ThrottleEnvKeys.THROTTLE_MEMORY_MAX_KEYS, DEFAULT_MEMORY_MAX_KEYS, 1, Integer.MAX_VALUE),
            parsePolicy(EnvVars.getOrDefault(env, ThrottleEnvKeys.THROTTLE_FAILURE_POLICY, FailurePolicy.PROPAGATE.name())),
            EnvVars.getLongClamped(
                env, ThrottleEnvKeys.THROTTLE_KNOBS_TTL_SECONDS, ThrottleDefaults.KNOBS_TTL_SECONDS, 0, ThrottleRequest.MAX_KNOBS_TTL_SECONDS),
            EnvVars.getBoolean(env, ThrottleEnvKeys.THROTTLE_PERSIST_DEFAULTS, false)
        );
        LOG.debug("Loaded {}", config);
        return config;
    }

    private static FailurePolicy parsePolicy(String value) {
        try {
            return FailurePolicy.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown failure policy: " + value, e);
        }
    }
}
