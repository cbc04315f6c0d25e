package throttle.java.config;

import org.junit.jupiter.api.Test;
import throttle.core.model.ThrottleRequest;
import throttle.java.engine.FailurePolicy;
import throttle.java.engine.StoreType;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ThrottleServerConfigTest {

    @Test
    void defaults() {
        ThrottleServerConfig config = ThrottleServerConfig.fromEnv(Map.of());

        assertEquals(9090, config.port());
        assertEquals(StoreType.REDIS, config.storeType());
        assertEquals("redis://localhost:6379", config.redisUrl());
        assertEquals(Duration.ofSeconds(2), config.redisTimeout());
        assertEquals(100_000, config.memoryMaxKeys());
        assertEquals(FailurePolicy.PROPAGATE, config.failurePolicy());
        assertEquals(604_800L, config.knobsTtlSeconds());
        assertFalse(config.persistDefaults());
    }

    @Test
    void readsEveryVariable() {
        Map<String, String> env = Map.of(
            ThrottleEnvKeys.THROTTLE_GRPC_PORT, "7000",
            ThrottleEnvKeys.THROTTLE_STORE, "memory",
            ThrottleEnvKeys.THROTTLE_REDIS_URL, "redis://cache:6380",
            ThrottleEnvKeys.THROTTLE_REDIS_TIMEOUT_MS, "250",
            ThrottleEnvKeys.THROTTLE_MEMORY_MAX_KEYS, "50",
            ThrottleEnvKeys.THROTTLE_FAILURE_POLICY, "fail-open",
            ThrottleEnvKeys.THROTTLE_KNOBS_TTL_SECONDS, "0",
            ThrottleEnvKeys.THROTTLE_PERSIST_DEFAULTS, "true"
        );

        ThrottleServerConfig config = ThrottleServerConfig.fromEnv(env);

        assertEquals(7000, config.port());
        assertEquals(StoreType.MEMORY, config.storeType());
        assertEquals("redis://cache:6380", config.redisUrl());
        assertEquals(Duration.ofMillis(250), config.redisTimeout());
        assertEquals(50, config.memoryMaxKeys());
        assertEquals(FailurePolicy.FAIL_OPEN, config.failurePolicy());
        assertEquals(0L, config.knobsTtlSeconds());
        assertTrue(config.persistDefaults());
    }

    @Test
    void unknownNamesAreRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> ThrottleServerConfig.fromEnv(Map.of(ThrottleEnvKeys.THROTTLE_STORE, "memcached")));
        assertThrows(IllegalArgumentException.class,
            () -> ThrottleServerConfig.fromEnv(Map.of(ThrottleEnvKeys.THROTTLE_FAILURE_POLICY, "maybe")));
    }

    @Test
    void knobsTtl_isClampedToTenYears() {
        ThrottleServerConfig config = ThrottleServerConfig.fromEnv(
            Map.of(ThrottleEnvKeys.THROTTLE_KNOBS_TTL_SECONDS, "10000000000000"));

        assertEquals(ThrottleRequest.MAX_KNOBS_TTL_SECONDS, config.knobsTtlSeconds());
    }
}
