package throttle.java.engine;

import throttle.core.clock.SystemClock;
import throttle.java.config.ThrottleServerConfig;
import throttle.java.store.ThrottleStore;
import throttle.java.store.memory.InMemoryThrottleStore;
import throttle.java.store.redis.RedisThrottleStore;

/**
 * Creates the {@link ThrottleStore} selected by configuration.
 *
 * Thread-safety: This class is stateless and thread-safe.
 */
public final class ThrottleStoreFactory {

    private ThrottleStoreFactory() {
        // Utility class, no instantiation
    }

    /**
     * @param config Server configuration naming the store and its settings
     * @return A new store; the caller owns it and must close it
     */
    public static ThrottleStore create(ThrottleServerConfig config) {
        if (config == null) throw new IllegalArgumentException("config cannot be null");

        return switch (config.storeType()) {
            case REDIS -> RedisThrottleStore.connect(config.redisUrl(), config.redisTimeout());
            case MEMORY -> new InMemoryThrottleStore(SystemClock.instance(), config.memoryMaxKeys());
        };
    }
}
