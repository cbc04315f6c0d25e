package throttle.java.engine;

/**
 * Supported throttle stores.
 */
public enum StoreType {
    /**
     * Redis with Lua scripts. Shared across processes; time comes from the Redis server.
     */
    REDIS,

    /**
     * Process-local maps with per-key locks. For single-process deployments and tests.
     */
    MEMORY;

    /**
     * Parses a store name case-insensitively.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static StoreType parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("store type cannot be null");
        }
        for (StoreType type : values()) {
            if (type.name().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown store type: " + value);
    }
}
