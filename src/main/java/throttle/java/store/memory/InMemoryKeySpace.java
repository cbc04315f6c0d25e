package throttle.java.store.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Process-local key space with Redis-like value types (hash, float counter, sorted index) and TTLs.
 *
 * <p>Expired keys are dropped lazily when touched; the LRU bound caps memory for keys nobody touches again.
 * Multi-key atomicity is the caller's job: {@link InMemoryThrottleStore} holds a per-key lock around
 * every unit that reads and writes more than one value.
 */
final class InMemoryKeySpace {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryKeySpace.class);

    static final long NO_EXPIRY = Long.MAX_VALUE;
    static final long TTL_MISSING = -2L;
    static final long TTL_NONE = -1L;

    private final LRUCache<String, Entry> entries;

    InMemoryKeySpace(int maxKeys) {
        this.entries = new LRUCache<>(maxKeys, (key, entry) ->
            LOG.debug("Evicted key {} to stay within {} keys", key, maxKeys));
    }

    Optional<Map<String, String>> hash(String key, long nowMicros) {
        Entry entry = live(key, nowMicros);
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(Map.copyOf(entry.as(HashValue.class, key).fields));
    }

    /**
     * Sets the given fields, keeping other fields and the TTL (HSET semantics).
     */
    void putHashFields(String key, Map<String, String> fields, long nowMicros) {
        Entry entry = live(key, nowMicros);
        if (entry == null) {
            entry = new Entry(new HashValue());
            entries.put(key, entry);
        }
        entry.as(HashValue.class, key).fields.putAll(fields);
    }

    /**
     * @return the value after the increment
     */
    double incrementBy(String key, double amount, long nowMicros) {
        Entry entry = live(key, nowMicros);
        if (entry == null) {
            entry = new Entry(new CounterValue());
            entries.put(key, entry);
        }
        CounterValue counter = entry.as(CounterValue.class, key);
        counter.value += amount;
        return counter.value;
    }

    Optional<Double> counter(String key, long nowMicros) {
        Entry entry = live(key, nowMicros);
        return entry == null ? Optional.empty() : Optional.of(entry.as(CounterValue.class, key).value);
    }

    /**
     * The live sorted index stored at {@code key}. Mutations must happen under the caller's lock.
     *
     * @return the index, or null if absent and {@code create} is false
     */
    NavigableSet<Long> index(String key, long nowMicros, boolean create) {
        Entry entry = live(key, nowMicros);
        if (entry == null) {
            if (!create) {
                return null;
            }
            entry = new Entry(new IndexValue());
            entries.put(key, entry);
        }
        return entry.as(IndexValue.class, key).members;
    }

    boolean expire(String key, long seconds, long nowMicros) {
        Entry entry = live(key, nowMicros);
        if (entry == null) {
            return false;
        }
        entry.expiresAtMicros = seconds >= (NO_EXPIRY - nowMicros) / 1_000_000L
            ? NO_EXPIRY - 1
            : nowMicros + seconds * 1_000_000L;
        return true;
    }

    boolean exists(String key, long nowMicros) {
        return live(key, nowMicros) != null;
    }

    boolean delete(String key) {
        return entries.remove(key) != null;
    }

    /**
     * Remaining TTL in whole seconds, {@link #TTL_NONE} without expiry, {@link #TTL_MISSING} if absent.
     */
    long ttlSeconds(String key, long nowMicros) {
        Entry entry = live(key, nowMicros);
        if (entry == null) {
            return TTL_MISSING;
        }
        if (entry.expiresAtMicros == NO_EXPIRY) {
            return TTL_NONE;
        }
        return (entry.expiresAtMicros - nowMicros) / 1_000_000L;
    }

    int size() {
        return entries.size();
    }

    void clear() {
        entries.clear();
    }

    private Entry live(String key, long nowMicros) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.expiresAtMicros <= nowMicros) {
            entries.remove(key, entry);
            return null;
        }
        return entry;
    }

    private static final class Entry {
        private final Object value;
        private volatile long expiresAtMicros = NO_EXPIRY;

        Entry(Object value) {
            this.value = value;
        }

        <T> T as(Class<T> type, String key) {
            if (!type.isInstance(value)) {
                throw new IllegalStateException("WRONGTYPE key " + key + " holds a "
                    + value.getClass().getSimpleName() + ", not a " + type.getSimpleName());
            }
            return type.cast(value);
        }
    }

    private static final class HashValue {
        private final Map<String, String> fields = new LinkedHashMap<>();
    }

    private static final class CounterValue {
        private volatile double value;
    }

    private static final class IndexValue {
        private final NavigableSet<Long> members = new TreeSet<>();
    }
}
