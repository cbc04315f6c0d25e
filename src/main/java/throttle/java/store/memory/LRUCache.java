package throttle.java.store.memory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * LRU (Least Recently Used) map bounding the in-memory key space.
 *
 * - O(1) get/put/remove
 * - access-order eviction once more than maxSize keys are held
 * - synchronized, so single-key reads and writes are safe without the store's per-key locks
 * - eviction callback for logging
 *
 * @param <K> Key type
 * @param <V> Value type
 */
final class LRUCache<K, V> {

    private final int maxSize;
    private final LinkedHashMap<K, V> map;

    /**
     * @param maxSize Maximum number of entries (must be > 0)
     * @param evictionCallback Invoked when an entry is evicted for space (can be null)
     * @throws IllegalArgumentException if maxSize <= 0
     */
    LRUCache(int maxSize, BiConsumer<K, V> evictionCallback) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }

        this.maxSize = maxSize;
        this.map = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                boolean shouldRemove = size() > LRUCache.this.maxSize;
                if (shouldRemove && evictionCallback != null) {
                    evictionCallback.accept(eldest.getKey(), eldest.getValue());
                }
                return shouldRemove;
            }
        };
    }

    /**
     * Marks the entry as recently used.
     *
     * @return The value, or null if not present
     */
    synchronized V get(K key) {
        return map.get(key);
    }

    /**
     * May evict the least recently used entry.
     *
     * @return The previous value, or null if none
     */
    synchronized V put(K key, V value) {
        return map.put(key, value);
    }

    /**
     * Explicit removal, the eviction callback is not invoked.
     */
    synchronized V remove(K key) {
        return map.remove(key);
    }

    /**
     * Removes {@code key} only while it still maps to {@code value}.
     */
    synchronized boolean remove(K key, V value) {
        return map.remove(key, value);
    }

    synchronized int size() {
        return map.size();
    }

    synchronized void clear() {
        map.clear();
    }
}
