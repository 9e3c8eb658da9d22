package dev.evalset.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Thread-safe cache with a maximum size. When the cache exceeds its capacity, the least recently
 * used entry is evicted.
 *
 * @param <K> Key type
 * @param <V> Value type
 */
@ThreadSafe
class LRUCache<K, V> {
    private final int maxSize;
    private final Map<K, V> cache;

    LRUCache(int maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("cache size must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.cache =
                new LinkedHashMap<K, V>(16, 0.75f, true) {
                    @Override
                    protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                        return size() > LRUCache.this.maxSize;
                    }
                };
    }

    @Nullable
    synchronized V get(K key) {
        return cache.get(key);
    }

    /**
     * Get a value from the cache, or compute and cache it if not present. The supplier runs at most
     * once per key while the entry stays cached. A supplier that throws caches nothing.
     */
    synchronized V getOrCompute(K key, Supplier<V> supplier) {
        V value = cache.get(key);
        if (value == null) {
            value = supplier.get();
            cache.put(key, value);
        }
        return value;
    }

    synchronized void invalidate(K key) {
        cache.remove(key);
    }

    synchronized int size() {
        return cache.size();
    }
}
