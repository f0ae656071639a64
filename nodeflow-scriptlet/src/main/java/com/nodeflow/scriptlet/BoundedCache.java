package com.nodeflow.scriptlet;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thread-safe cache holding at most {@code maxEntries}; on overflow the oldest inserted entry is evicted.
 */
final class BoundedCache<K, V> {

    private final int maxEntries;
    private final Map<K, V> entries;

    BoundedCache(int maxEntries) {
        if (maxEntries < 1) throw new IllegalArgumentException("maxEntries must be >= 1");
        this.maxEntries = maxEntries;
        this.entries = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > BoundedCache.this.maxEntries;
            }
        };
    }

    synchronized V get(K key) {
        return entries.get(key);
    }

    synchronized void put(K key, V value) {
        entries.put(key, value);
    }

    synchronized int size() {
        return entries.size();
    }

    synchronized void clear() {
        entries.clear();
    }

    int maxEntries() {
        return maxEntries;
    }
}
