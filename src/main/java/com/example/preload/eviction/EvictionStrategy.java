package com.example.preload.eviction;

import java.util.List;

// Not thread-safe; the cache calls it under its own lock.
public interface EvictionStrategy<K> {
    void onInsert(K key);
    void onRemove(K key);

    /** Up to {@code count} victims, most evictable first. Does not remove them. */
    List<K> selectVictims(int count);

    void clear();
}
