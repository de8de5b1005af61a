package com.example.preload.eviction;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Oldest-inserted-first eviction. Reads never change the order, so this is FIFO rather than LRU.
 */
public class InsertionOrderEvictionStrategy<K> implements EvictionStrategy<K> {

    // Iteration order is insertion order; re-inserting a present key keeps its original slot.
    private final LinkedHashSet<K> order = new LinkedHashSet<>();

    @Override
    public void onInsert(K key) {
        order.add(key);
    }

    @Override
    public void onRemove(K key) {
        order.remove(key);
    }

    @Override
    public List<K> selectVictims(int count) {
        List<K> victims = new ArrayList<>(Math.max(count, 0));
        Iterator<K> it = order.iterator();
        while (victims.size() < count && it.hasNext()) {
            victims.add(it.next());
        }
        return victims;
    }

    @Override
    public void clear() {
        order.clear();
    }

    public int size() {
        return order.size();
    }
}
