package com.example.preload.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

// Updated without the cache lock, so a snapshot may be slightly torn across counters.
public class CacheStats {

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong loadsStarted = new AtomicLong();
    private final AtomicLong deduplicated = new AtomicLong();
    private final AtomicLong loadSuccesses = new AtomicLong();
    private final AtomicLong loadFailures = new AtomicLong();
    private final AtomicLong timeouts = new AtomicLong();
    private final AtomicLong cancellations = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    void recordHit() {
        hits.incrementAndGet();
    }

    void recordMiss() {
        misses.incrementAndGet();
    }

    void recordLoadStarted() {
        loadsStarted.incrementAndGet();
    }

    void recordDeduplicated() {
        deduplicated.incrementAndGet();
    }

    void recordSuccess() {
        loadSuccesses.incrementAndGet();
    }

    // Timeouts count as failures too.
    void recordFailure(boolean timedOut) {
        loadFailures.incrementAndGet();
        if (timedOut) {
            timeouts.incrementAndGet();
        }
    }

    void recordCancelled() {
        cancellations.incrementAndGet();
    }

    void recordEvictions(int count) {
        evictions.addAndGet(count);
    }

    public long getHits() {
        return hits.get();
    }

    public long getMisses() {
        return misses.get();
    }

    public long getLoadsStarted() {
        return loadsStarted.get();
    }

    public long getDeduplicated() {
        return deduplicated.get();
    }

    public long getLoadSuccesses() {
        return loadSuccesses.get();
    }

    public long getLoadFailures() {
        return loadFailures.get();
    }

    public long getTimeouts() {
        return timeouts.get();
    }

    public long getCancellations() {
        return cancellations.get();
    }

    public long getEvictions() {
        return evictions.get();
    }

    public double hitRatio() {
        long h = hits.get();
        long total = h + misses.get();
        return total == 0 ? 0.0 : (double) h / total;
    }

    public Map<String, Object> snapshot() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("hits", getHits());
        out.put("misses", getMisses());
        out.put("hitRatio", hitRatio());
        out.put("loadsStarted", getLoadsStarted());
        out.put("deduplicated", getDeduplicated());
        out.put("loadSuccesses", getLoadSuccesses());
        out.put("loadFailures", getLoadFailures());
        out.put("timeouts", getTimeouts());
        out.put("cancellations", getCancellations());
        out.put("evictions", getEvictions());
        return Map.copyOf(out);
    }

    void reset() {
        hits.set(0);
        misses.set(0);
        loadsStarted.set(0);
        deduplicated.set(0);
        loadSuccesses.set(0);
        loadFailures.set(0);
        timeouts.set(0);
        cancellations.set(0);
        evictions.set(0);
    }

    @Override
    public String toString() {
        return "CacheStats" + snapshot();
    }
}
