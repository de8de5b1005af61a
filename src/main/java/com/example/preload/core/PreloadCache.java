package com.example.preload.core;

import com.example.preload.eviction.EvictionStrategy;
import com.example.preload.eviction.InsertionOrderEvictionStrategy;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Capacity-bounded cache that assembles per-key values in the background ahead of use.
 *
 * <p>Every key moves through {@link LoadStatus}: absent or {@code NOT_STARTED}, then {@code LOADING}, then
 * {@code COMPLETED} or {@code FAILED}. Only completed keys hold a value. When a successful load pushes the
 * number of values over capacity, the oldest-inserted values are evicted together with their status.
 * Failed statuses are kept for at most {@code capacity} keys as well, oldest failure dropped first.
 *
 * <p>Load errors are never thrown to callers. They are recorded in the key's status, and nothing is retried
 * until someone calls {@link #preload} again.
 *
 * <p>All maps are guarded by one lock. Assemblers run on the cache executor, off that lock. The
 * {@link PreloadCacheSettings#getLoadTimeout() timeout} starts when the assembler starts, so time spent
 * waiting for an executor thread does not count against it. A load settles into the maps only while it is
 * still the registered in-flight load for its key, so an {@link #invalidate} or {@link #clear} issued
 * mid-flight always wins over the late result.
 */
public class PreloadCache<K, V> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PreloadCache.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<K, PreloadEntry<V>> entries = new HashMap<>();
    private final Map<K, LoadStatus> statuses = new HashMap<>();
    private final Map<K, InFlightLoad> inFlight = new HashMap<>();

    private final EvictionStrategy<K> evictionStrategy;
    private final EvictionStrategy<K> failureOrder = new InsertionOrderEvictionStrategy<>();
    private final PreloadCacheSettings settings;
    private final ExecutorService executor;
    private final boolean ownsExecutor;
    private final CacheStats stats = new CacheStats();

    public PreloadCache(PreloadCacheSettings settings) {
        this(settings, newAssemblerPool(settings.getExecutorThreads()), true, new InsertionOrderEvictionStrategy<>());
    }

    /** Runs assemblers on {@code executor}, which the caller keeps ownership of. */
    public PreloadCache(PreloadCacheSettings settings, ExecutorService executor) {
        this(settings, executor, false, new InsertionOrderEvictionStrategy<>());
    }

    PreloadCache(
        PreloadCacheSettings settings,
        ExecutorService executor,
        boolean ownsExecutor,
        EvictionStrategy<K> evictionStrategy
    ) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.ownsExecutor = ownsExecutor;
        this.evictionStrategy = Objects.requireNonNull(evictionStrategy, "evictionStrategy");
    }

    /**
     * Starts loading {@code key} unless it is already loading or completed.
     *
     * @return a future that completes, never exceptionally, once the load for this key settles. A caller
     *     that arrives while the key is loading gets the in-flight load's future.
     */
    public CompletableFuture<Void> preload(K key, Assembler<K, V> assembler) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(assembler, "assembler");

        InFlightLoad load;
        lock.lock();
        try {
            InFlightLoad existing = inFlight.get(key);
            if (existing != null) {
                stats.recordDeduplicated();
                log.debug("Load already in flight, attaching. key={}", key);
                return existing.settled.copy();
            }
            if (statusOf(key).isCompleted()) {
                return CompletableFuture.completedFuture(null);
            }
            load = register(key);
        } finally {
            lock.unlock();
        }

        start(load, assembler);
        return load.settled.copy();
    }

    /**
     * Preloads at most {@code batchWidth} of {@code keys} concurrently: the first ones, in the given order,
     * that are neither loading nor completed. The rest are not queued; call again to pick them up.
     *
     * @return a future that completes once every scheduled load has settled
     */
    public CompletableFuture<Void> preloadBatch(List<K> keys, Assembler<K, V> assembler) {
        return startBatch(keys, assembler).completion();
    }

    /**
     * Same as {@link #preloadBatch}, also reporting which keys this call scheduled. Selection and the move
     * to {@code LOADING} happen under one lock acquisition.
     */
    public ScheduledBatch<K> startBatch(List<K> keys, Assembler<K, V> assembler) {
        Objects.requireNonNull(keys, "keys");
        Objects.requireNonNull(assembler, "assembler");

        List<InFlightLoad> batch = new ArrayList<>(settings.getBatchWidth());
        lock.lock();
        try {
            for (K key : eligible(keys)) {
                batch.add(register(key));
            }
        } finally {
            lock.unlock();
        }
        if (batch.isEmpty()) {
            return new ScheduledBatch<>(List.of(), CompletableFuture.completedFuture(null));
        }
        log.debug("Preloading batch of {} from {} requested keys", batch.size(), keys.size());

        List<K> scheduled = new ArrayList<>(batch.size());
        CompletableFuture<?>[] loads = new CompletableFuture<?>[batch.size()];
        for (int i = 0; i < batch.size(); i++) {
            InFlightLoad load = batch.get(i);
            start(load, assembler);
            scheduled.add(load.key);
            loads[i] = load.settled.copy();
        }
        return new ScheduledBatch<>(scheduled, CompletableFuture.allOf(loads));
    }

    /**
     * Keys that a {@link #preloadBatch} call with {@code keys} would schedule right now.
     */
    public List<K> selectBatch(List<K> keys) {
        Objects.requireNonNull(keys, "keys");
        lock.lock();
        try {
            return eligible(keys);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the cached value if {@code key} is completed. Otherwise returns a fresh placeholder from
     * {@code placeholderFactory} and starts a background load.
     *
     * <p>The placeholder is never filled in. Once {@link #isReady} turns true, callers re-query by key to
     * get the assembled value. A failed background load shows up as {@code FAILED} in {@link #status}.
     */
    public V getOrCreate(K key, Function<? super K, ? extends V> placeholderFactory, Assembler<K, V> assembler) {
        Objects.requireNonNull(placeholderFactory, "placeholderFactory");
        Optional<V> ready = getIfReady(key);
        if (ready.isPresent()) {
            return ready.get();
        }
        V placeholder = placeholderFactory.apply(key);
        preload(key, assembler);
        return placeholder;
    }

    public Optional<V> getIfReady(K key) {
        Objects.requireNonNull(key, "key");
        lock.lock();
        try {
            PreloadEntry<V> entry = entries.get(key);
            if (entry != null) {
                stats.recordHit();
                return Optional.of(entry.value);
            }
            stats.recordMiss();
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public boolean isReady(K key) {
        lock.lock();
        try {
            return statusOf(key).isCompleted() && entries.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    public LoadStatus status(K key) {
        lock.lock();
        try {
            return statusOf(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops the value and status for {@code key}. An in-flight load is cancelled, and its result is
     * discarded when it settles. A load still waiting for a thread never calls its assembler.
     */
    public void invalidate(K key) {
        Objects.requireNonNull(key, "key");
        InFlightLoad load;
        lock.lock();
        try {
            entries.remove(key);
            statuses.remove(key);
            evictionStrategy.onRemove(key);
            failureOrder.onRemove(key);
            load = inFlight.remove(key);
        } finally {
            lock.unlock();
        }
        if (load != null) {
            log.info("Invalidated key with load in flight, cancelling. key={}", key);
            load.signal.cancel();
        }
    }

    /** Drops every value and status and cancels all in-flight loads. */
    public void clear() {
        List<InFlightLoad> cancelled;
        lock.lock();
        try {
            cancelled = new ArrayList<>(inFlight.values());
            entries.clear();
            statuses.clear();
            inFlight.clear();
            evictionStrategy.clear();
            failureOrder.clear();
        } finally {
            lock.unlock();
        }
        log.info("Cleared preload cache, cancelling {} in-flight loads", cancelled.size());
        for (InFlightLoad load : cancelled) {
            load.signal.cancel();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        return stats;
    }

    public void resetStats() {
        stats.reset();
    }

    public PreloadCacheSettings settings() {
        return settings;
    }

    @Override
    public void close() {
        clear();
        if (ownsExecutor) {
            // Queued tasks never run after shutdownNow; settle them so nobody waits forever.
            for (Runnable queued : executor.shutdownNow()) {
                if (queued instanceof PreloadCache<?, ?>.AssemblyTask) {
                    ((PreloadCache<?, ?>.AssemblyTask) queued).abandon();
                }
            }
        }
    }

    private LoadStatus statusOf(K key) {
        LoadStatus status = statuses.get(key);
        return status != null ? status : LoadStatus.NOT_STARTED;
    }

    // Caller holds the lock.
    private List<K> eligible(List<K> keys) {
        List<K> batch = new ArrayList<>(settings.getBatchWidth());
        for (K key : new LinkedHashSet<>(keys)) {
            if (batch.size() >= settings.getBatchWidth()) {
                break;
            }
            if (key != null && !statusOf(key).isSettledOrBusy()) {
                batch.add(key);
            }
        }
        return batch;
    }

    // Caller holds the lock and has checked the key is neither loading nor completed.
    private InFlightLoad register(K key) {
        InFlightLoad load = new InFlightLoad(key);
        inFlight.put(key, load);
        statuses.put(key, LoadStatus.LOADING);
        failureOrder.onRemove(key);
        stats.recordLoadStarted();
        return load;
    }

    private void start(InFlightLoad load, Assembler<K, V> assembler) {
        log.debug("Queueing assembly. key={}", load.key);
        AssemblyTask task = new AssemblyTask(load, assembler);
        task.assembly.whenComplete((value, error) -> settle(load, value, error));
        try {
            executor.execute(task);
        } catch (RejectedExecutionException e) {
            task.assembly.completeExceptionally(e);
        }
    }

    private void settle(InFlightLoad load, V value, Throwable error) {
        Throwable cause = unwrap(error);
        long loadNanos = System.nanoTime() - load.startNanos;
        boolean current;
        boolean timedOut = cause instanceof TimeoutException;
        String reason = null;
        List<K> evicted = List.of();

        lock.lock();
        try {
            current = inFlight.get(load.key) == load;
            if (current) {
                inFlight.remove(load.key);
                if (cause == null && value != null) {
                    entries.put(load.key, new PreloadEntry<>(value, System.currentTimeMillis(), loadNanos));
                    statuses.put(load.key, LoadStatus.COMPLETED);
                    evictionStrategy.onInsert(load.key);
                    evicted = evictOverflow();
                } else {
                    reason = timedOut ? FailureReason.TIMEOUT
                        : cause == null ? "assembler returned no value"
                        : FailureReason.describe(cause);
                    statuses.put(load.key, LoadStatus.failed(reason));
                    failureOrder.onInsert(load.key);
                    dropOldestFailures();
                }
            }
        } finally {
            lock.unlock();
        }

        if (!current) {
            stats.recordCancelled();
            log.debug("Discarding result of {} load. key={}", FailureReason.CANCELLED, load.key);
        } else if (reason == null) {
            stats.recordSuccess();
            log.debug("Loaded key={} in {}ms", load.key, TimeUnit.NANOSECONDS.toMillis(loadNanos));
            if (!evicted.isEmpty()) {
                stats.recordEvictions(evicted.size());
                log.debug("Evicted {} oldest entries: {}", evicted.size(), evicted);
            }
        } else {
            stats.recordFailure(timedOut);
            if (timedOut) {
                log.warn("Load timed out after {}. key={}", settings.getLoadTimeout(), load.key);
            } else {
                log.warn("Load failed. key={}, reason={}", load.key, reason, cause);
            }
        }

        if (timedOut) {
            load.signal.cancel();
        }
        load.settled.complete(null);
    }

    // Caller holds the lock. Only completed keys are in entries, so only they can be victims.
    private List<K> evictOverflow() {
        int excess = entries.size() - settings.getCapacity();
        if (excess <= 0) {
            return List.of();
        }
        List<K> victims = evictionStrategy.selectVictims(excess);
        for (K victim : victims) {
            entries.remove(victim);
            statuses.remove(victim);
            evictionStrategy.onRemove(victim);
        }
        return victims;
    }

    // Caller holds the lock. A dropped failure reads as NOT_STARTED again.
    private void dropOldestFailures() {
        int failed = statuses.size() - entries.size() - inFlight.size();
        int excess = failed - settings.getCapacity();
        if (excess <= 0) {
            return;
        }
        for (K key : failureOrder.selectVictims(excess)) {
            statuses.remove(key);
            failureOrder.onRemove(key);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
            && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static ExecutorService newAssemblerPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, "preload-assembler-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(threads, factory);
    }

    private final class InFlightLoad {
        final K key;
        final CancellationSignal signal = new CancellationSignal();
        final CompletableFuture<Void> settled = new CompletableFuture<>();
        final long startNanos = System.nanoTime();

        InFlightLoad(K key) {
            this.key = key;
        }
    }

    /**
     * One queued assembly. The timeout is armed on the worker thread right before the assembler runs, and
     * the assembler is skipped entirely if the load was cancelled while queued.
     */
    private final class AssemblyTask implements Runnable {
        final InFlightLoad load;
        final Assembler<K, V> assembler;
        final CompletableFuture<V> assembly = new CompletableFuture<>();

        AssemblyTask(InFlightLoad load, Assembler<K, V> assembler) {
            this.load = load;
            this.assembler = assembler;
        }

        @Override
        public void run() {
            if (load.signal.isCancelled()) {
                assembly.completeExceptionally(new CancellationException("cancelled before assembly started"));
                return;
            }
            // orTimeout completes the same future, so whichever of assembler and timer finishes first wins.
            assembly.orTimeout(settings.getLoadTimeout().toMillis(), TimeUnit.MILLISECONDS);
            try {
                assembly.complete(assembler.assemble(load.key, load.signal));
            } catch (Throwable t) {
                assembly.completeExceptionally(t);
            }
        }

        void abandon() {
            assembly.completeExceptionally(new CancellationException("cache closed"));
        }
    }
}
