package com.example.preload.core;

import java.time.Duration;
import java.util.Objects;

public final class PreloadCacheSettings {

    public static final int DEFAULT_CAPACITY = 10;
    public static final int DEFAULT_BATCH_WIDTH = 3;
    public static final Duration DEFAULT_LOAD_TIMEOUT = Duration.ofSeconds(8);
    public static final int DEFAULT_EXECUTOR_THREADS = 8;

    private final int capacity;
    private final int batchWidth;
    private final Duration loadTimeout; // from assembler start; queue wait for a thread is not counted
    private final int executorThreads;

    public PreloadCacheSettings(int capacity, int batchWidth, Duration loadTimeout, int executorThreads) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got: " + capacity);
        }
        if (batchWidth <= 0) {
            throw new IllegalArgumentException("batchWidth must be positive, got: " + batchWidth);
        }
        Objects.requireNonNull(loadTimeout, "loadTimeout");
        if (loadTimeout.isNegative() || loadTimeout.isZero()) {
            throw new IllegalArgumentException("loadTimeout must be positive, got: " + loadTimeout);
        }
        if (executorThreads <= 0) {
            throw new IllegalArgumentException("executorThreads must be positive, got: " + executorThreads);
        }
        this.capacity = capacity;
        this.batchWidth = batchWidth;
        this.loadTimeout = loadTimeout;
        this.executorThreads = executorThreads;
    }

    public PreloadCacheSettings(int capacity, int batchWidth, Duration loadTimeout) {
        this(capacity, batchWidth, loadTimeout, DEFAULT_EXECUTOR_THREADS);
    }

    public static PreloadCacheSettings defaults() {
        return new PreloadCacheSettings(DEFAULT_CAPACITY, DEFAULT_BATCH_WIDTH, DEFAULT_LOAD_TIMEOUT);
    }

    public int getCapacity() {
        return capacity;
    }

    public int getBatchWidth() {
        return batchWidth;
    }

    public Duration getLoadTimeout() {
        return loadTimeout;
    }

    public int getExecutorThreads() {
        return executorThreads;
    }

    @Override
    public String toString() {
        return "PreloadCacheSettings{capacity=" + capacity + ", batchWidth=" + batchWidth
                + ", loadTimeout=" + loadTimeout + ", executorThreads=" + executorThreads + "}";
    }
}
