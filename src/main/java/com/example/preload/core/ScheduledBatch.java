package com.example.preload.core;

import java.util.List;
import java.util.concurrent.CompletableFuture;

public final class ScheduledBatch<K> {

    private final List<K> keys;
    private final CompletableFuture<Void> completion;

    public ScheduledBatch(List<K> keys, CompletableFuture<Void> completion) {
        this.keys = List.copyOf(keys);
        this.completion = completion;
    }

    public List<K> keys() {
        return keys;
    }

    public CompletableFuture<Void> completion() {
        return completion;
    }
}
