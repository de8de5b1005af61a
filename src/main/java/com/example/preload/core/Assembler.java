package com.example.preload.core;

/**
 * Builds the value for a key. Runs on the cache executor, off the cache lock.
 *
 * <p>Implementations should poll {@link CancellationSignal#isCancelled()} (or register a callback) during
 * long work and stop early once cancelled. The cache stops waiting on timeout or invalidation, but it cannot
 * stop the assembler itself. Releasing anything the assembler opened is the assembler's job.
 */
@FunctionalInterface
public interface Assembler<K, V> {

    V assemble(K key, CancellationSignal signal) throws Exception;
}
