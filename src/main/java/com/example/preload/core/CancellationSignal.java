package com.example.preload.core;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperative cancellation handed to an {@link Assembler}. Cancelled by the cache when a load times out
 * or its key is invalidated.
 */
public class CancellationSignal {

    private static final Logger log = LoggerFactory.getLogger(CancellationSignal.class);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Runs {@code callback} once on cancellation. If the signal is already cancelled the callback runs
     * immediately on the calling thread.
     */
    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            callback.run();
        }
    }

    void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Runnable callback : callbacks) {
            if (callbacks.remove(callback)) {
                try {
                    callback.run();
                } catch (RuntimeException e) {
                    log.warn("Cancellation callback failed", e);
                }
            }
        }
    }
}
