package com.example.preload.config;

import com.example.preload.core.PreloadCacheSettings;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Preload cache settings.
 *
 * <pre>{@code
 * preload:
 *   cache:
 *     capacity: 10
 *     batch-width: 3
 *     load-timeout: 8s
 *     executor-threads: 8
 * }</pre>
 */
@ConfigurationProperties(prefix = "preload.cache")
public record PreloadCacheProperties(
    @DefaultValue("10") int capacity,
    @DefaultValue("3") int batchWidth,
    @DefaultValue("8s") Duration loadTimeout,
    @DefaultValue("8") int executorThreads) {

    public PreloadCacheProperties {
        if (capacity <= 0) {
            throw new IllegalArgumentException("preload.cache.capacity must be positive, got: " + capacity);
        }
        if (batchWidth <= 0) {
            throw new IllegalArgumentException("preload.cache.batch-width must be positive, got: " + batchWidth);
        }
        if (loadTimeout == null || loadTimeout.isNegative() || loadTimeout.isZero()) {
            throw new IllegalArgumentException("preload.cache.load-timeout must be positive, got: " + loadTimeout);
        }
        if (executorThreads <= 0) {
            throw new IllegalArgumentException("preload.cache.executor-threads must be positive");
        }
    }

    public PreloadCacheSettings toSettings() {
        return new PreloadCacheSettings(capacity, batchWidth, loadTimeout, executorThreads);
    }
}
