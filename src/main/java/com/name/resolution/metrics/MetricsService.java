package com.name.resolution.metrics;

import com.name.resolution.core.model.NameKind;

import java.time.Duration;

/**
 * Interface for recording name resolution metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordCacheHit();

    void recordCacheMiss();

    void recordNegativeCacheHit();

    void incrementResolved(NameKind kind, String source);

    void incrementNotFound();

    void incrementBackendUnavailable();

    void incrementSourceFailure(String source);

    void recordLookupDuration(Duration duration, boolean found);

    void recordExpiredRemoved(int count);
}
