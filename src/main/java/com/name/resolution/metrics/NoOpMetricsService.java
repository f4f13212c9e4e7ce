package com.name.resolution.metrics;

import com.name.resolution.core.model.NameKind;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }

    @Override
    public void recordNegativeCacheHit() {
    }

    @Override
    public void incrementResolved(NameKind kind, String source) {
    }

    @Override
    public void incrementNotFound() {
    }

    @Override
    public void incrementBackendUnavailable() {
    }

    @Override
    public void incrementSourceFailure(String source) {
    }

    @Override
    public void recordLookupDuration(Duration duration, boolean found) {
    }

    @Override
    public void recordExpiredRemoved(int count) {
    }
}
