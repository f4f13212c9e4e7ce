package com.name.resolution.metrics;

import com.name.resolution.core.model.NameKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code name.cache.hit}: Counter</li>
 *   <li>{@code name.cache.miss}: Counter</li>
 *   <li>{@code name.cache.negative.hit}: Counter</li>
 *   <li>{@code name.resolved}: Counter (tags: kind, source)</li>
 *   <li>{@code name.not_found}: Counter</li>
 *   <li>{@code name.backend.unavailable}: Counter</li>
 *   <li>{@code name.source.failure}: Counter (tag: source)</li>
 *   <li>{@code name.lookup.duration}: Timer (tag: outcome)</li>
 *   <li>{@code name.cache.expired.removed}: DistributionSummary</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<Boolean, Timer> timerCache = new ConcurrentHashMap<>();
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Counter negativeHitCounter;
    private final Counter notFoundCounter;
    private final Counter backendUnavailableCounter;
    private final DistributionSummary expiredRemovedSummary;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.cacheHitCounter = Counter.builder("name.cache.hit")
                .description("Number of name cache hits on found entries")
                .register(registry);
        this.cacheMissCounter = Counter.builder("name.cache.miss")
                .description("Number of name cache misses")
                .register(registry);
        this.negativeHitCounter = Counter.builder("name.cache.negative.hit")
                .description("Number of name cache hits on not-found entries")
                .register(registry);
        this.notFoundCounter = Counter.builder("name.not_found")
                .description("Number of identifiers not found in any lookup source")
                .register(registry);
        this.backendUnavailableCounter = Counter.builder("name.backend.unavailable")
                .description("Number of resolutions attempted without a reachable backend")
                .register(registry);
        this.expiredRemovedSummary = DistributionSummary.builder("name.cache.expired.removed")
                .description("Entries removed per expiry sweep")
                .register(registry);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    @Override
    public void recordNegativeCacheHit() {
        negativeHitCounter.increment();
    }

    @Override
    public void incrementResolved(NameKind kind, String source) {
        String kindLabel = kind != null ? kind.getLabel() : "none";
        String key = "resolved:" + kindLabel + ":" + source;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("name.resolved")
                        .description("Number of identifiers resolved from the backend")
                        .tag("kind", kindLabel)
                        .tag("source", source)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementNotFound() {
        notFoundCounter.increment();
    }

    @Override
    public void incrementBackendUnavailable() {
        backendUnavailableCounter.increment();
    }

    @Override
    public void incrementSourceFailure(String source) {
        String key = "failure:" + source;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("name.source.failure")
                        .description("Number of lookup source queries that failed")
                        .tag("source", source)
                        .register(registry));
        counter.increment();
    }

    @Override
    public void recordLookupDuration(Duration duration, boolean found) {
        Timer timer = timerCache.computeIfAbsent(found, f ->
                Timer.builder("name.lookup.duration")
                        .description("Duration of backend fallback chain lookups")
                        .tag("outcome", f ? "found" : "not_found")
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordExpiredRemoved(int count) {
        expiredRemovedSummary.record(count);
    }
}
