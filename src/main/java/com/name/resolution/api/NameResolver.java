package com.name.resolution.api;

import com.name.resolution.audit.MissAuditor;
import com.name.resolution.audit.MissReason;
import com.name.resolution.audit.NoOpMissAuditor;
import com.name.resolution.backend.NameLookupBackend;
import com.name.resolution.backend.UnavailableNameLookupBackend;
import com.name.resolution.cache.CacheConfig;
import com.name.resolution.cache.CacheEntry;
import com.name.resolution.cache.CacheHousekeeper;
import com.name.resolution.cache.CacheStats;
import com.name.resolution.cache.NameCache;
import com.name.resolution.cache.TtlNameCache;
import com.name.resolution.core.model.Identifiers;
import com.name.resolution.core.model.NameRecord;
import com.name.resolution.health.BackendHealthCheck;
import com.name.resolution.health.HealthCheckRegistry;
import com.name.resolution.health.HealthStatus;
import com.name.resolution.health.NameCacheHealthCheck;
import com.name.resolution.logging.LogContext;
import com.name.resolution.metrics.MetricsService;
import com.name.resolution.metrics.NoOpMetricsService;
import com.name.resolution.source.FallbackChain;
import com.name.resolution.tracing.NoOpTracingService;
import com.name.resolution.tracing.Span;
import com.name.resolution.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves cluster and tenant identifiers to display names.
 *
 * <p>Numeric identifiers are looked up in the cache first, then through the
 * {@link FallbackChain} against the lookup backend. Found and not-found outcomes are
 * both cached, with their own TTLs. Non-numeric identifiers resolve to themselves
 * and are never cached.</p>
 *
 * <p>Safe for concurrent use. Backend queries run outside the cache lock, so two callers
 * missing on the same id may both query the backend; the later write wins.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * NameResolver resolver = NameResolver.builder()
 *     .backend(new JdbcNameLookupBackend(dataSource, BackendConfig.defaults()))
 *     .missAuditor(new FileMissAuditor(Path.of("name_service_miss.log")))
 *     .build();
 *
 * NameResolution resolution = resolver.resolve("10234");
 * String display = resolution.record().getName();
 * </pre>
 */
public class NameResolver implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NameResolver.class);

    private final NameLookupBackend backend;
    private final NameCache cache;
    private final FallbackChain chain;
    private final MissAuditor missAuditor;
    private final boolean ownsMissAuditor;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final HealthCheckRegistry healthCheckRegistry;
    private final CacheHousekeeper housekeeper;
    private final Clock clock;

    private NameResolver(Builder builder) {
        this.clock = builder.clock;
        this.backend = builder.backend != null ? builder.backend : new UnavailableNameLookupBackend();
        this.cache = builder.cache != null ? builder.cache : new TtlNameCache(builder.cacheConfig, clock);
        this.ownsMissAuditor = builder.missAuditor == null;
        this.missAuditor = ownsMissAuditor ? new NoOpMissAuditor() : builder.missAuditor;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();
        this.chain = builder.chain != null
                ? builder.chain : FallbackChain.standard(backend, metricsService);

        this.healthCheckRegistry = new HealthCheckRegistry();
        healthCheckRegistry.register(new BackendHealthCheck(backend));
        healthCheckRegistry.register(new NameCacheHealthCheck(cache));

        if (builder.cleanupInterval != null) {
            this.housekeeper = new CacheHousekeeper(cache, builder.cleanupInterval, metricsService);
            housekeeper.start();
        } else {
            this.housekeeper = null;
        }
        log.info("NameResolver initialized with backend: {}", backend.getClass().getSimpleName());
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========== Resolution API ==========

    /**
     * Resolves an identifier to its display record.
     * The returned record is always usable for display, even when an error is reported.
     */
    public NameResolution resolve(String id) {
        if (id == null || id.isEmpty()) {
            return NameResolution.failed(NameRecord.unresolved(""), ResolutionError.INVALID_INPUT);
        }
        if (!Identifiers.isNumeric(id)) {
            return NameResolution.resolved(NameRecord.unresolved(id));
        }

        Optional<CacheEntry> cached = cache.get(id);
        if (cached.isPresent()) {
            CacheEntry entry = cached.get();
            if (entry.notFound()) {
                metricsService.recordNegativeCacheHit();
                return NameResolution.failed(NameRecord.unresolved(id), ResolutionError.NOT_FOUND_CACHED);
            }
            metricsService.recordCacheHit();
            return NameResolution.resolved(entry.record());
        }
        metricsService.recordCacheMiss();

        if (!backend.isAvailable()) {
            log.debug("name.backend.unavailable id={}", id);
            metricsService.incrementBackendUnavailable();
            missAuditor.record(id, MissReason.BACKEND_UNAVAILABLE);
            return NameResolution.failed(NameRecord.unresolved(id), ResolutionError.BACKEND_UNAVAILABLE);
        }

        return resolveFromBackend(id);
    }

    /**
     * Display name for an identifier; the id itself when it cannot be resolved.
     */
    public String displayName(String id) {
        return resolve(id).record().getName();
    }

    private NameResolution resolveFromBackend(String id) {
        try (LogContext ignored = LogContext.forResolution(id);
             Span span = tracingService.startSpan("name.resolve", id)) {
            try {
                return resolveTraced(id, span);
            } catch (RuntimeException e) {
                span.markFailed(e);
                throw e;
            }
        }
    }

    private NameResolution resolveTraced(String id, Span span) {
        long startNanos = System.nanoTime();
        Optional<FallbackChain.Match> match = chain.resolve(id);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        metricsService.recordLookupDuration(elapsed, match.isPresent());
        span.setAttribute("name.found", match.isPresent());

        if (match.isPresent()) {
            NameRecord record = match.get().record();
            cache.put(id, record, false);
            metricsService.incrementResolved(record.getKind(), match.get().source());
            span.setAttribute("name.source", match.get().source());
            span.markSucceeded();
            log.debug("name.resolved id={} source={} kind={}", id, match.get().source(), record.getKind());
            return NameResolution.resolved(record);
        }

        NameRecord unresolved = NameRecord.unresolved(id);
        cache.put(id, unresolved, true);
        metricsService.incrementNotFound();
        missAuditor.record(id, MissReason.NOT_FOUND_IN_BACKEND);
        span.markSucceeded();
        log.debug("name.not_found id={}", id);
        return NameResolution.failed(unresolved, ResolutionError.NOT_FOUND);
    }

    // ========== Housekeeping API ==========

    public CacheStats stats() {
        return cache.stats();
    }

    /**
     * Cache statistics keyed as {@code total, found, not_found, expired, cache_ttl, not_found_ttl}.
     */
    public Map<String, Object> statsAsMap() {
        return cache.stats().toMap();
    }

    public void clear() {
        try (LogContext ignored = LogContext.forHousekeeping("clear")) {
            cache.clear();
        }
    }

    /**
     * Removes expired entries now.
     *
     * @return number of entries removed
     */
    public int cleanExpired() {
        try (LogContext ignored = LogContext.forHousekeeping("clean-expired")) {
            int removed = cache.cleanExpired();
            metricsService.recordExpiredRemoved(removed);
            return removed;
        }
    }

    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    public boolean isHousekeepingEnabled() {
        return housekeeper != null && housekeeper.isRunning();
    }

    /**
     * Stops background cleanup. A miss auditor passed to the builder is left open.
     */
    @Override
    public void close() {
        if (housekeeper != null) {
            housekeeper.close();
        }
        if (ownsMissAuditor) {
            missAuditor.close();
        }
        log.info("NameResolver closed");
    }

    /**
     * Builder for {@link NameResolver}.
     */
    public static class Builder {
        private NameLookupBackend backend;
        private NameCache cache;
        private CacheConfig cacheConfig = CacheConfig.defaults();
        private FallbackChain chain;
        private MissAuditor missAuditor;
        private MetricsService metricsService;
        private TracingService tracingService;
        private Duration cleanupInterval;
        private Clock clock = Clock.systemUTC();

        /**
         * Lookup backend. Defaults to one that is always unavailable.
         */
        public Builder backend(NameLookupBackend backend) {
            this.backend = backend;
            return this;
        }

        /**
         * TTLs for the default cache. Ignored when {@link #cache(NameCache)} is set.
         */
        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder cache(NameCache cache) {
            this.cache = cache;
            return this;
        }

        /**
         * Custom fallback chain. Defaults to {@link FallbackChain#standard}.
         */
        public Builder fallbackChain(FallbackChain chain) {
            this.chain = chain;
            return this;
        }

        /**
         * Miss auditor supplied by the caller. The caller keeps ownership and closes it;
         * {@link NameResolver#close()} leaves it open.
         */
        public Builder missAuditor(MissAuditor missAuditor) {
            this.missAuditor = missAuditor;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        /**
         * Enables a background sweep of expired entries at this interval.
         */
        public Builder cleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = cleanupInterval;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public NameResolver build() {
            if (cacheConfig == null) {
                throw new IllegalArgumentException("cacheConfig is required");
            }
            if (clock == null) {
                throw new IllegalArgumentException("clock is required");
            }
            return new NameResolver(this);
        }
    }
}
