package com.name.resolution.cache;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for the name cache.
 *
 * @param cacheTtl    time-to-live of positive entries
 * @param notFoundTtl time-to-live of negative entries, normally shorter so new backend records show up sooner
 */
public record CacheConfig(Duration cacheTtl, Duration notFoundTtl) {

    public static final Duration DEFAULT_CACHE_TTL = Duration.ofHours(24);
    public static final Duration DEFAULT_NOT_FOUND_TTL = Duration.ofHours(1);

    public CacheConfig {
        Objects.requireNonNull(cacheTtl, "cacheTtl is required");
        Objects.requireNonNull(notFoundTtl, "notFoundTtl is required");
        if (cacheTtl.isNegative() || cacheTtl.isZero()) {
            throw new IllegalArgumentException("cacheTtl must be > 0");
        }
        if (notFoundTtl.isNegative() || notFoundTtl.isZero()) {
            throw new IllegalArgumentException("notFoundTtl must be > 0");
        }
    }

    /**
     * Default cache configuration: 24h for found entries, 1h for not-found entries.
     */
    public static CacheConfig defaults() {
        return new CacheConfig(DEFAULT_CACHE_TTL, DEFAULT_NOT_FOUND_TTL);
    }

    public Duration ttlFor(boolean notFound) {
        return notFound ? notFoundTtl : cacheTtl;
    }
}
