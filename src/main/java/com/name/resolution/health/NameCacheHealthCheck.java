package com.name.resolution.health;

import com.name.resolution.cache.CacheStats;
import com.name.resolution.cache.NameCache;

/**
 * Reports cache occupancy. DEGRADED when more than half of the stored entries
 * are expired, which means the periodic sweep is not running.
 */
public class NameCacheHealthCheck implements HealthCheck {

    private final NameCache cache;

    public NameCacheHealthCheck(NameCache cache) {
        this.cache = cache;
    }

    @Override
    public String getName() {
        return "name-cache";
    }

    @Override
    public HealthStatus check() {
        CacheStats stats = cache.stats();
        HealthStatus status = stats.expired() * 2 > stats.total()
                ? HealthStatus.degraded(stats.expired() + " of " + stats.total() + " entries expired, sweep not keeping up")
                : HealthStatus.up();
        return status.withDetails(stats.toMap());
    }
}
