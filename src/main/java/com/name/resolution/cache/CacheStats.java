package com.name.resolution.cache;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of the cache contents, classifying every stored entry.
 * Expired entries that have not been swept yet count towards {@code total} and {@code expired}
 * only, never towards {@code found} or {@code notFound}.
 *
 * @param total       number of stored entries
 * @param found       valid positive entries
 * @param notFound    valid negative entries
 * @param expired     entries past their TTL but not yet removed
 * @param cacheTtl    configured positive TTL
 * @param notFoundTtl configured negative TTL
 */
public record CacheStats(int total, int found, int notFound, int expired,
                         Duration cacheTtl, Duration notFoundTtl) {

    /**
     * Renders the snapshot with the keys the dashboard's stats endpoint exposes.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("total", total);
        map.put("found", found);
        map.put("not_found", notFound);
        map.put("expired", expired);
        map.put("cache_ttl", cacheTtl.toString());
        map.put("not_found_ttl", notFoundTtl.toString());
        return map;
    }
}
