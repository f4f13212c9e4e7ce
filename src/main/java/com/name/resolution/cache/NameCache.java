package com.name.resolution.cache;

import com.name.resolution.core.model.NameRecord;

import java.util.Optional;

/**
 * Cache of name resolutions keyed by identifier, holding both found and not-found outcomes.
 */
public interface NameCache {

    /**
     * Gets a cached entry if one exists and is still within its TTL.
     * An expired entry is reported as absent but stays stored until {@link #cleanExpired()}.
     *
     * @param id the identifier
     * @return the valid entry, or empty
     */
    Optional<CacheEntry> get(String id);

    /**
     * Stores or replaces the entry for an identifier, stamped with the current time.
     *
     * @param id       the identifier
     * @param record   the record to cache
     * @param notFound true to store a negative entry
     */
    void put(String id, NameRecord record, boolean notFound);

    /**
     * Discards all entries.
     */
    void clear();

    /**
     * Removes every entry whose TTL has lapsed.
     *
     * @return number of entries removed
     */
    int cleanExpired();

    /**
     * Returns a snapshot of the cache contents.
     */
    CacheStats stats();
}
