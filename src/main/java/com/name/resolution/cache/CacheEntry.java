package com.name.resolution.cache;

import com.name.resolution.core.model.NameRecord;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable cache entry. A stale entry is replaced wholesale, never mutated.
 *
 * @param record   the resolved record, or the unresolved placeholder for negative entries
 * @param notFound true if the identifier was confirmed absent from the backend
 * @param storedAt when the entry was written
 */
public record CacheEntry(NameRecord record, boolean notFound, Instant storedAt) {

    public CacheEntry {
        Objects.requireNonNull(record, "record is required");
        Objects.requireNonNull(storedAt, "storedAt is required");
    }
}
