package com.name.resolution.source;

import com.name.resolution.core.model.NameRecord;

import java.util.Optional;

/**
 * One step of the fallback chain: looks an identifier up in a single place.
 *
 * <p>Returns empty when the source has nothing for the id. May throw
 * {@link com.name.resolution.backend.BackendQueryException} when the underlying
 * query fails; the chain treats that as "no result" and moves on.</p>
 */
public interface NameSource {

    /**
     * Short name used in logs and metric tags.
     */
    String name();

    Optional<NameRecord> lookup(String id);
}
