package com.name.resolution.api;

import com.name.resolution.core.model.NameRecord;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of resolving one identifier: always a displayable record, plus an error when
 * the identifier could not be resolved.
 *
 * @param record the resolved record, or {@code {id, name: id}} on failure
 * @param error  the failure kind, or null on success
 */
public record NameResolution(NameRecord record, ResolutionError error) {

    public NameResolution {
        Objects.requireNonNull(record, "record is required");
    }

    public static NameResolution resolved(NameRecord record) {
        return new NameResolution(record, null);
    }

    public static NameResolution failed(NameRecord fallback, ResolutionError error) {
        return new NameResolution(fallback, Objects.requireNonNull(error, "error is required"));
    }

    public boolean isResolved() {
        return error == null;
    }

    public Optional<ResolutionError> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * Returns the record, or throws when the resolution failed.
     *
     * @throws NameResolutionException carrying the error and the placeholder record
     */
    public NameRecord orElseThrow() {
        if (error != null) {
            throw new NameResolutionException(error, record);
        }
        return record;
    }
}
