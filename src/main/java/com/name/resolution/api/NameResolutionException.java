package com.name.resolution.api;

import com.name.resolution.core.model.NameRecord;

/**
 * Thrown by {@link NameResolution#orElseThrow()} when a resolution failed.
 * Carries the error kind and the placeholder record so callers can still render something.
 */
public class NameResolutionException extends RuntimeException {

    private final ResolutionError error;
    private final NameRecord fallback;

    public NameResolutionException(ResolutionError error, NameRecord fallback) {
        super(messageFor(error, fallback.getId()));
        this.error = error;
        this.fallback = fallback;
    }

    public ResolutionError getError() {
        return error;
    }

    public NameRecord getFallback() {
        return fallback;
    }

    private static String messageFor(ResolutionError error, String id) {
        return switch (error) {
            case INVALID_INPUT -> "empty id";
            case BACKEND_UNAVAILABLE -> "lookup backend not available";
            case NOT_FOUND -> "ID not found: " + id;
            case NOT_FOUND_CACHED -> "ID not found (cached): " + id;
        };
    }
}
