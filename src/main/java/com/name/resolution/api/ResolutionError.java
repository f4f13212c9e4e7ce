package com.name.resolution.api;

/**
 * Ways a resolution can fail. Every failure still comes with a usable display record.
 */
public enum ResolutionError {
    /** Empty identifier. */
    INVALID_INPUT,
    /** No backend configured or reachable. Never cached. */
    BACKEND_UNAVAILABLE,
    /** Every lookup source came up empty. Cached as a not-found entry. */
    NOT_FOUND,
    /** A still-valid not-found entry was read from the cache. */
    NOT_FOUND_CACHED
}
