package com.name.resolution.backend;

/**
 * Configuration for {@link JdbcNameLookupBackend}.
 *
 * @param queryTimeoutSeconds per-statement timeout, also used for connection validation
 */
public record BackendConfig(int queryTimeoutSeconds) {

    public BackendConfig {
        if (queryTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("queryTimeoutSeconds must be > 0");
        }
    }

    /**
     * Default backend configuration: 5s query timeout.
     */
    public static BackendConfig defaults() {
        return new BackendConfig(5);
    }
}
