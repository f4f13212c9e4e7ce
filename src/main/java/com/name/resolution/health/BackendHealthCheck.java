package com.name.resolution.health;

import com.name.resolution.backend.NameLookupBackend;

/**
 * Reports the lookup backend DOWN when it is not configured or not reachable.
 * Resolution still works in that state, returning ids as names.
 */
public class BackendHealthCheck implements HealthCheck {

    private final NameLookupBackend backend;

    public BackendHealthCheck(NameLookupBackend backend) {
        this.backend = backend;
    }

    @Override
    public String getName() {
        return "lookup-backend";
    }

    @Override
    public HealthStatus check() {
        long startMs = System.currentTimeMillis();
        boolean available = backend.isAvailable() && backend.ping();
        long latencyMs = System.currentTimeMillis() - startMs;

        HealthStatus status = available
                ? HealthStatus.up()
                : HealthStatus.down("Lookup backend not configured or unreachable");
        return status
                .withDetail("backend", backend.getClass().getSimpleName())
                .withDetail("latencyMs", latencyMs);
    }
}
