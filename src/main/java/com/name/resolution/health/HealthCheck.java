package com.name.resolution.health;

/**
 * A single health check for a resolver component.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
