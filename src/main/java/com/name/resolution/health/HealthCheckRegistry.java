package com.name.resolution.health;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs registered health checks and folds them into one status.
 * The aggregate takes the worst individual status; each check's
 * result is reported under its name in the aggregate's details.
 */
public class HealthCheckRegistry {

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        HealthStatus worst = HealthStatus.up();
        String worstName = null;
        Map<String, Object> perCheck = new LinkedHashMap<>();

        for (HealthCheck check : checks) {
            HealthStatus result;
            try {
                result = check.check();
            } catch (RuntimeException e) {
                result = HealthStatus.down(e.getClass().getSimpleName() + ": " + e.getMessage());
            }
            perCheck.put(check.getName(), Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()));
            if (result.isWorseThan(worst)) {
                worst = result;
                worstName = check.getName();
            }
        }

        String message = worstName == null ? "OK" : worstName + ": " + worst.message();
        return new HealthStatus(worst.status(), message, perCheck);
    }

    public int size() {
        return checks.size();
    }
}
