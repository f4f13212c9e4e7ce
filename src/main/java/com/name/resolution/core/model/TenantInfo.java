package com.name.resolution.core.model;

import java.time.Instant;

/**
 * Tenant row as read from the lookup backend.
 */
public record TenantInfo(
        String tenantId,
        String tenantName,
        String kind,
        Instant createdAt,
        Instant updatedAt
) {
}
