package com.name.resolution.core.model;

import java.time.Instant;

/**
 * Cluster row as read from the lookup backend.
 *
 * <p>Only the id, name, tenant linkage and deploy type take part in resolution;
 * the remaining columns are carried through for callers that want them.</p>
 *
 * @param tenantName the cluster's own tenant name, or the joined tenant's name when blank
 */
public record ClusterInfo(
        String clusterId,
        String clusterName,
        String tenantId,
        String tenantName,
        String deployType,
        String version,
        String clusterLifecycle,
        String creationDuration,
        String tenantPlan,
        String provider,
        String region,
        String projectId,
        String orgId,
        String clusterType,
        Instant createdAt,
        Instant updatedAt
) {

    public static final String NEXTGEN_HOST = "nextgen-host";

    public boolean isNextgenHost() {
        return NEXTGEN_HOST.equals(deployType);
    }

    /**
     * Shorthand for tests and fixtures that only care about the load-bearing columns.
     */
    public static ClusterInfo of(String clusterId, String clusterName, String tenantId,
                                 String tenantName, String deployType) {
        return new ClusterInfo(clusterId, clusterName, tenantId, tenantName, deployType,
                "", "", "", "", "", "", "", "", "", null, null);
    }
}
