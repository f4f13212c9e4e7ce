package com.name.resolution.backend;

import com.name.resolution.core.model.ClusterInfo;
import com.name.resolution.core.model.TenantInfo;

import java.util.List;
import java.util.Optional;

/**
 * Read-only query interface over the external store holding cluster and tenant records.
 *
 * <p>"No matching row" is reported as an empty result. Any other failure
 * (connection, timeout, malformed row) is thrown as {@link BackendQueryException}.</p>
 */
public interface NameLookupBackend {

    /**
     * Whether a backend is configured. Checked on every cache miss, so it must be cheap.
     * An unavailable backend is a valid runtime state; callers degrade instead of failing.
     */
    boolean isAvailable();

    /**
     * Whether the backend answers right now. May perform I/O; meant for health checks.
     */
    default boolean ping() {
        return isAvailable();
    }

    /**
     * Full cluster record by id, with the tenant name resolved through the tenant table when
     * the cluster row carries none.
     */
    Optional<ClusterInfo> findCluster(String clusterId);

    /**
     * Full tenant record by id.
     */
    Optional<TenantInfo> findTenant(String tenantId);

    /**
     * Bare tenant name by id.
     */
    Optional<String> findTenantName(String tenantId);

    /**
     * Bare cluster name by id.
     */
    Optional<String> findClusterName(String clusterId);

    /**
     * Non-empty names of premium cluster detail rows under a parent id, newest first.
     */
    List<String> findPremiumClusterNames(String parentId);
}
