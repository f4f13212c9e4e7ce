package com.name.resolution.backend;

import com.name.resolution.core.model.ClusterInfo;
import com.name.resolution.core.model.TenantInfo;

import java.util.List;
import java.util.Optional;

/**
 * Backend used when no lookup store is configured.
 * Always reports itself unavailable and never matches anything.
 */
public class UnavailableNameLookupBackend implements NameLookupBackend {

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public Optional<ClusterInfo> findCluster(String clusterId) {
        return Optional.empty();
    }

    @Override
    public Optional<TenantInfo> findTenant(String tenantId) {
        return Optional.empty();
    }

    @Override
    public Optional<String> findTenantName(String tenantId) {
        return Optional.empty();
    }

    @Override
    public Optional<String> findClusterName(String clusterId) {
        return Optional.empty();
    }

    @Override
    public List<String> findPremiumClusterNames(String parentId) {
        return List.of();
    }
}
