package com.name.resolution.source;

import com.name.resolution.backend.NameLookupBackend;
import com.name.resolution.core.model.ClusterInfo;
import com.name.resolution.core.model.NameKind;
import com.name.resolution.core.model.NameRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Full cluster lookup. A found cluster is a result even when its stored name is empty.
 *
 * <p>Nextgen host clusters often carry no name of their own. For those, when the stored
 * name is empty or just the id, the names of their premium cluster detail rows are
 * joined (newest first) and used instead.</p>
 */
public class ClusterNameSource implements NameSource {
    private static final Logger log = LoggerFactory.getLogger(ClusterNameSource.class);

    static final String NAME_SEPARATOR = ", ";

    private final NameLookupBackend backend;

    public ClusterNameSource(NameLookupBackend backend) {
        this.backend = backend;
    }

    @Override
    public String name() {
        return "cluster";
    }

    @Override
    public Optional<NameRecord> lookup(String id) {
        return backend.findCluster(id).map(cluster -> NameRecord.builder()
                .kind(NameKind.CLUSTER)
                .id(id)
                .name(displayName(id, cluster))
                .tenantId(cluster.tenantId())
                .tenantName(cluster.tenantName())
                .build());
    }

    private String displayName(String id, ClusterInfo cluster) {
        String stored = cluster.clusterName() != null ? cluster.clusterName() : "";
        if (!cluster.isNextgenHost() || !(stored.isEmpty() || stored.equals(id))) {
            return stored;
        }
        List<String> premiumNames;
        try {
            premiumNames = backend.findPremiumClusterNames(id);
        } catch (RuntimeException e) {
            log.warn("name.premium_lookup.failed id={} error={}", id, e.getMessage());
            return stored;
        }
        List<String> meaningful = new ArrayList<>();
        for (String premiumName : premiumNames) {
            String trimmed = premiumName == null ? "" : premiumName.trim();
            if (!trimmed.isEmpty() && !trimmed.equals(id)) {
                meaningful.add(trimmed);
            }
        }
        if (meaningful.isEmpty()) {
            return stored;
        }
        log.debug("name.premium_lookup.recovered id={} count={}", id, meaningful.size());
        return String.join(NAME_SEPARATOR, meaningful);
    }
}
