package com.name.resolution.source;

import com.name.resolution.backend.NameLookupBackend;
import com.name.resolution.core.model.NameKind;
import com.name.resolution.core.model.NameRecord;

import java.util.Optional;

/**
 * Bare cluster name lookup. Empty names don't count.
 */
public class ClusterNameOnlySource implements NameSource {

    private final NameLookupBackend backend;

    public ClusterNameOnlySource(NameLookupBackend backend) {
        this.backend = backend;
    }

    @Override
    public String name() {
        return "cluster-name";
    }

    @Override
    public Optional<NameRecord> lookup(String id) {
        return backend.findClusterName(id)
                .filter(name -> !name.isEmpty())
                .map(name -> NameRecord.builder().kind(NameKind.CLUSTER).id(id).name(name).build());
    }
}
