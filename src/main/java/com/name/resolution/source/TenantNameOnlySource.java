package com.name.resolution.source;

import com.name.resolution.backend.NameLookupBackend;
import com.name.resolution.core.model.NameKind;
import com.name.resolution.core.model.NameRecord;

import java.util.Optional;

/**
 * Bare tenant name lookup, for rows the full tenant query cannot read. Empty names don't count.
 */
public class TenantNameOnlySource implements NameSource {

    private final NameLookupBackend backend;

    public TenantNameOnlySource(NameLookupBackend backend) {
        this.backend = backend;
    }

    @Override
    public String name() {
        return "tenant-name";
    }

    @Override
    public Optional<NameRecord> lookup(String id) {
        return backend.findTenantName(id)
                .filter(name -> !name.isEmpty())
                .map(name -> NameRecord.builder().kind(NameKind.TENANT).id(id).name(name).build());
    }
}
