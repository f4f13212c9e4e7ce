package com.name.resolution.source;

import com.name.resolution.backend.NameLookupBackend;
import com.name.resolution.core.model.NameKind;
import com.name.resolution.core.model.NameRecord;

import java.util.Optional;

/**
 * Full tenant record lookup.
 */
public class TenantNameSource implements NameSource {

    private final NameLookupBackend backend;

    public TenantNameSource(NameLookupBackend backend) {
        this.backend = backend;
    }

    @Override
    public String name() {
        return "tenant";
    }

    @Override
    public Optional<NameRecord> lookup(String id) {
        return backend.findTenant(id).map(tenant -> NameRecord.builder()
                .kind(NameKind.TENANT)
                .id(id)
                .name(tenant.tenantName())
                .build());
    }
}
