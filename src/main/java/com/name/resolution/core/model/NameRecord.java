package com.name.resolution.core.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Resolved display data for an identifier. Immutable.
 * Tenant linkage is only populated for cluster records.
 */
public final class NameRecord {
    private final NameKind kind;
    private final String id;
    private final String name;
    private final String tenantId;
    private final String tenantName;

    private NameRecord(Builder builder) {
        this.kind = builder.kind;
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = builder.name != null ? builder.name : "";
        this.tenantId = builder.tenantId != null ? builder.tenantId : "";
        this.tenantName = builder.tenantName != null ? builder.tenantName : "";
    }

    /**
     * Display value for an identifier that could not be resolved: the id stands in for the name.
     */
    public static NameRecord unresolved(String id) {
        return builder().id(id).name(id).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Kind of the record, or null when unset.
     */
    public NameKind getKind() {
        return kind;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getTenantName() {
        return tenantName;
    }

    /**
     * Renders the record in the shape the dashboard consumes.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", kind != null ? kind.getLabel() : "");
        map.put("id", id);
        map.put("name", name);
        map.put("tenantId", tenantId);
        map.put("tenantName", tenantName);
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        NameRecord that = (NameRecord) o;
        return kind == that.kind
                && id.equals(that.id)
                && name.equals(that.name)
                && tenantId.equals(that.tenantId)
                && tenantName.equals(that.tenantName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, id, name, tenantId, tenantName);
    }

    @Override
    public String toString() {
        return "NameRecord{" +
                "kind=" + kind +
                ", id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", tenantId='" + tenantId + '\'' +
                ", tenantName='" + tenantName + '\'' +
                '}';
    }

    public static class Builder {
        private NameKind kind;
        private String id;
        private String name;
        private String tenantId;
        private String tenantName;

        public Builder kind(NameKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder tenantName(String tenantName) {
            this.tenantName = tenantName;
            return this;
        }

        public NameRecord build() {
            return new NameRecord(this);
        }
    }
}
