package com.name.resolution.core.model;

/**
 * Kind of object an identifier resolved to.
 */
public enum NameKind {
    CLUSTER("cluster"),
    TENANT("tenant");

    private final String label;

    NameKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
