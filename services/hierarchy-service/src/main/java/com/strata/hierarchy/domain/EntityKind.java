package com.strata.hierarchy.domain;

/** One level of the Cluster → Domain → Resource containment hierarchy. */
public enum EntityKind {

    CLUSTER("Cluster"),
    DOMAIN("Domain"),
    RESOURCE("Resource");

    private final String label;

    EntityKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** The level directly above, or null for clusters. */
    public EntityKind parent() {
        return switch (this) {
            case CLUSTER -> null;
            case DOMAIN -> CLUSTER;
            case RESOURCE -> DOMAIN;
        };
    }

    /** The level directly below, or null for resources. */
    public EntityKind child() {
        return switch (this) {
            case CLUSTER -> DOMAIN;
            case DOMAIN -> RESOURCE;
            case RESOURCE -> null;
        };
    }
}
