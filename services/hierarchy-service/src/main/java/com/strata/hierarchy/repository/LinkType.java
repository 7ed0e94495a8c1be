package com.strata.hierarchy.repository;

import com.strata.hierarchy.domain.EntityKind;

/** The two junction tables and the parent/child kinds they connect. */
public enum LinkType {

    CLUSTER_DOMAIN(
            "cluster_domain_links", "cluster_id", "domain_id", EntityKind.CLUSTER, EntityKind.DOMAIN),
    DOMAIN_RESOURCE(
            "domain_resource_links",
            "domain_id",
            "resource_id",
            EntityKind.DOMAIN,
            EntityKind.RESOURCE);

    private final String table;
    private final String parentColumn;
    private final String childColumn;
    private final EntityKind parentKind;
    private final EntityKind childKind;

    LinkType(
            String table,
            String parentColumn,
            String childColumn,
            EntityKind parentKind,
            EntityKind childKind) {
        this.table = table;
        this.parentColumn = parentColumn;
        this.childColumn = childColumn;
        this.parentKind = parentKind;
        this.childKind = childKind;
    }

    /**
     * The junction connecting {@code parent} to {@code child}.
     *
     * @throws IllegalArgumentException if the kinds are not adjacent levels
     */
    public static LinkType between(EntityKind parent, EntityKind child) {
        for (LinkType type : values()) {
            if (type.parentKind == parent && type.childKind == child) {
                return type;
            }
        }
        throw new IllegalArgumentException(
                "A " + child.label() + " cannot be linked under a " + parent.label());
    }

    /** The junction holding {@code child}'s parents. */
    public static LinkType above(EntityKind child) {
        return between(child.parent() == null ? child : child.parent(), child);
    }

    /** The junction holding {@code parent}'s children, or null for the bottom level. */
    public static LinkType below(EntityKind parent) {
        return parent.child() == null ? null : between(parent, parent.child());
    }

    public String table() {
        return table;
    }

    public String parentColumn() {
        return parentColumn;
    }

    public String childColumn() {
        return childColumn;
    }

    public EntityKind parentKind() {
        return parentKind;
    }

    public EntityKind childKind() {
        return childKind;
    }
}
