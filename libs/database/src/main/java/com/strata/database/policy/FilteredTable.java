package com.strata.database.policy;

/** Tables whose rows are subject to the membership-closure filter, with the key the filter joins on. */
public enum FilteredTable {

    CLUSTERS("clusters", "id"),
    CLUSTER_MEMBERSHIPS("cluster_memberships", "cluster_id"),
    DOMAINS("domains", "id"),
    RESOURCES("resources", "id");

    private final String tableName;
    private final String filterKey;

    FilteredTable(String tableName, String filterKey) {
        this.tableName = tableName;
        this.filterKey = filterKey;
    }

    public String tableName() {
        return tableName;
    }

    /** Column the visibility predicate is evaluated against. */
    public String filterKey() {
        return filterKey;
    }
}
