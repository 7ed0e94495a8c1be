package com.strata.database.policy;

import com.strata.database.session.SessionVariableDialect;

/**
 * Membership-closure visibility predicates.
 *
 * <ul>
 *   <li>a cluster is visible when the bound identity holds any membership in it
 *   <li>a membership row is visible when its cluster is visible
 *   <li>a domain is visible when it is linked to a visible cluster
 *   <li>a resource is visible when it is linked to a visible domain
 * </ul>
 *
 * <p>The identity is read from the session variable inside the SQL, never supplied as a query
 * parameter, so a repository cannot widen visibility by passing a different identity. With no
 * bound identity the predicates match nothing. Each predicate is a correlated {@code EXISTS} over
 * the junction primary keys and the {@code (identity_id, cluster_id)} membership index.
 *
 * <p>PostgreSQL deployments attach the same rules as row-level-security policies
 * ({@code db/migration/postgresql}); these predicates keep other engines equally filtered.
 */
public final class RowFilterPolicy {

    private final String identity;

    public RowFilterPolicy(SessionVariableDialect dialect) {
        this.identity = dialect.currentIdentityExpression();
    }

    /**
     * A derived table exposing only the visible rows of {@code table}, aliased as {@code alias}.
     * Use it in place of the bare table name in every read.
     */
    public String visible(FilteredTable table, String alias) {
        String inner = "rf_" + alias;
        return "(SELECT "
                + inner
                + ".* FROM "
                + table.tableName()
                + " "
                + inner
                + " WHERE "
                + predicate(table, inner + "." + table.filterKey())
                + ") "
                + alias;
    }

    /**
     * The visibility predicate for {@code table}, evaluated against {@code keyColumn} (a
     * qualified column holding the table's filter key). Use it in the WHERE clause of updates and
     * deletes.
     */
    public String predicate(FilteredTable table, String keyColumn) {
        return switch (table) {
            case CLUSTERS, CLUSTER_MEMBERSHIPS -> clusterClosure(keyColumn);
            case DOMAINS -> domainClosure(keyColumn);
            case RESOURCES -> resourceClosure(keyColumn);
        };
    }

    private String clusterClosure(String clusterId) {
        return "EXISTS (SELECT 1 FROM cluster_memberships rfm"
                + " WHERE rfm.cluster_id = "
                + clusterId
                + " AND rfm.identity_id = "
                + identity
                + ")";
    }

    private String domainClosure(String domainId) {
        return "EXISTS (SELECT 1 FROM cluster_domain_links rfcd"
                + " JOIN cluster_memberships rfm ON rfm.cluster_id = rfcd.cluster_id"
                + " WHERE rfcd.domain_id = "
                + domainId
                + " AND rfm.identity_id = "
                + identity
                + ")";
    }

    private String resourceClosure(String resourceId) {
        return "EXISTS (SELECT 1 FROM domain_resource_links rfdr"
                + " JOIN cluster_domain_links rfcd ON rfcd.domain_id = rfdr.domain_id"
                + " JOIN cluster_memberships rfm ON rfm.cluster_id = rfcd.cluster_id"
                + " WHERE rfdr.resource_id = "
                + resourceId
                + " AND rfm.identity_id = "
                + identity
                + ")";
    }
}
