package com.strata.hierarchy.repository;

import com.strata.database.policy.FilteredTable;
import com.strata.database.session.BoundSession;
import com.strata.hierarchy.domain.ListQuery;
import com.strata.hierarchy.domain.Membership;
import com.strata.hierarchy.domain.PageResult;
import com.strata.security.ClusterRole;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.stereotype.Repository;

/** JDBC access to {@code cluster_memberships}, filtered like every other hierarchy table. */
@Repository
public class MembershipRepository {

    private static final String COLUMNS =
            "m.id, m.cluster_id, m.identity_id, m.role, m.comment, m.created_at, m.updated_at";

    private static final Map<String, String> SORT_COLUMNS =
            Map.of(
                    "identity_id", "m.identity_id",
                    "role", "m.role",
                    "created_at", "m.created_at");

    private static final RowMapper<Membership> MAPPER =
            (rs, rowNum) -> {
                String role = rs.getString("role");
                return new Membership(
                        rs.getObject("id", UUID.class),
                        rs.getObject("cluster_id", UUID.class),
                        rs.getString("identity_id"),
                        ClusterRole.fromValue(role)
                                .orElseThrow(
                                        () ->
                                                new IllegalStateException(
                                                        "Unknown role in cluster_memberships: "
                                                                + role)),
                        rs.getString("comment"),
                        rs.getObject("created_at", OffsetDateTime.class),
                        rs.getObject("updated_at", OffsetDateTime.class));
            };

    /**
     * Locks the cluster row for the rest of the transaction. Role changes on one cluster queue
     * behind this lock, so each sees the owners the previous one committed.
     *
     * @return false if the cluster is not visible to the caller
     */
    public boolean lockCluster(BoundSession session, UUID clusterId) {
        String sql =
                "SELECT c.id FROM clusters c WHERE c.id = :clusterId AND "
                        + session.rowFilter().predicate(FilteredTable.CLUSTERS, "c.id")
                        + " FOR UPDATE";
        return !session.namedJdbc()
                .queryForList(sql, new MapSqlParameterSource("clusterId", clusterId), UUID.class)
                .isEmpty();
    }

    public Optional<Membership> find(BoundSession session, UUID clusterId, String identityId) {
        String sql =
                "SELECT "
                        + COLUMNS
                        + " FROM "
                        + session.rowFilter().visible(FilteredTable.CLUSTER_MEMBERSHIPS, "m")
                        + " WHERE m.cluster_id = :clusterId AND m.identity_id = :identityId";
        var params =
                new MapSqlParameterSource()
                        .addValue("clusterId", clusterId)
                        .addValue("identityId", identityId);
        return session.namedJdbc().query(sql, params, MAPPER).stream().findFirst();
    }

    /**
     * The caller's roles in the live clusters {@code entityId} is reachable from.
     *
     * @param link junction chain start: {@link LinkType#CLUSTER_DOMAIN} for a domain id, {@link
     *     LinkType#DOMAIN_RESOURCE} for a resource id
     */
    public List<ClusterRole> callerRolesAbove(BoundSession session, LinkType link, UUID entityId) {
        String reach =
                link == LinkType.CLUSTER_DOMAIN
                        ? " JOIN cluster_domain_links cd ON cd.cluster_id = m.cluster_id"
                                + " WHERE cd.domain_id = :entityId"
                        : " JOIN cluster_domain_links cd ON cd.cluster_id = m.cluster_id"
                                + " JOIN domain_resource_links dr ON dr.domain_id = cd.domain_id"
                                + " WHERE dr.resource_id = :entityId";
        String sql =
                "SELECT m.role FROM "
                        + session.rowFilter().visible(FilteredTable.CLUSTER_MEMBERSHIPS, "m")
                        + " JOIN "
                        + session.rowFilter().visible(FilteredTable.CLUSTERS, "c")
                        + " ON c.id = m.cluster_id AND c.deleted_at IS NULL"
                        + reach
                        + " AND m.identity_id = :identityId";
        var params =
                new MapSqlParameterSource()
                        .addValue("entityId", entityId)
                        .addValue("identityId", session.identityId());
        return session.namedJdbc().queryForList(sql, params, String.class).stream()
                .map(ClusterRole::fromValue)
                .flatMap(Optional::stream)
                .toList();
    }

    public void insert(BoundSession session, Membership membership) {
        var params =
                new MapSqlParameterSource()
                        .addValue("id", membership.id())
                        .addValue("clusterId", membership.clusterId())
                        .addValue("identityId", membership.identityId())
                        .addValue("role", membership.role().value())
                        .addValue("comment", membership.comment(), Types.VARCHAR);
        session.namedJdbc()
                .update(
                        "INSERT INTO cluster_memberships"
                                + " (id, cluster_id, identity_id, role, comment, created_at,"
                                + " updated_at)"
                                + " VALUES (:id, :clusterId, :identityId, :role, :comment,"
                                + " CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)",
                        params);
    }

    public boolean update(
            BoundSession session, UUID clusterId, String identityId, ClusterRole role, String comment) {
        var params =
                new MapSqlParameterSource()
                        .addValue("clusterId", clusterId)
                        .addValue("identityId", identityId)
                        .addValue("role", role.value())
                        .addValue("comment", comment, Types.VARCHAR);
        String sql =
                "UPDATE cluster_memberships SET role = :role, comment = :comment,"
                        + " updated_at = CURRENT_TIMESTAMP"
                        + " WHERE cluster_id = :clusterId AND identity_id = :identityId AND "
                        + session.rowFilter()
                                .predicate(
                                        FilteredTable.CLUSTER_MEMBERSHIPS,
                                        "cluster_memberships.cluster_id");
        return session.namedJdbc().update(sql, params) == 1;
    }

    public boolean delete(BoundSession session, UUID clusterId, String identityId) {
        var params =
                new MapSqlParameterSource()
                        .addValue("clusterId", clusterId)
                        .addValue("identityId", identityId);
        String sql =
                "DELETE FROM cluster_memberships"
                        + " WHERE cluster_id = :clusterId AND identity_id = :identityId AND "
                        + session.rowFilter()
                                .predicate(
                                        FilteredTable.CLUSTER_MEMBERSHIPS,
                                        "cluster_memberships.cluster_id");
        return session.namedJdbc().update(sql, params) == 1;
    }

    public long countOwners(BoundSession session, UUID clusterId) {
        String sql =
                "SELECT count(*) FROM "
                        + session.rowFilter().visible(FilteredTable.CLUSTER_MEMBERSHIPS, "m")
                        + " WHERE m.cluster_id = :clusterId AND m.role = :role";
        var params =
                new MapSqlParameterSource()
                        .addValue("clusterId", clusterId)
                        .addValue("role", ClusterRole.OWNER.value());
        Long count = session.namedJdbc().queryForObject(sql, params, Long.class);
        return count == null ? 0 : count;
    }

    /**
     * Pages through a cluster's memberships. {@code search} matches identity ids and comments.
     *
     * @throws IllegalArgumentException for an unsupported {@code sortBy}
     */
    public PageResult<Membership> list(BoundSession session, UUID clusterId, ListQuery query) {
        String orderColumn = "m.created_at";
        if (query.sortBy() != null) {
            orderColumn = SORT_COLUMNS.get(query.sortBy());
            if (orderColumn == null) {
                throw new IllegalArgumentException(
                        "sort_by must be one of " + SORT_COLUMNS.keySet().stream().sorted().toList());
            }
        }
        var params = new MapSqlParameterSource("clusterId", clusterId);
        String where = " WHERE m.cluster_id = :clusterId";
        if (query.searchPattern() != null) {
            where +=
                    " AND (lower(m.identity_id) LIKE :search ESCAPE '\\'"
                            + " OR lower(coalesce(m.comment, '')) LIKE :search ESCAPE '\\')";
            params.addValue("search", query.searchPattern());
        }
        String from = session.rowFilter().visible(FilteredTable.CLUSTER_MEMBERSHIPS, "m");

        Long total =
                session.namedJdbc()
                        .queryForObject("SELECT count(*) FROM " + from + where, params, Long.class);

        String direction = query.sortOrder().name();
        params.addValue("limit", query.perPage()).addValue("offset", query.offset());
        List<Membership> items =
                session.namedJdbc()
                        .query(
                                "SELECT "
                                        + COLUMNS
                                        + " FROM "
                                        + from
                                        + where
                                        + " ORDER BY "
                                        + orderColumn
                                        + " "
                                        + direction
                                        + ", m.identity_id "
                                        + direction
                                        + " LIMIT :limit OFFSET :offset",
                                params,
                                MAPPER);
        return new PageResult<>(items, query.page(), query.perPage(), total == null ? 0 : total);
    }
}
