package com.strata.hierarchy.repository;

import com.strata.database.policy.FilteredTable;
import com.strata.database.session.BoundSession;
import java.util.List;
import java.util.UUID;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.stereotype.Repository;

/**
 * JDBC access to the junction tables.
 *
 * <p>Junction rows carry only ids. Callers check visibility of both ends before linking.
 */
@Repository
public class LinkRepository {

    /**
     * Inserts the pair unless it already exists.
     *
     * <p>Two transactions racing on the same pair can both pass the {@code NOT EXISTS}; the loser
     * then fails on the primary key with a {@link org.springframework.dao.DuplicateKeyException}.
     *
     * @return true if a row was inserted
     */
    public boolean insertIfAbsent(BoundSession session, LinkType link, UUID parentId, UUID childId) {
        String sql =
                "INSERT INTO "
                        + link.table()
                        + " ("
                        + link.parentColumn()
                        + ", "
                        + link.childColumn()
                        + ", created_at)"
                        + " SELECT CAST(:parentId AS UUID), CAST(:childId AS UUID), CURRENT_TIMESTAMP"
                        + " WHERE NOT EXISTS (SELECT 1 FROM "
                        + link.table()
                        + " WHERE "
                        + link.parentColumn()
                        + " = :parentId AND "
                        + link.childColumn()
                        + " = :childId)";
        return session.namedJdbc().update(sql, pair(parentId, childId)) == 1;
    }

    /** @return true if a row was deleted */
    public boolean delete(BoundSession session, LinkType link, UUID parentId, UUID childId) {
        String sql =
                "DELETE FROM "
                        + link.table()
                        + " WHERE "
                        + link.parentColumn()
                        + " = :parentId AND "
                        + link.childColumn()
                        + " = :childId";
        return session.namedJdbc().update(sql, pair(parentId, childId)) == 1;
    }

    /** Visible, live parents {@code childId} is linked under. */
    public List<UUID> parentsOf(BoundSession session, LinkType link, UUID childId) {
        FilteredTable parentTable =
                link == LinkType.CLUSTER_DOMAIN ? FilteredTable.CLUSTERS : FilteredTable.DOMAINS;
        String sql =
                "SELECT p.id FROM "
                        + session.rowFilter().visible(parentTable, "p")
                        + " JOIN "
                        + link.table()
                        + " l ON l."
                        + link.parentColumn()
                        + " = p.id"
                        + " WHERE l."
                        + link.childColumn()
                        + " = :childId AND p.deleted_at IS NULL";
        return session.namedJdbc()
                .queryForList(sql, new MapSqlParameterSource("childId", childId), UUID.class);
    }

    private static MapSqlParameterSource pair(UUID parentId, UUID childId) {
        return new MapSqlParameterSource()
                .addValue("parentId", parentId)
                .addValue("childId", childId);
    }
}
