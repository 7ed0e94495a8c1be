package com.strata.hierarchy.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.strata.database.policy.FilteredTable;
import com.strata.database.session.BoundSession;
import com.strata.hierarchy.domain.EntityAttributes;
import com.strata.hierarchy.domain.EntityKind;
import com.strata.hierarchy.domain.HierarchyEntity;
import com.strata.hierarchy.domain.ListQuery;
import com.strata.hierarchy.domain.PageResult;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.stereotype.Repository;

/**
 * JDBC access to the {@code clusters}, {@code domains} and {@code resources} tables.
 *
 * <p>Every statement runs on the caller's {@link BoundSession}. Reads select from the row filter's
 * visible derived table and writes carry the row filter predicate, so a row outside the caller's
 * membership closure can be neither returned nor modified from here.
 */
@Repository
public class EntityRepository {

    private static final TypeReference<Map<String, Object>> CONFIGURATION_TYPE =
            new TypeReference<>() {};

    private static final Map<EntityKind, EntityTable> TABLES =
            Map.of(
                    EntityKind.CLUSTER,
                    EntityTable.described("clusters", FilteredTable.CLUSTERS),
                    EntityKind.DOMAIN,
                    EntityTable.described("domains", FilteredTable.DOMAINS),
                    EntityKind.RESOURCE,
                    new EntityTable(
                            "resources",
                            FilteredTable.RESOURCES,
                            "e.id, e.name, e.resource_type, e.configuration, e.created_by,"
                                    + " e.created_at, e.updated_at, e.deleted_at",
                            Map.of(
                                    "name", "e.name",
                                    "resource_type", "e.resource_type",
                                    "created_at", "e.created_at",
                                    "updated_at", "e.updated_at"),
                            List.of("e.name", "coalesce(e.resource_type, '')")));

    private final ObjectMapper objectMapper;

    public EntityRepository(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void insert(BoundSession session, EntityKind kind, UUID id, EntityAttributes attributes) {
        var params =
                new MapSqlParameterSource()
                        .addValue("id", id)
                        .addValue("name", attributes.name())
                        .addValue("createdBy", session.identityId());
        String sql;
        if (kind == EntityKind.RESOURCE) {
            params.addValue("resourceType", attributes.resourceType(), Types.VARCHAR)
                    .addValue("configuration", toJson(attributes.configuration()));
            sql =
                    "INSERT INTO resources"
                            + " (id, name, resource_type, configuration, created_by, created_at,"
                            + " updated_at)"
                            + " VALUES (:id, :name, :resourceType, :configuration, :createdBy,"
                            + " CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)";
        } else {
            params.addValue("description", attributes.description(), Types.VARCHAR);
            sql =
                    "INSERT INTO "
                            + table(kind).name()
                            + " (id, name, description, created_by, created_at, updated_at)"
                            + " VALUES (:id, :name, :description, :createdBy, CURRENT_TIMESTAMP,"
                            + " CURRENT_TIMESTAMP)";
        }
        session.namedJdbc().update(sql, params);
    }

    public Optional<HierarchyEntity> findById(
            BoundSession session, EntityKind kind, UUID id, boolean includeDeleted) {
        EntityTable table = table(kind);
        String sql =
                "SELECT "
                        + table.columns()
                        + " FROM "
                        + session.rowFilter().visible(table.filtered(), "e")
                        + " WHERE e.id = :id"
                        + (includeDeleted ? "" : " AND e.deleted_at IS NULL");
        return session.namedJdbc()
                .query(sql, new MapSqlParameterSource("id", id), mapper(kind))
                .stream()
                .findFirst();
    }

    /**
     * Lists visible entities of {@code kind}, restricted to the children of {@code parentId} when
     * it is not null.
     *
     * @throws IllegalArgumentException if the query sorts by a column this kind does not offer
     */
    public PageResult<HierarchyEntity> list(
            BoundSession session, EntityKind kind, UUID parentId, ListQuery query) {
        EntityTable table = table(kind);
        String orderColumn = table.sortColumn(query.sortBy());

        var params = new MapSqlParameterSource();
        var from = new StringBuilder(session.rowFilter().visible(table.filtered(), "e"));
        var where = new ArrayList<String>();
        if (parentId != null) {
            LinkType link = LinkType.above(kind);
            from.append(" JOIN ")
                    .append(link.table())
                    .append(" l ON l.")
                    .append(link.childColumn())
                    .append(" = e.id");
            where.add("l." + link.parentColumn() + " = :parentId");
            params.addValue("parentId", parentId);
        }
        if (!query.includeDeleted()) {
            where.add("e.deleted_at IS NULL");
        }
        if (query.searchPattern() != null) {
            where.add(
                    "("
                            + String.join(
                                    " OR ",
                                    table.searchColumns().stream()
                                            .map(c -> "lower(" + c + ") LIKE :search ESCAPE '\\'")
                                            .toList())
                            + ")");
            params.addValue("search", query.searchPattern());
        }
        String whereClause = where.isEmpty() ? "" : " WHERE " + String.join(" AND ", where);

        Long total =
                session.namedJdbc()
                        .queryForObject(
                                "SELECT count(*) FROM " + from + whereClause, params, Long.class);

        String direction = query.sortOrder().name();
        params.addValue("limit", query.perPage()).addValue("offset", query.offset());
        List<HierarchyEntity> items =
                session.namedJdbc()
                        .query(
                                "SELECT "
                                        + table.columns()
                                        + " FROM "
                                        + from
                                        + whereClause
                                        + " ORDER BY "
                                        + orderColumn
                                        + " "
                                        + direction
                                        + ", e.id "
                                        + direction
                                        + " LIMIT :limit OFFSET :offset",
                                params,
                                mapper(kind));
        return new PageResult<>(items, query.page(), query.perPage(), total == null ? 0 : total);
    }

    /** Applies the non-null attributes to a live entity; returns false if none was updated. */
    public boolean update(BoundSession session, EntityKind kind, UUID id, EntityAttributes changes) {
        EntityTable table = table(kind);
        var params = new MapSqlParameterSource("id", id);
        var assignments = new ArrayList<String>();
        if (changes.name() != null) {
            assignments.add("name = :name");
            params.addValue("name", changes.name());
        }
        if (kind == EntityKind.RESOURCE) {
            if (changes.resourceType() != null) {
                assignments.add("resource_type = :resourceType");
                params.addValue("resourceType", changes.resourceType());
            }
            if (changes.configuration() != null) {
                assignments.add("configuration = :configuration");
                params.addValue("configuration", toJson(changes.configuration()));
            }
        } else if (changes.description() != null) {
            assignments.add("description = :description");
            params.addValue("description", changes.description());
        }
        assignments.add("updated_at = CURRENT_TIMESTAMP");

        String sql =
                "UPDATE "
                        + table.name()
                        + " SET "
                        + String.join(", ", assignments)
                        + " WHERE id = :id AND deleted_at IS NULL AND "
                        + session.rowFilter().predicate(table.filtered(), table.name() + ".id");
        return session.namedJdbc().update(sql, params) == 1;
    }

    public boolean softDelete(BoundSession session, EntityKind kind, UUID id) {
        EntityTable table = table(kind);
        String sql =
                "UPDATE "
                        + table.name()
                        + " SET deleted_at = CURRENT_TIMESTAMP, updated_at = CURRENT_TIMESTAMP"
                        + " WHERE id = :id AND deleted_at IS NULL AND "
                        + session.rowFilter().predicate(table.filtered(), table.name() + ".id");
        return session.namedJdbc().update(sql, new MapSqlParameterSource("id", id)) == 1;
    }

    /** Deletes the row; junction rows and memberships go with it through the foreign keys. */
    public boolean hardDelete(BoundSession session, EntityKind kind, UUID id) {
        EntityTable table = table(kind);
        String sql =
                "DELETE FROM "
                        + table.name()
                        + " WHERE id = :id AND "
                        + session.rowFilter().predicate(table.filtered(), table.name() + ".id");
        return session.namedJdbc().update(sql, new MapSqlParameterSource("id", id)) == 1;
    }

    /** Live children linked below {@code id}; always zero for resources. */
    public long countLiveChildren(BoundSession session, EntityKind kind, UUID id) {
        LinkType link = LinkType.below(kind);
        if (link == null) {
            return 0;
        }
        String sql =
                "SELECT count(*) FROM "
                        + session.rowFilter().visible(table(link.childKind()).filtered(), "c")
                        + " JOIN "
                        + link.table()
                        + " l ON l."
                        + link.childColumn()
                        + " = c.id"
                        + " WHERE l."
                        + link.parentColumn()
                        + " = :id AND c.deleted_at IS NULL";
        Long count =
                session.namedJdbc().queryForObject(sql, new MapSqlParameterSource("id", id), Long.class);
        return count == null ? 0 : count;
    }

    /** Whether {@code createdBy} already has a live cluster with this name, ignoring case. */
    public boolean clusterNameTaken(
            BoundSession session, String createdBy, String name, UUID excludingId) {
        var params =
                new MapSqlParameterSource()
                        .addValue("createdBy", createdBy)
                        .addValue("name", name);
        String sql =
                "SELECT count(*) FROM "
                        + session.rowFilter().visible(FilteredTable.CLUSTERS, "e")
                        + " WHERE e.created_by = :createdBy AND lower(e.name) = lower(:name)"
                        + " AND e.deleted_at IS NULL"
                        + excluding(excludingId, params);
        Long count = session.namedJdbc().queryForObject(sql, params, Long.class);
        return count != null && count > 0;
    }

    /**
     * Whether a live {@code kind} with this name, ignoring case, is already linked under any of
     * {@code parentIds}.
     */
    public boolean childNameTaken(
            BoundSession session,
            EntityKind kind,
            Collection<UUID> parentIds,
            String name,
            UUID excludingId) {
        if (parentIds.isEmpty()) {
            return false;
        }
        LinkType link = LinkType.above(kind);
        var params =
                new MapSqlParameterSource()
                        .addValue("parentIds", parentIds)
                        .addValue("name", name);
        String sql =
                "SELECT count(*) FROM "
                        + session.rowFilter().visible(table(kind).filtered(), "e")
                        + " JOIN "
                        + link.table()
                        + " l ON l."
                        + link.childColumn()
                        + " = e.id"
                        + " WHERE l."
                        + link.parentColumn()
                        + " IN (:parentIds) AND lower(e.name) = lower(:name)"
                        + " AND e.deleted_at IS NULL"
                        + excluding(excludingId, params);
        Long count = session.namedJdbc().queryForObject(sql, params, Long.class);
        return count != null && count > 0;
    }

    private static String excluding(UUID excludingId, MapSqlParameterSource params) {
        if (excludingId == null) {
            return "";
        }
        params.addValue("excludingId", excludingId);
        return " AND e.id <> :excludingId";
    }

    private static EntityTable table(EntityKind kind) {
        return TABLES.get(kind);
    }

    private RowMapper<HierarchyEntity> mapper(EntityKind kind) {
        return (rs, rowNum) ->
                new HierarchyEntity(
                        rs.getObject("id", UUID.class),
                        kind,
                        rs.getString("name"),
                        kind == EntityKind.RESOURCE ? null : rs.getString("description"),
                        kind == EntityKind.RESOURCE ? rs.getString("resource_type") : null,
                        kind == EntityKind.RESOURCE ? fromJson(rs) : null,
                        rs.getString("created_by"),
                        rs.getObject("created_at", OffsetDateTime.class),
                        rs.getObject("updated_at", OffsetDateTime.class),
                        rs.getObject("deleted_at", OffsetDateTime.class));
    }

    /**
     * The JSON stored for a resource configuration; null stores as an empty object.
     *
     * @throws IllegalArgumentException if the map cannot be serialized
     */
    public String toJson(Map<String, Object> configuration) {
        try {
            return objectMapper.writeValueAsString(configuration == null ? Map.of() : configuration);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("configuration cannot be serialized as JSON", e);
        }
    }

    private Map<String, Object> fromJson(ResultSet rs) throws SQLException {
        String json = rs.getString("configuration");
        try {
            return json == null ? Map.of() : objectMapper.readValue(json, CONFIGURATION_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(
                    "Stored configuration of resource " + rs.getObject("id") + " is not valid JSON",
                    e);
        }
    }

    /**
     * Per-kind table layout.
     *
     * @param sortColumns {@code sort_by} value to qualified column
     */
    private record EntityTable(
            String name,
            FilteredTable filtered,
            String columns,
            Map<String, String> sortColumns,
            List<String> searchColumns) {

        static EntityTable described(String name, FilteredTable filtered) {
            return new EntityTable(
                    name,
                    filtered,
                    "e.id, e.name, e.description, e.created_by, e.created_at, e.updated_at,"
                            + " e.deleted_at",
                    Map.of(
                            "name", "e.name",
                            "created_at", "e.created_at",
                            "updated_at", "e.updated_at"),
                    List.of("e.name", "coalesce(e.description, '')"));
        }

        String sortColumn(String sortBy) {
            if (sortBy == null || sortBy.isBlank()) {
                return "e.created_at";
            }
            String column = sortColumns.get(sortBy);
            if (column == null) {
                throw new IllegalArgumentException(
                        "sort_by must be one of " + sortColumns.keySet().stream().sorted().toList());
            }
            return column;
        }
    }
}
