package com.strata.hierarchy.domain;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * A cluster, domain or resource row.
 *
 * <p>{@code description} applies to clusters and domains; {@code resourceType} and {@code
 * configuration} only to resources. Fields that do not apply to the kind are null.
 */
public record HierarchyEntity(
        UUID id,
        EntityKind kind,
        String name,
        String description,
        String resourceType,
        Map<String, Object> configuration,
        String createdBy,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        OffsetDateTime deletedAt) {

    public HierarchyEntity {
        configuration = configuration == null ? null : Map.copyOf(configuration);
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }
}
