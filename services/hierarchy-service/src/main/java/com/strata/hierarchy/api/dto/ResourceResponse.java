package com.strata.hierarchy.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.strata.hierarchy.domain.HierarchyEntity;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResourceResponse(
        UUID id,
        String name,
        String resourceType,
        Map<String, Object> configuration,
        String createdBy,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        OffsetDateTime deletedAt) {

    public static ResourceResponse from(HierarchyEntity entity) {
        return new ResourceResponse(
                entity.id(),
                entity.name(),
                entity.resourceType(),
                entity.configuration(),
                entity.createdBy(),
                entity.createdAt(),
                entity.updatedAt(),
                entity.deletedAt());
    }
}
