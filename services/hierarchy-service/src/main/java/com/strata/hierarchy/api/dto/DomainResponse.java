package com.strata.hierarchy.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.strata.hierarchy.domain.HierarchyEntity;
import java.time.OffsetDateTime;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DomainResponse(
        UUID id,
        String name,
        String description,
        String createdBy,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        OffsetDateTime deletedAt) {

    public static DomainResponse from(HierarchyEntity entity) {
        return new DomainResponse(
                entity.id(),
                entity.name(),
                entity.description(),
                entity.createdBy(),
                entity.createdAt(),
                entity.updatedAt(),
                entity.deletedAt());
    }
}
