package com.strata.hierarchy.api.dto;

import com.strata.hierarchy.domain.EntityAttributes;
import jakarta.validation.constraints.Size;

/** Body for creating or updating a cluster or domain. On update absent fields stay unchanged. */
public record EntityRequest(
        @Size(max = 255, message = "is too long (maximum is 255 characters)") String name,
        @Size(max = 10_000, message = "is too long (maximum is 10000 characters)")
                String description) {

    public EntityAttributes toAttributes() {
        return new EntityAttributes(name, description, null, null);
    }
}
