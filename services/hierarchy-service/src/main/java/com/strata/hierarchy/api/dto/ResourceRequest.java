package com.strata.hierarchy.api.dto;

import com.strata.hierarchy.domain.EntityAttributes;
import jakarta.validation.constraints.Size;
import java.util.Map;

/** Body for creating or updating a resource. */
public record ResourceRequest(
        @Size(max = 255, message = "is too long (maximum is 255 characters)") String name,
        @Size(max = 100, message = "is too long (maximum is 100 characters)") String resourceType,
        Map<String, Object> configuration) {

    public EntityAttributes toAttributes() {
        return new EntityAttributes(name, null, resourceType, configuration);
    }
}
