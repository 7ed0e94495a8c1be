package com.strata.hierarchy.api.dto;

import jakarta.validation.constraints.Size;

/** Body of {@code PATCH /clusters/{id}/members/{identityId}}; absent fields stay unchanged. */
public record MemberUpdateRequest(
        String role,
        @Size(max = 1000, message = "is too long (maximum is 1000 characters)") String comment) {}
