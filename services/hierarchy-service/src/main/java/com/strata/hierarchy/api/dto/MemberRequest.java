package com.strata.hierarchy.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/** Body of {@code POST /clusters/{id}/members}. */
public record MemberRequest(
        @NotBlank(message = "can't be blank") String identityId,
        @NotBlank(message = "can't be blank") String role,
        @Size(max = 1000, message = "is too long (maximum is 1000 characters)") String comment) {}
