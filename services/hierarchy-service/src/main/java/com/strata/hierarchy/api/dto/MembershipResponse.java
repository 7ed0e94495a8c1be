package com.strata.hierarchy.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.strata.hierarchy.domain.Membership;
import java.time.OffsetDateTime;
import java.util.UUID;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record MembershipResponse(
        UUID id,
        UUID clusterId,
        String identityId,
        String role,
        String comment,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt) {

    public static MembershipResponse from(Membership membership) {
        return new MembershipResponse(
                membership.id(),
                membership.clusterId(),
                membership.identityId(),
                membership.role().value(),
                membership.comment(),
                membership.createdAt(),
                membership.updatedAt());
    }
}
