package com.strata.hierarchy.domain;

import com.strata.security.ClusterRole;
import java.time.OffsetDateTime;
import java.util.UUID;

/** One identity's role in one cluster. */
public record Membership(
        UUID id,
        UUID clusterId,
        String identityId,
        ClusterRole role,
        String comment,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt) {

    public boolean isOwner() {
        return role == ClusterRole.OWNER;
    }
}
