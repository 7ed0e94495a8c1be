package com.strata.hierarchy.service;

import com.strata.hierarchy.domain.Membership;
import com.strata.security.ClusterRole;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes one line per membership change to the {@value #AUDIT_LOGGER} logger, which deployments
 * can route to a separate appender.
 */
@Component
public class MembershipAuditLogger {

    public static final String AUDIT_LOGGER = "com.strata.hierarchy.membership.audit";

    private static final Logger audit = LoggerFactory.getLogger(AUDIT_LOGGER);

    public void added(String actor, Membership membership) {
        audit.info(
                "membership.added cluster={} identity={} role={} actor={}",
                membership.clusterId(),
                membership.identityId(),
                membership.role().value(),
                actor);
    }

    public void changed(String actor, Membership before, Membership after) {
        audit.info(
                "membership.changed cluster={} identity={} role={}->{} actor={}",
                after.clusterId(),
                after.identityId(),
                before.role().value(),
                after.role().value(),
                actor);
    }

    public void removed(String actor, Membership membership) {
        audit.info(
                "membership.removed cluster={} identity={} role={} actor={}",
                membership.clusterId(),
                membership.identityId(),
                membership.role().value(),
                actor);
    }

    public void ownershipTransferred(
            String actor, UUID clusterId, String newOwner, ClusterRole actorRole) {
        audit.info(
                "membership.ownership_transferred cluster={} from={} to={} from_role={}",
                clusterId,
                actor,
                newOwner,
                actorRole.value());
    }
}
