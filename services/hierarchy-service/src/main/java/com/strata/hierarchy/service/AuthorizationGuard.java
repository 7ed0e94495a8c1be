package com.strata.hierarchy.service;

import com.strata.database.session.BoundSession;
import com.strata.hierarchy.domain.EntityKind;
import com.strata.hierarchy.domain.ForbiddenException;
import com.strata.hierarchy.domain.Membership;
import com.strata.hierarchy.domain.NotFoundException;
import com.strata.hierarchy.repository.LinkType;
import com.strata.hierarchy.repository.MembershipRepository;
import com.strata.security.AuthorizationDecision;
import com.strata.security.ClusterAction;
import com.strata.security.ClusterRole;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Application-level permission checks.
 *
 * <p>Looks up the caller's role and evaluates the fixed {@link com.strata.security.PermissionMatrix}.
 * For a domain or resource the caller's role is the strongest one it holds in any live cluster the
 * entity is reachable from.
 *
 * <p>A caller with no role gets {@link NotFoundException} from the {@code require} methods, never
 * {@link ForbiddenException}: to a non-member the target does not exist.
 */
@Component
public class AuthorizationGuard {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationGuard.class);

    private final MembershipRepository memberships;

    public AuthorizationGuard(MembershipRepository memberships) {
        this.memberships = memberships;
    }

    public AuthorizationDecision authorize(BoundSession session, UUID clusterId, ClusterAction action) {
        ClusterRole role =
                memberships.find(session, clusterId, session.identityId())
                        .map(Membership::role)
                        .orElse(null);
        return AuthorizationDecision.evaluate(role, action);
    }

    public AuthorizationDecision authorizeDomain(
            BoundSession session, UUID domainId, ClusterAction action) {
        return AuthorizationDecision.evaluate(
                strongestRole(session, LinkType.CLUSTER_DOMAIN, domainId), action);
    }

    public AuthorizationDecision authorizeResource(
            BoundSession session, UUID resourceId, ClusterAction action) {
        return AuthorizationDecision.evaluate(
                strongestRole(session, LinkType.DOMAIN_RESOURCE, resourceId), action);
    }

    public AuthorizationDecision authorize(
            BoundSession session, EntityKind kind, UUID id, ClusterAction action) {
        return switch (kind) {
            case CLUSTER -> authorize(session, id, action);
            case DOMAIN -> authorizeDomain(session, id, action);
            case RESOURCE -> authorizeResource(session, id, action);
        };
    }

    /**
     * Throws unless the caller may perform {@code action} on the entity.
     *
     * @return the caller's effective role
     * @throws NotFoundException if the caller has no role reaching the entity
     * @throws ForbiddenException if the role does not permit the action
     */
    public ClusterRole require(BoundSession session, EntityKind kind, UUID id, ClusterAction action) {
        AuthorizationDecision decision = authorize(session, kind, id, action);
        if (decision.allowed()) {
            return decision.role();
        }
        log.debug(
                "Denied {} on {} {} for {}: {}",
                action.value(),
                kind.label(),
                id,
                session.identityId(),
                decision.reason());
        if (decision.isNonMember()) {
            throw NotFoundException.of(kind, id);
        }
        throw new ForbiddenException(
                "You are not allowed to "
                        + action.value()
                        + " this "
                        + kind.label().toLowerCase(Locale.ROOT));
    }

    private ClusterRole strongestRole(BoundSession session, LinkType link, UUID entityId) {
        return memberships.callerRolesAbove(session, link, entityId).stream()
                .max(ClusterRole.BY_RANK)
                .orElse(null);
    }
}
