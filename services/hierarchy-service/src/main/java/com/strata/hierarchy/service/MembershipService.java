package com.strata.hierarchy.service;

import com.strata.database.session.SessionContextPropagator;
import com.strata.hierarchy.domain.ConflictException;
import com.strata.hierarchy.domain.ListQuery;
import com.strata.hierarchy.domain.Membership;
import com.strata.hierarchy.domain.PageResult;
import com.strata.security.ClusterRole;
import com.strata.security.IdentityContext;
import java.util.UUID;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

/** Membership use cases, each in its own bound session. */
@Service
public class MembershipService {

    private final SessionContextPropagator sessions;
    private final MembershipRegistry registry;

    public MembershipService(SessionContextPropagator sessions, MembershipRegistry registry) {
        this.sessions = sessions;
        this.registry = registry;
    }

    public PageResult<Membership> list(IdentityContext identity, UUID clusterId, ListQuery query) {
        return sessions.withContext(
                identity, session -> registry.listMembers(session, clusterId, query));
    }

    public Membership add(
            IdentityContext identity,
            UUID clusterId,
            String identityId,
            ClusterRole role,
            String comment) {
        try {
            return sessions.withContext(
                    identity,
                    session -> registry.addMember(session, clusterId, identityId, role, comment));
        } catch (DuplicateKeyException e) {
            throw new ConflictException(identityId + " is already a member of this cluster");
        }
    }

    public Membership update(
            IdentityContext identity,
            UUID clusterId,
            String identityId,
            ClusterRole role,
            String comment) {
        return sessions.withContext(
                identity,
                session -> registry.updateMember(session, clusterId, identityId, role, comment));
    }

    public void remove(IdentityContext identity, UUID clusterId, String identityId) {
        sessions.withContext(
                identity,
                session -> {
                    registry.removeMember(session, clusterId, identityId);
                    return null;
                });
    }

    public Membership transferOwnership(IdentityContext identity, UUID clusterId, String newOwnerId) {
        return sessions.withContext(
                identity, session -> registry.transferOwnership(session, clusterId, newOwnerId));
    }
}
