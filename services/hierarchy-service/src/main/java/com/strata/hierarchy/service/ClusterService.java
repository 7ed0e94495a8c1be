package com.strata.hierarchy.service;

import com.strata.database.session.SessionContextPropagator;
import com.strata.hierarchy.domain.EntityAttributes;
import com.strata.hierarchy.domain.EntityKind;
import com.strata.hierarchy.domain.HierarchyEntity;
import com.strata.hierarchy.domain.ListQuery;
import com.strata.hierarchy.domain.PageResult;
import com.strata.security.ClusterAction;
import com.strata.security.IdentityContext;
import java.util.UUID;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

/**
 * Cluster use cases and the domains directly below a cluster. Each public method is one bound
 * session and one transaction.
 */
@Service
public class ClusterService {

    private final SessionContextPropagator sessions;
    private final HierarchyStore store;
    private final AuthorizationGuard guard;
    private final MembershipRegistry memberships;
    private final RelationshipManager relationships;

    public ClusterService(
            SessionContextPropagator sessions,
            HierarchyStore store,
            AuthorizationGuard guard,
            MembershipRegistry memberships,
            RelationshipManager relationships) {
        this.sessions = sessions;
        this.store = store;
        this.guard = guard;
        this.memberships = memberships;
        this.relationships = relationships;
    }

    public PageResult<HierarchyEntity> list(IdentityContext identity, ListQuery query) {
        return sessions.withContext(
                identity, session -> store.list(session, EntityKind.CLUSTER, null, query));
    }

    /** Creates a cluster owned by the caller. */
    public HierarchyEntity create(IdentityContext identity, EntityAttributes attributes) {
        return sessions.withContext(
                identity,
                session -> {
                    UUID id = store.create(session, EntityKind.CLUSTER, null, attributes);
                    memberships.assignCreator(session, id);
                    return store.get(session, EntityKind.CLUSTER, id, false);
                });
    }

    public HierarchyEntity get(IdentityContext identity, UUID clusterId, boolean includeDeleted) {
        return sessions.withContext(
                identity,
                session -> {
                    guard.require(session, EntityKind.CLUSTER, clusterId, ClusterAction.VIEW);
                    return store.get(session, EntityKind.CLUSTER, clusterId, includeDeleted);
                });
    }

    public HierarchyEntity update(IdentityContext identity, UUID clusterId, EntityAttributes changes) {
        return sessions.withContext(
                identity,
                session -> {
                    guard.require(session, EntityKind.CLUSTER, clusterId, ClusterAction.EDIT);
                    return store.update(session, EntityKind.CLUSTER, clusterId, changes);
                });
    }

    public void delete(IdentityContext identity, UUID clusterId, boolean permanent) {
        sessions.withContext(
                identity,
                session -> {
                    guard.require(session, EntityKind.CLUSTER, clusterId, ClusterAction.DELETE);
                    if (permanent) {
                        store.hardDelete(session, EntityKind.CLUSTER, clusterId);
                    } else {
                        store.softDelete(session, EntityKind.CLUSTER, clusterId);
                    }
                    return null;
                });
    }

    public PageResult<HierarchyEntity> listDomains(
            IdentityContext identity, UUID clusterId, ListQuery query) {
        return sessions.withContext(
                identity,
                session -> {
                    guard.require(session, EntityKind.CLUSTER, clusterId, ClusterAction.VIEW);
                    return store.list(session, EntityKind.DOMAIN, clusterId, query);
                });
    }

    /** Creates a domain linked under the cluster. */
    public HierarchyEntity createDomain(
            IdentityContext identity, UUID clusterId, EntityAttributes attributes) {
        return sessions.withContext(
                identity,
                session -> {
                    guard.require(session, EntityKind.CLUSTER, clusterId, ClusterAction.EDIT);
                    store.get(session, EntityKind.CLUSTER, clusterId, false);
                    UUID id = store.create(session, EntityKind.DOMAIN, clusterId, attributes);
                    return store.get(session, EntityKind.DOMAIN, id, false);
                });
    }

    /** @return false if the domain was already linked */
    public boolean linkDomain(IdentityContext identity, UUID clusterId, UUID domainId) {
        try {
            return sessions.withContext(
                    identity,
                    session ->
                            relationships.link(
                                    session,
                                    EntityKind.CLUSTER,
                                    clusterId,
                                    EntityKind.DOMAIN,
                                    domainId));
        } catch (DuplicateKeyException e) {
            // a concurrent request inserted the same pair first
            return false;
        }
    }

    public boolean unlinkDomain(IdentityContext identity, UUID clusterId, UUID domainId) {
        return sessions.withContext(
                identity,
                session ->
                        relationships.unlink(
                                session, EntityKind.CLUSTER, clusterId, EntityKind.DOMAIN, domainId));
    }
}
