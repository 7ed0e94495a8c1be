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

/** Domain use cases and the resources directly below a domain. */
@Service
public class DomainService {

    private final SessionContextPropagator sessions;
    private final HierarchyStore store;
    private final AuthorizationGuard guard;
    private final RelationshipManager relationships;

    public DomainService(
            SessionContextPropagator sessions,
            HierarchyStore store,
            AuthorizationGuard guard,
            RelationshipManager relationships) {
        this.sessions = sessions;
        this.store = store;
        this.guard = guard;
        this.relationships = relationships;
    }

    public HierarchyEntity get(IdentityContext identity, UUID domainId, boolean includeDeleted) {
        return sessions.withContext(
                identity,
                session -> {
                    guard.require(session, EntityKind.DOMAIN, domainId, ClusterAction.VIEW);
                    return store.get(session, EntityKind.DOMAIN, domainId, includeDeleted);
                });
    }

    public HierarchyEntity update(IdentityContext identity, UUID domainId, EntityAttributes changes) {
        return sessions.withContext(
                identity,
                session -> {
                    guard.require(session, EntityKind.DOMAIN, domainId, ClusterAction.EDIT);
                    return store.update(session, EntityKind.DOMAIN, domainId, changes);
                });
    }

    public void delete(IdentityContext identity, UUID domainId, boolean permanent) {
        sessions.withContext(
                identity,
                session -> {
                    guard.require(session, EntityKind.DOMAIN, domainId, ClusterAction.DELETE);
                    if (permanent) {
                        store.hardDelete(session, EntityKind.DOMAIN, domainId);
                    } else {
                        store.softDelete(session, EntityKind.DOMAIN, domainId);
                    }
                    return null;
                });
    }

    public PageResult<HierarchyEntity> listResources(
            IdentityContext identity, UUID domainId, ListQuery query) {
        return sessions.withContext(
                identity,
                session -> {
                    guard.require(session, EntityKind.DOMAIN, domainId, ClusterAction.VIEW);
                    return store.list(session, EntityKind.RESOURCE, domainId, query);
                });
    }

    public HierarchyEntity createResource(
            IdentityContext identity, UUID domainId, EntityAttributes attributes) {
        return sessions.withContext(
                identity,
                session -> {
                    guard.require(session, EntityKind.DOMAIN, domainId, ClusterAction.EDIT);
                    store.get(session, EntityKind.DOMAIN, domainId, false);
                    UUID id = store.create(session, EntityKind.RESOURCE, domainId, attributes);
                    return store.get(session, EntityKind.RESOURCE, id, false);
                });
    }

    /** @return false if the resource was already linked */
    public boolean linkResource(IdentityContext identity, UUID domainId, UUID resourceId) {
        try {
            return sessions.withContext(
                    identity,
                    session ->
                            relationships.link(
                                    session,
                                    EntityKind.DOMAIN,
                                    domainId,
                                    EntityKind.RESOURCE,
                                    resourceId));
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    public boolean unlinkResource(IdentityContext identity, UUID domainId, UUID resourceId) {
        return sessions.withContext(
                identity,
                session ->
                        relationships.unlink(
                                session,
                                EntityKind.DOMAIN,
                                domainId,
                                EntityKind.RESOURCE,
                                resourceId));
    }
}
