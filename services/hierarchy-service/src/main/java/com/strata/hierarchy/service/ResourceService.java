package com.strata.hierarchy.service;

import com.strata.database.session.SessionContextPropagator;
import com.strata.hierarchy.domain.EntityAttributes;
import com.strata.hierarchy.domain.EntityKind;
import com.strata.hierarchy.domain.HierarchyEntity;
import com.strata.security.ClusterAction;
import com.strata.security.IdentityContext;
import java.util.UUID;
import org.springframework.stereotype.Service;

@Service
public class ResourceService {

    private final SessionContextPropagator sessions;
    private final HierarchyStore store;
    private final AuthorizationGuard guard;

    public ResourceService(
            SessionContextPropagator sessions, HierarchyStore store, AuthorizationGuard guard) {
        this.sessions = sessions;
        this.store = store;
        this.guard = guard;
    }

    public HierarchyEntity get(IdentityContext identity, UUID resourceId, boolean includeDeleted) {
        return sessions.withContext(
                identity,
                session -> {
                    guard.require(session, EntityKind.RESOURCE, resourceId, ClusterAction.VIEW);
                    return store.get(session, EntityKind.RESOURCE, resourceId, includeDeleted);
                });
    }

    public HierarchyEntity update(
            IdentityContext identity, UUID resourceId, EntityAttributes changes) {
        return sessions.withContext(
                identity,
                session -> {
                    guard.require(session, EntityKind.RESOURCE, resourceId, ClusterAction.EDIT);
                    return store.update(session, EntityKind.RESOURCE, resourceId, changes);
                });
    }

    public void delete(IdentityContext identity, UUID resourceId, boolean permanent) {
        sessions.withContext(
                identity,
                session -> {
                    guard.require(session, EntityKind.RESOURCE, resourceId, ClusterAction.DELETE);
                    if (permanent) {
                        store.hardDelete(session, EntityKind.RESOURCE, resourceId);
                    } else {
                        store.softDelete(session, EntityKind.RESOURCE, resourceId);
                    }
                    return null;
                });
    }
}
