package com.strata.hierarchy.service;

import com.strata.database.session.BoundSession;
import com.strata.hierarchy.domain.EntityKind;
import com.strata.hierarchy.domain.ForbiddenException;
import com.strata.hierarchy.domain.HierarchyEntity;
import com.strata.hierarchy.domain.NotFoundException;
import com.strata.hierarchy.domain.ValidationFailedException;
import com.strata.hierarchy.repository.LinkRepository;
import com.strata.hierarchy.repository.LinkType;
import com.strata.security.AuthorizationDecision;
import com.strata.security.ClusterAction;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Links and unlinks entities across adjacent levels of the hierarchy.
 *
 * <p>A domain may sit under several clusters and a resource under several domains. Linking needs
 * {@code edit} on the parent and on the child; unlinking needs {@code edit} on the parent only.
 * Both are idempotent.
 */
@Service
public class RelationshipManager {

    private static final Logger log = LoggerFactory.getLogger(RelationshipManager.class);

    private final HierarchyStore store;
    private final LinkRepository links;
    private final AuthorizationGuard guard;

    public RelationshipManager(HierarchyStore store, LinkRepository links, AuthorizationGuard guard) {
        this.store = store;
        this.links = links;
        this.guard = guard;
    }

    /**
     * Links {@code childId} under {@code parentId}.
     *
     * @return false if the link already existed
     * @throws IllegalArgumentException if the kinds are not adjacent
     * @throws NotFoundException if either end is invisible or soft-deleted
     * @throws ForbiddenException if the caller may not edit either end
     * @throws ValidationFailedException if another child of the parent has the same name
     */
    public boolean link(
            BoundSession session,
            EntityKind parentKind,
            UUID parentId,
            EntityKind childKind,
            UUID childId) {
        LinkType link = LinkType.between(parentKind, childKind);
        guard.require(session, parentKind, parentId, ClusterAction.EDIT);
        store.get(session, parentKind, parentId, false);
        HierarchyEntity childEntity = store.get(session, childKind, childId, false);

        // The child is visible, so a denial here is a missing permission rather than a missing row.
        AuthorizationDecision access = guard.authorize(session, childKind, childId, ClusterAction.EDIT);
        if (!access.allowed()) {
            throw new ForbiddenException(
                    "You are not allowed to link this " + childKind.label().toLowerCase(Locale.ROOT));
        }

        store.requireNameFreeUnder(session, parentId, childEntity);
        boolean inserted = links.insertIfAbsent(session, link, parentId, childId);
        if (inserted) {
            log.info(
                    "Linked {} {} under {} {}",
                    childKind.label(),
                    childId,
                    parentKind.label(),
                    parentId);
        }
        return inserted;
    }

    /**
     * Removes the link between {@code parentId} and {@code childId}. A child left without parents
     * becomes unreachable but is not deleted.
     *
     * @return false if there was no such link
     */
    public boolean unlink(
            BoundSession session,
            EntityKind parentKind,
            UUID parentId,
            EntityKind childKind,
            UUID childId) {
        LinkType link = LinkType.between(parentKind, childKind);
        guard.require(session, parentKind, parentId, ClusterAction.EDIT);
        store.get(session, parentKind, parentId, false);

        boolean deleted = links.delete(session, link, parentId, childId);
        if (deleted) {
            log.info(
                    "Unlinked {} {} from {} {}",
                    childKind.label(),
                    childId,
                    parentKind.label(),
                    parentId);
        }
        return deleted;
    }
}
