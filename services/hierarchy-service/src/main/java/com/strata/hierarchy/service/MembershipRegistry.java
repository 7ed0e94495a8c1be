package com.strata.hierarchy.service;

import com.strata.database.session.BoundSession;
import com.strata.hierarchy.domain.ConflictException;
import com.strata.hierarchy.domain.EntityKind;
import com.strata.hierarchy.domain.ListQuery;
import com.strata.hierarchy.domain.Membership;
import com.strata.hierarchy.domain.NotFoundException;
import com.strata.hierarchy.domain.PageResult;
import com.strata.hierarchy.domain.ValidationFailedException;
import com.strata.hierarchy.repository.MembershipRepository;
import com.strata.security.ClusterAction;
import com.strata.security.ClusterRole;
import com.strata.security.IdentityContext;
import com.strata.security.IdentityContextValidator;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Service;

/**
 * Cluster memberships and the rules around them.
 *
 * <ul>
 *   <li>adding, changing and removing members needs {@code manage_members}
 *   <li>granting, changing or revoking an {@code owner} role also needs {@code change_owner}
 *   <li>a cluster always keeps at least one owner
 * </ul>
 *
 * <p>Every mutation first locks the cluster row, so concurrent changes to one cluster's
 * memberships run one after another and each checks the owner count the previous one left behind.
 * The lock query only matches clusters the caller belongs to, which doubles as the visibility
 * check.
 */
@Service
public class MembershipRegistry {

    static final int MAX_COMMENT_LENGTH = 1000;

    private final MembershipRepository memberships;
    private final AuthorizationGuard guard;
    private final MembershipAuditLogger audit;

    public MembershipRegistry(
            MembershipRepository memberships, AuthorizationGuard guard, MembershipAuditLogger audit) {
        this.memberships = memberships;
        this.guard = guard;
        this.audit = audit;
    }

    /**
     * Parses a wire role.
     *
     * @throws ValidationFailedException if blank or not one of owner, admin, member
     */
    public static ClusterRole parseRole(String value) {
        if (value == null || value.isBlank()) {
            throw ValidationFailedException.of("role", "can't be blank");
        }
        return ClusterRole.fromValue(value)
                .orElseThrow(() -> ValidationFailedException.of("role", "is not included in the list"));
    }

    public Optional<ClusterRole> roleOf(BoundSession session, UUID clusterId, String identityId) {
        return memberships.find(session, clusterId, identityId).map(Membership::role);
    }

    /** Makes the caller the first owner of a cluster it has just created. */
    public Membership assignCreator(BoundSession session, UUID clusterId) {
        var owner =
                new Membership(
                        UUID.randomUUID(),
                        clusterId,
                        session.identityId(),
                        ClusterRole.OWNER,
                        null,
                        null,
                        null);
        memberships.insert(session, owner);
        audit.added(session.identityId(), owner);
        return load(session, clusterId, session.identityId());
    }

    /**
     * Adds {@code identityId} with {@code role}.
     *
     * @throws ConflictException if the identity is already a member
     */
    public Membership addMember(
            BoundSession session, UUID clusterId, String identityId, ClusterRole role, String comment) {
        lock(session, clusterId);
        guard.require(session, EntityKind.CLUSTER, clusterId, ClusterAction.MANAGE_MEMBERS);
        if (role == ClusterRole.OWNER) {
            guard.require(session, EntityKind.CLUSTER, clusterId, ClusterAction.CHANGE_OWNER);
        }
        validate(identityId, role, comment);
        if (memberships.find(session, clusterId, identityId).isPresent()) {
            throw new ConflictException(identityId + " is already a member of this cluster");
        }

        var membership =
                new Membership(UUID.randomUUID(), clusterId, identityId, role, comment, null, null);
        memberships.insert(session, membership);
        audit.added(session.identityId(), membership);
        return load(session, clusterId, identityId);
    }

    /** Changes a member's role, keeping its comment. */
    public Membership updateRole(
            BoundSession session, UUID clusterId, String identityId, ClusterRole newRole) {
        return updateMember(session, clusterId, identityId, newRole, null);
    }

    /**
     * Changes a member's role and/or comment; null leaves the field unchanged.
     *
     * @throws ConflictException if the change would leave the cluster without an owner
     */
    public Membership updateMember(
            BoundSession session,
            UUID clusterId,
            String identityId,
            ClusterRole newRole,
            String newComment) {
        lock(session, clusterId);
        guard.require(session, EntityKind.CLUSTER, clusterId, ClusterAction.MANAGE_MEMBERS);
        Membership before = load(session, clusterId, identityId);
        ClusterRole role = newRole != null ? newRole : before.role();
        String comment = newComment != null ? newComment : before.comment();
        if (role != before.role() && (before.isOwner() || role == ClusterRole.OWNER)) {
            guard.require(session, EntityKind.CLUSTER, clusterId, ClusterAction.CHANGE_OWNER);
        }
        validateComment(comment);
        if (before.isOwner() && role != ClusterRole.OWNER) {
            requireAnotherOwner(session, clusterId, "demote");
        }

        memberships.update(session, clusterId, identityId, role, comment);
        Membership after = load(session, clusterId, identityId);
        audit.changed(session.identityId(), before, after);
        return after;
    }

    /**
     * Removes a member.
     *
     * @throws ConflictException if it is the cluster's last owner
     */
    public void removeMember(BoundSession session, UUID clusterId, String identityId) {
        lock(session, clusterId);
        guard.require(session, EntityKind.CLUSTER, clusterId, ClusterAction.MANAGE_MEMBERS);
        Membership target = load(session, clusterId, identityId);
        if (target.isOwner()) {
            guard.require(session, EntityKind.CLUSTER, clusterId, ClusterAction.CHANGE_OWNER);
            requireAnotherOwner(session, clusterId, "remove");
        }
        memberships.delete(session, clusterId, identityId);
        audit.removed(session.identityId(), target);
    }

    /**
     * Makes {@code newOwnerId} an owner and the calling owner an admin, in one step.
     *
     * @return the new owner's membership
     */
    public Membership transferOwnership(BoundSession session, UUID clusterId, String newOwnerId) {
        lock(session, clusterId);
        guard.require(session, EntityKind.CLUSTER, clusterId, ClusterAction.CHANGE_OWNER);
        if (session.identityId().equals(newOwnerId)) {
            throw new ConflictException("You already own this cluster");
        }
        Membership target = load(session, clusterId, newOwnerId);
        Membership caller = load(session, clusterId, session.identityId());

        if (!target.isOwner()) {
            memberships.update(session, clusterId, newOwnerId, ClusterRole.OWNER, target.comment());
        }
        memberships.update(
                session, clusterId, session.identityId(), ClusterRole.ADMIN, caller.comment());
        audit.ownershipTransferred(session.identityId(), clusterId, newOwnerId, ClusterRole.ADMIN);
        return load(session, clusterId, newOwnerId);
    }

    /** @throws IllegalArgumentException for an unsupported sort column */
    public PageResult<Membership> listMembers(BoundSession session, UUID clusterId, ListQuery query) {
        guard.require(session, EntityKind.CLUSTER, clusterId, ClusterAction.VIEW);
        return memberships.list(session, clusterId, query);
    }

    private void lock(BoundSession session, UUID clusterId) {
        if (!memberships.lockCluster(session, clusterId)) {
            throw NotFoundException.of(EntityKind.CLUSTER, clusterId);
        }
    }

    private Membership load(BoundSession session, UUID clusterId, String identityId) {
        return memberships.find(session, clusterId, identityId)
                .orElseThrow(
                        () ->
                                new NotFoundException(
                                        "Member " + identityId + " not found in cluster " + clusterId));
    }

    // The count runs under the cluster lock and before the write: once the caller removes or
    // demotes itself the row filter may no longer show it this cluster's memberships.
    private void requireAnotherOwner(BoundSession session, UUID clusterId, String verb) {
        if (memberships.countOwners(session, clusterId) <= 1) {
            throw new ConflictException(
                    "Cannot " + verb + " the last owner; a cluster must keep at least one owner");
        }
    }

    private static void validate(String identityId, ClusterRole role, String comment) {
        var errors = new ValidationFailedException.Collector();
        var identity = IdentityContextValidator.validate(IdentityContext.of(identityId));
        identity.errors()
                .forEach(e -> errors.add("identity_id", e.replaceFirst("^identityId ", "")));
        if (role == null) {
            errors.add("role", "can't be blank");
        }
        if (comment != null && comment.length() > MAX_COMMENT_LENGTH) {
            errors.add("comment", "is too long (maximum is " + MAX_COMMENT_LENGTH + " characters)");
        }
        errors.throwIfAny();
    }

    private static void validateComment(String comment) {
        if (comment != null && comment.length() > MAX_COMMENT_LENGTH) {
            throw ValidationFailedException.of(
                    "comment", "is too long (maximum is " + MAX_COMMENT_LENGTH + " characters)");
        }
    }
}
