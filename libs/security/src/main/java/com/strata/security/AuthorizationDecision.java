package com.strata.security;

import java.util.Optional;

/**
 * Outcome of an authorization check.
 *
 * @param allowed whether the action may proceed
 * @param action the action that was checked
 * @param role the caller's role in the cluster, or null when the caller has no membership
 * @param reason human-readable denial reason (null when allowed)
 */
public record AuthorizationDecision(
        boolean allowed, ClusterAction action, ClusterRole role, String reason) {

    public static AuthorizationDecision allow(ClusterAction action, ClusterRole role) {
        return new AuthorizationDecision(true, action, role, null);
    }

    public static AuthorizationDecision deny(ClusterAction action, ClusterRole role, String reason) {
        return new AuthorizationDecision(false, action, role, reason);
    }

    /**
     * Evaluates the permission matrix for a caller holding {@code role} (null for none).
     */
    public static AuthorizationDecision evaluate(ClusterRole role, ClusterAction action) {
        if (role == null) {
            return deny(action, null, "not a member of this cluster");
        }
        if (PermissionMatrix.permits(role, action)) {
            return allow(action, role);
        }
        return deny(
                action,
                role,
                "role '%s' is not permitted to %s".formatted(role.value(), action.value()));
    }

    /** The caller's role, when it has one. */
    public Optional<ClusterRole> roleIfMember() {
        return Optional.ofNullable(role);
    }

    /** Whether the caller has no membership at all (the cluster is invisible to it). */
    public boolean isNonMember() {
        return role == null;
    }
}
