package com.strata.security;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * The fixed role → action matrix.
 *
 * <pre>
 * | Role   | view | edit | delete | manage_members | change_owner |
 * | owner  |  ✓   |  ✓   |   ✓    |       ✓        |      ✓       |
 * | admin  |  ✓   |  ✓   |   ✗    |       ✓        |      ✗       |
 * | member |  ✓   |  ✗   |   ✗    |       ✗        |      ✗       |
 * </pre>
 *
 * <p>Process-wide and read-only. The database row filter only checks "has any
 * membership"; every finer decision is made here.
 */
public final class PermissionMatrix {

    private static final Map<ClusterRole, Set<ClusterAction>> GRANTS;

    static {
        var grants = new EnumMap<ClusterRole, Set<ClusterAction>>(ClusterRole.class);
        grants.put(ClusterRole.OWNER, Collections.unmodifiableSet(EnumSet.allOf(ClusterAction.class)));
        grants.put(
                ClusterRole.ADMIN,
                Collections.unmodifiableSet(
                        EnumSet.of(
                                ClusterAction.VIEW,
                                ClusterAction.EDIT,
                                ClusterAction.MANAGE_MEMBERS)));
        grants.put(
                ClusterRole.MEMBER, Collections.unmodifiableSet(EnumSet.of(ClusterAction.VIEW)));
        GRANTS = Collections.unmodifiableMap(grants);
    }

    private PermissionMatrix() {
        // utility class
    }

    /** Whether {@code role} may perform {@code action}. */
    public static boolean permits(ClusterRole role, ClusterAction action) {
        return role != null && GRANTS.get(role).contains(action);
    }

    /** All actions granted to {@code role}. */
    public static Set<ClusterAction> actionsFor(ClusterRole role) {
        return GRANTS.get(role);
    }
}
