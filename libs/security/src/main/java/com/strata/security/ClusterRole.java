package com.strata.security;

import java.util.Comparator;
import java.util.Optional;

/**
 * Role an identity holds inside one cluster.
 *
 * <p>Ranked {@code OWNER > ADMIN > MEMBER}. What each role may do is defined in {@link
 * PermissionMatrix}; the rank is only used to pick the strongest role when an entity is reachable
 * from several clusters.
 */
public enum ClusterRole {

    OWNER("owner", 3),
    ADMIN("admin", 2),
    MEMBER("member", 1);

    /** Orders roles from weakest to strongest. */
    public static final Comparator<ClusterRole> BY_RANK = Comparator.comparingInt(ClusterRole::rank);

    private final String value;
    private final int rank;

    ClusterRole(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    /** The persisted and wire representation (e.g. "owner"). */
    public String value() {
        return value;
    }

    int rank() {
        return rank;
    }

    /** Whether this role ranks strictly above {@code other}. */
    public boolean outranks(ClusterRole other) {
        return rank > other.rank;
    }

    /**
     * Looks up a role by its wire value, ignoring case.
     *
     * @param value the string to match (may be null)
     * @return the matching role, or empty if unknown
     */
    public static Optional<ClusterRole> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (ClusterRole role : values()) {
            if (role.value.equalsIgnoreCase(value.strip())) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
