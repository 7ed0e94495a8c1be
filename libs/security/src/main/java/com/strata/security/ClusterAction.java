package com.strata.security;

/** Actions checked against a caller's {@link ClusterRole}. */
public enum ClusterAction {

    VIEW("view"),
    EDIT("edit"),
    DELETE("delete"),
    MANAGE_MEMBERS("manage_members"),
    CHANGE_OWNER("change_owner");

    private final String value;

    ClusterAction(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
