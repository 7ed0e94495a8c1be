package com.strata.hierarchy.domain;

/** The caller can see the target but its role does not permit the action. */
public class ForbiddenException extends HierarchyException {

    public ForbiddenException(String message) {
        super("forbidden", message);
    }
}
