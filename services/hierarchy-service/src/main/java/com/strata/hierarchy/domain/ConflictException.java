package com.strata.hierarchy.domain;

/** The request contradicts current state: live children, a duplicate membership, no owner left. */
public class ConflictException extends HierarchyException {

    public ConflictException(String message) {
        super("conflict", message);
    }
}
