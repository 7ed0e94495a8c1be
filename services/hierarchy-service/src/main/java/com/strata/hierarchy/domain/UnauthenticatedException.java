package com.strata.hierarchy.domain;

public class UnauthenticatedException extends HierarchyException {

    public UnauthenticatedException(String message) {
        super("unauthenticated", message);
    }

    public UnauthenticatedException(String message, Throwable cause) {
        super("unauthenticated", message, cause);
    }
}
