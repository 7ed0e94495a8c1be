package com.strata.hierarchy.domain;

import java.util.UUID;

/** The entity does not exist, or the caller has no membership that makes it visible. */
public class NotFoundException extends HierarchyException {

    public NotFoundException(String message) {
        super("not_found", message);
    }

    public static NotFoundException of(EntityKind kind, UUID id) {
        return new NotFoundException(kind.label() + " " + id + " not found");
    }
}
