package com.strata.hierarchy.domain;

import java.util.Map;

/**
 * Caller-supplied attributes for create and update.
 *
 * <p>On update a null field means "leave unchanged". {@code description} and {@code resourceType}
 * cannot be cleared back to null once set; send an empty string instead.
 */
public record EntityAttributes(
        String name, String description, String resourceType, Map<String, Object> configuration) {

    public static EntityAttributes named(String name) {
        return new EntityAttributes(name, null, null, null);
    }
}
