package com.strata.hierarchy.api.dto;

import java.util.UUID;

/**
 * Result of a link request.
 *
 * @param created false when the link already existed
 */
public record LinkResponse(UUID parentId, UUID childId, boolean created) {}
