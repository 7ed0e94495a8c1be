package com.strata.hierarchy.service;

import com.strata.database.session.BoundSession;
import com.strata.hierarchy.domain.ConflictException;
import com.strata.hierarchy.domain.EntityAttributes;
import com.strata.hierarchy.domain.EntityKind;
import com.strata.hierarchy.domain.HierarchyEntity;
import com.strata.hierarchy.domain.ListQuery;
import com.strata.hierarchy.domain.NotFoundException;
import com.strata.hierarchy.domain.PageResult;
import com.strata.hierarchy.domain.ValidationFailedException;
import com.strata.hierarchy.repository.EntityRepository;
import com.strata.hierarchy.repository.LinkRepository;
import com.strata.hierarchy.repository.LinkType;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Create, read, update and delete for clusters, domains and resources.
 *
 * <p>Permission checks are the caller's job ({@link AuthorizationGuard}); this class validates
 * input, enforces name uniqueness within the owning context and refuses to delete an entity that
 * still has live children.
 */
@Service
public class HierarchyStore {

    private static final Logger log = LoggerFactory.getLogger(HierarchyStore.class);

    static final int MAX_NAME_LENGTH = 255;
    static final int MAX_DESCRIPTION_LENGTH = 10_000;
    static final int MAX_RESOURCE_TYPE_LENGTH = 100;
    static final int MAX_CONFIGURATION_LENGTH = 65_535;
    static final String TAKEN = "has already been taken";

    private final EntityRepository entities;
    private final LinkRepository links;

    public HierarchyStore(EntityRepository entities, LinkRepository links) {
        this.entities = entities;
        this.links = links;
    }

    /**
     * Creates an entity. A domain or resource is linked under {@code parentId} in the same
     * transaction; for a cluster {@code parentId} must be null.
     *
     * <p>A new cluster stays invisible, even to its creator, until a membership is added for it.
     *
     * @return the new entity's id
     * @throws ValidationFailedException for invalid attributes or a name clash
     */
    public UUID create(
            BoundSession session, EntityKind kind, UUID parentId, EntityAttributes attributes) {
        if ((kind == EntityKind.CLUSTER) != (parentId == null)) {
            throw new IllegalArgumentException(
                    kind == EntityKind.CLUSTER
                            ? "A Cluster has no parent"
                            : "A " + kind.label() + " must be created under a parent");
        }
        EntityAttributes normalized = validateForCreate(kind, attributes);
        boolean taken =
                kind == EntityKind.CLUSTER
                        ? entities.clusterNameTaken(
                                session, session.identityId(), normalized.name(), null)
                        : entities.childNameTaken(
                                session, kind, List.of(parentId), normalized.name(), null);
        if (taken) {
            throw ValidationFailedException.of("name", TAKEN);
        }

        UUID id = UUID.randomUUID();
        entities.insert(session, kind, id, normalized);
        if (parentId != null) {
            links.insertIfAbsent(session, LinkType.above(kind), parentId, id);
        }
        log.info("Created {} {} '{}'", kind.label(), id, normalized.name());
        return id;
    }

    /** @throws NotFoundException if the entity is invisible, or soft-deleted and not asked for */
    public HierarchyEntity get(
            BoundSession session, EntityKind kind, UUID id, boolean includeDeleted) {
        return entities.findById(session, kind, id, includeDeleted)
                .orElseThrow(() -> NotFoundException.of(kind, id));
    }

    /**
     * Lists visible entities; children of {@code parentId} when given.
     *
     * @throws IllegalArgumentException for an unsupported sort column
     */
    public PageResult<HierarchyEntity> list(
            BoundSession session, EntityKind kind, UUID parentId, ListQuery query) {
        return entities.list(session, kind, parentId, query);
    }

    /** Applies the non-null attributes to a live entity and returns it as stored. */
    public HierarchyEntity update(
            BoundSession session, EntityKind kind, UUID id, EntityAttributes changes) {
        HierarchyEntity current = get(session, kind, id, false);
        EntityAttributes normalized = validateForUpdate(kind, changes);
        if (normalized.name() != null && !normalized.name().equalsIgnoreCase(current.name())) {
            boolean taken =
                    kind == EntityKind.CLUSTER
                            ? entities.clusterNameTaken(
                                    session, current.createdBy(), normalized.name(), id)
                            : entities.childNameTaken(
                                    session,
                                    kind,
                                    links.parentsOf(session, LinkType.above(kind), id),
                                    normalized.name(),
                                    id);
            if (taken) {
                throw ValidationFailedException.of("name", TAKEN);
            }
        }
        if (!entities.update(session, kind, id, normalized)) {
            throw NotFoundException.of(kind, id);
        }
        return get(session, kind, id, false);
    }

    /**
     * Checks that {@code child} could be linked under {@code parentId} without clashing with the
     * name of another live child there.
     *
     * @throws ValidationFailedException if the name is taken under that parent
     */
    public void requireNameFreeUnder(BoundSession session, UUID parentId, HierarchyEntity child) {
        if (entities.childNameTaken(
                session, child.kind(), List.of(parentId), child.name(), child.id())) {
            throw ValidationFailedException.of("name", TAKEN);
        }
    }

    /**
     * Marks a live entity deleted.
     *
     * @throws ConflictException if live children are still linked below it
     */
    public void softDelete(BoundSession session, EntityKind kind, UUID id) {
        get(session, kind, id, false);
        requireNoLiveChildren(session, kind, id);
        if (!entities.softDelete(session, kind, id)) {
            throw NotFoundException.of(kind, id);
        }
        log.info("Soft-deleted {} {}", kind.label(), id);
    }

    /**
     * Removes the row, live or soft-deleted. Junction rows and memberships cascade.
     *
     * @throws ConflictException if live children are still linked below it
     */
    public void hardDelete(BoundSession session, EntityKind kind, UUID id) {
        get(session, kind, id, true);
        requireNoLiveChildren(session, kind, id);
        if (!entities.hardDelete(session, kind, id)) {
            throw NotFoundException.of(kind, id);
        }
        log.info("Permanently deleted {} {}", kind.label(), id);
    }

    private void requireNoLiveChildren(BoundSession session, EntityKind kind, UUID id) {
        long children = entities.countLiveChildren(session, kind, id);
        if (children > 0) {
            throw new ConflictException(
                    kind.label()
                            + " still has "
                            + children
                            + " linked "
                            + kind.child().label().toLowerCase(Locale.ROOT)
                            + (children == 1 ? "" : "s")
                            + "; unlink or delete them first");
        }
    }

    private EntityAttributes validateForCreate(EntityKind kind, EntityAttributes attributes) {
        var errors = new ValidationFailedException.Collector();
        String name = attributes.name() == null ? null : attributes.name().strip();
        if (name == null || name.isEmpty()) {
            errors.add("name", "can't be blank");
        }
        EntityAttributes normalized = checkCommon(kind, name, attributes, errors);
        errors.throwIfAny();
        return normalized;
    }

    private EntityAttributes validateForUpdate(EntityKind kind, EntityAttributes changes) {
        var errors = new ValidationFailedException.Collector();
        String name = changes.name() == null ? null : changes.name().strip();
        if (name != null && name.isEmpty()) {
            errors.add("name", "can't be blank");
        }
        EntityAttributes normalized = checkCommon(kind, name, changes, errors);
        errors.throwIfAny();
        return normalized;
    }

    private EntityAttributes checkCommon(
            EntityKind kind,
            String name,
            EntityAttributes attributes,
            ValidationFailedException.Collector errors) {
        if (name != null && name.length() > MAX_NAME_LENGTH) {
            errors.add("name", "is too long (maximum is " + MAX_NAME_LENGTH + " characters)");
        }
        if (kind == EntityKind.RESOURCE) {
            String type = attributes.resourceType() == null ? null : attributes.resourceType().strip();
            if (type != null && type.length() > MAX_RESOURCE_TYPE_LENGTH) {
                errors.add(
                        "resource_type",
                        "is too long (maximum is " + MAX_RESOURCE_TYPE_LENGTH + " characters)");
            }
            if (attributes.configuration() != null
                    && entities.toJson(attributes.configuration()).length()
                            > MAX_CONFIGURATION_LENGTH) {
                errors.add(
                        "configuration",
                        "is too large (maximum is "
                                + MAX_CONFIGURATION_LENGTH
                                + " characters as JSON)");
            }
            return new EntityAttributes(name, null, type, attributes.configuration());
        }
        String description = attributes.description();
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            errors.add(
                    "description",
                    "is too long (maximum is " + MAX_DESCRIPTION_LENGTH + " characters)");
        }
        return new EntityAttributes(name, description, null, null);
    }
}
