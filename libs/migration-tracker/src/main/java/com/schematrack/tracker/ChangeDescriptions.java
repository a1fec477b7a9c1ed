package com.schematrack.tracker;

import com.schematrack.host.SchemaEntity;
import java.util.List;
import java.util.StringJoiner;

/**
 * Builds the human-readable {@code changes} text of a ledger entry.
 *
 * <p>Never throws: an entity whose name cannot be resolved turns the whole description into
 * {@link #UNRESOLVED}.
 */
public final class ChangeDescriptions {

    /** Prefix of the line describing one synchronized entity. */
    public static final String ENTITY_PREFIX = "AutoMigrated ";

    /** Description used when no entity identity is observable. */
    public static final String NO_ENTITIES = "No specific models found, general AutoMigrate performed";

    /** Description used when entity names cannot be resolved. */
    public static final String UNRESOLVED = "Unable to determine migrated models";

    private ChangeDescriptions() {
        // utility class
    }

    /**
     * Describes the synchronization of a single entity.
     *
     * @param entity the entity, or null when unknown
     * @return {@code "AutoMigrated <name>"}, or a fallback
     */
    public static String describe(SchemaEntity entity) {
        if (entity == null) {
            return NO_ENTITIES;
        }
        String name = logicalNameOrNull(entity);
        return name != null ? ENTITY_PREFIX + name : UNRESOLVED;
    }

    /**
     * Describes a batch of entities synchronized together: one line per entity, in the given order.
     *
     * @param entities the batch, possibly null or empty
     * @return newline-separated lines, or a fallback
     */
    public static String describeBatch(List<? extends SchemaEntity> entities) {
        if (entities == null || entities.isEmpty()) {
            return NO_ENTITIES;
        }
        StringJoiner lines = new StringJoiner("\n");
        for (SchemaEntity entity : entities) {
            String name = entity != null ? logicalNameOrNull(entity) : null;
            if (name == null) {
                return UNRESOLVED;
            }
            lines.add(ENTITY_PREFIX + name);
        }
        return lines.toString();
    }

    /**
     * Returns the entity's logical name, or null when it throws or is blank.
     */
    public static String logicalNameOrNull(SchemaEntity entity) {
        try {
            String name = entity.logicalName();
            return name == null || name.isBlank() ? null : name;
        } catch (RuntimeException e) {
            return null;
        }
    }
}
