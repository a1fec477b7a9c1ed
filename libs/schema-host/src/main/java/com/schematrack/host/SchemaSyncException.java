package com.schematrack.host;

/**
 * Thrown when the schema of an entity could not be synchronized.
 * <p>
 * The schema may have been partially changed before the failure; the host does not roll back DDL.
 */
public class SchemaSyncException extends RuntimeException {

    private final String entityName;

    public SchemaSyncException(String entityName, String message) {
        super(message);
        this.entityName = entityName;
    }

    public SchemaSyncException(String entityName, String message, Throwable cause) {
        super(message, cause);
        this.entityName = entityName;
    }

    /**
     * Returns the logical name of the entity whose synchronization failed, if known.
     */
    public String entityName() {
        return entityName;
    }
}
