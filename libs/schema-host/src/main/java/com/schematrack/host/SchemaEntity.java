package com.schematrack.host;

/**
 * An entity whose schema the host can synchronize.
 *
 * <p>Entities expose a stable logical name explicitly instead of having it derived from their
 * runtime type, so renaming a class never changes what the audit history calls it.
 */
public interface SchemaEntity {

    /**
     * Returns the entity's declared logical name (e.g., {@code "Order"}).
     */
    String logicalName();
}
