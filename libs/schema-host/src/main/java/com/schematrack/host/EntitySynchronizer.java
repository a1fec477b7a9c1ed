package com.schematrack.host;

/**
 * Strategy that synchronizes the schema of a single entity.
 *
 * <p>This is the per-entity extension point of {@link SchemaReconciler}. Decorators installed on
 * {@link SchemaReconciler#entityExtensionPoint()} receive the next synchronizer in the chain and
 * may observe each call before and after delegating to it.
 */
@FunctionalInterface
public interface EntitySynchronizer {

    /**
     * Synchronizes the schema of one entity.
     *
     * @param entity the entity being synchronized
     * @param pass the pass this call belongs to; carries the host's error channel
     * @throws SchemaSyncException if the schema could not be synchronized
     */
    void synchronize(SchemaEntity entity, ReconcilePass pass) throws SchemaSyncException;
}
