package com.schematrack.host;

/**
 * Strategy that runs one aggregate synchronization pass over all entities of a
 * {@link ReconcilePass}.
 *
 * <p>The default implementation synchronizes each entity through the per-entity chain and records
 * every failure on the pass's error channel. Decorators installed on
 * {@link SchemaReconciler#passExtensionPoint()} see the pass as a whole, without per-entity
 * boundaries.
 */
@FunctionalInterface
public interface PassSynchronizer {

    /**
     * Synchronizes every entity of the pass.
     *
     * @param pass the pass to run
     */
    void synchronizeAll(ReconcilePass pass);
}
