package com.schematrack.host;

import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Host facade that reconciles entity schemas with the database.
 * <p>
 * A {@link #reconcile} call runs the pass chain ({@link #passExtensionPoint()}). The base pass
 * strategy synchronizes each entity, in order, through the entity chain
 * ({@link #entityExtensionPoint()}). A failing entity is reported on the pass's error channel and
 * the pass moves on to the next entity; {@code reconcile} itself never throws for a synchronization
 * failure. Callers inspect {@link ReconcilePass#errors()} on the returned pass.
 * <p>
 * Reconciliation is safe to run concurrently from several threads; every call owns its pass.
 */
public final class SchemaReconciler {

    private static final Logger log = LoggerFactory.getLogger(SchemaReconciler.class);

    /** Name of the per-entity extension point. */
    public static final String ENTITY_EXTENSION_POINT = "entity-synchronizer";

    /** Name of the per-pass extension point. */
    public static final String PASS_EXTENSION_POINT = "pass-synchronizer";

    private final ExtensionPoint<EntitySynchronizer> entityExtensionPoint;
    private final ExtensionPoint<PassSynchronizer> passExtensionPoint;

    /**
     * Creates a reconciler around the given default per-entity synchronizer.
     *
     * @param defaultSynchronizer synchronizes one entity's schema
     */
    public SchemaReconciler(EntitySynchronizer defaultSynchronizer) {
        this.entityExtensionPoint = new ExtensionPoint<>(ENTITY_EXTENSION_POINT, defaultSynchronizer);
        this.passExtensionPoint = new ExtensionPoint<>(PASS_EXTENSION_POINT, this::synchronizeEach);
    }

    /**
     * Reconciles the schema of every given entity.
     *
     * @param entities entities to synchronize, in order (may be empty)
     * @return the completed pass, carrying any accumulated errors
     */
    public ReconcilePass reconcile(List<? extends SchemaEntity> entities) {
        ReconcilePass pass = new ReconcilePass(entities);
        log.debug("Starting reconcile pass {} over {} entities", pass.passId(), pass.entities().size());
        try {
            passExtensionPoint.current().synchronizeAll(pass);
        } catch (RuntimeException e) {
            log.warn("Reconcile pass {} failed: {}", pass.passId(), e.getMessage());
            pass.reportError(SyncError.HOST_SOURCE, null, e);
        }
        if (pass.hasErrors()) {
            log.warn("Reconcile pass {} completed with {} error(s)", pass.passId(), pass.errorCount());
        } else {
            log.debug("Reconcile pass {} completed", pass.passId());
        }
        return pass;
    }

    /**
     * Varargs convenience overload of {@link #reconcile(List)}.
     */
    public ReconcilePass reconcile(SchemaEntity... entities) {
        return reconcile(List.of(entities));
    }

    /**
     * Returns the per-entity extension point.
     */
    public ExtensionPoint<EntitySynchronizer> entityExtensionPoint() {
        return entityExtensionPoint;
    }

    /**
     * Returns the coarse per-pass extension point.
     */
    public ExtensionPoint<PassSynchronizer> passExtensionPoint() {
        return passExtensionPoint;
    }

    /**
     * Freezes both extension points; later installs fail.
     */
    public void freeze() {
        entityExtensionPoint.freeze();
        passExtensionPoint.freeze();
    }

    private void synchronizeEach(ReconcilePass pass) {
        EntitySynchronizer synchronizer = entityExtensionPoint.current();
        for (SchemaEntity entity : pass.entities()) {
            try {
                synchronizer.synchronize(entity, pass);
            } catch (RuntimeException e) {
                String entityName = entityNameOf(entity, e);
                log.warn("Failed to synchronize {}: {}", entityName, e.getMessage());
                pass.reportError(SyncError.HOST_SOURCE, entityName, e);
            }
        }
    }

    private static String entityNameOf(SchemaEntity entity, RuntimeException failure) {
        if (failure instanceof SchemaSyncException syncFailure && syncFailure.entityName() != null) {
            return syncFailure.entityName();
        }
        try {
            return entity.logicalName();
        } catch (RuntimeException e) {
            return null;
        }
    }
}
