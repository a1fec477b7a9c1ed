package com.schematrack.host;

import java.util.List;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * State of one reconciliation pass: the entities it covers and its error channel.
 * <p>
 * A pass is created per {@link SchemaReconciler#reconcile} call and is never shared between calls.
 * The error channel is thread-safe so that extensions running on other threads may report to it.
 */
public final class ReconcilePass {

    private final String passId;
    private final List<SchemaEntity> entities;
    private final Queue<SyncError> errors = new ConcurrentLinkedQueue<>();

    /**
     * Creates a pass over the given entities with a random id.
     *
     * @param entities entities in the order the host synchronizes them
     */
    public ReconcilePass(List<? extends SchemaEntity> entities) {
        this(UUID.randomUUID().toString(), entities);
    }

    /**
     * Creates a pass with an explicit id.
     *
     * @param passId unique identifier for log correlation
     * @param entities entities in the order the host synchronizes them
     */
    public ReconcilePass(String passId, List<? extends SchemaEntity> entities) {
        if (passId == null || passId.isBlank()) {
            throw new IllegalArgumentException("passId must not be null or blank");
        }
        if (entities == null) {
            throw new IllegalArgumentException("entities must not be null");
        }
        this.passId = passId;
        this.entities = List.copyOf(entities);
    }

    public String passId() {
        return passId;
    }

    /**
     * Returns the entities of this pass in host order.
     */
    public List<SchemaEntity> entities() {
        return entities;
    }

    /**
     * Adds a failure to the error channel.
     *
     * @param error the failure to report
     */
    public void reportError(SyncError error) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        errors.add(error);
    }

    /**
     * Convenience overload of {@link #reportError(SyncError)}.
     */
    public void reportError(String source, String entityName, Throwable cause) {
        reportError(new SyncError(source, entityName, cause));
    }

    /**
     * Returns a snapshot of the errors reported so far, in report order.
     */
    public List<SyncError> errors() {
        return List.copyOf(errors);
    }

    public int errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
