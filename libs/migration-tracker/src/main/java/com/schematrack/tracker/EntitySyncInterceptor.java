package com.schematrack.tracker;

import com.schematrack.host.EntitySynchronizer;
import com.schematrack.host.ReconcilePass;
import com.schematrack.host.SchemaEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-entity decorator that records each successful synchronization in the ledger.
 * <p>
 * The start instant lives in a {@link SyncInvocation} local to the call, so concurrent
 * synchronizations of different entities never see each other's timestamps. A failed
 * synchronization is rethrown to the host untouched and leaves no ledger entry.
 */
public final class EntitySyncInterceptor implements EntitySynchronizer {

    private static final Logger log = LoggerFactory.getLogger(EntitySyncInterceptor.class);

    private final EntitySynchronizer delegate;
    private final LedgerRecorder recorder;

    EntitySyncInterceptor(EntitySynchronizer delegate, LedgerRecorder recorder) {
        this.delegate = delegate;
        this.recorder = recorder;
    }

    @Override
    public void synchronize(SchemaEntity entity, ReconcilePass pass) {
        SyncInvocation invocation = SyncInvocation.begin(recorder.clock());
        invocation.runWithMdc(() -> synchronizeTracked(entity, pass, invocation));
    }

    private void synchronizeTracked(SchemaEntity entity, ReconcilePass pass, SyncInvocation invocation) {
        String entityName = ChangeDescriptions.logicalNameOrNull(entity);
        log.debug("Synchronizing {} (pass {}, started {})",
                entityName, pass.passId(), invocation.startedAt());

        try {
            delegate.synchronize(entity, pass);
        } catch (RuntimeException e) {
            recorder.metrics().syncFailed();
            log.warn("Synchronization of {} failed, not recording: {}", entityName, e.getMessage());
            throw e;
        } finally {
            recorder.metrics().syncDuration(invocation.elapsedUntil(recorder.clock().instant()));
        }

        recorder.record(invocation, ChangeDescriptions.describe(entity), pass, entityName);
    }
}
