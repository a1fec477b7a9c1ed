package com.schematrack.tracker;

import com.schematrack.host.PassSynchronizer;
import com.schematrack.host.ReconcilePass;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-pass decorator that records one ledger entry for each reconcile pass that completes without
 * errors. Used when per-entity tracking is not wanted; the entry lists every entity of the pass.
 * <p>
 * The host reports per-entity failures on the pass instead of throwing them, so the pass counts as
 * failed when its error channel grew while the delegate ran.
 */
public final class PassSyncInterceptor implements PassSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(PassSyncInterceptor.class);

    private final PassSynchronizer delegate;
    private final LedgerRecorder recorder;

    PassSyncInterceptor(PassSynchronizer delegate, LedgerRecorder recorder) {
        this.delegate = delegate;
        this.recorder = recorder;
    }

    @Override
    public void synchronizeAll(ReconcilePass pass) {
        SyncInvocation invocation = SyncInvocation.begin(recorder.clock());
        invocation.runWithMdc(() -> synchronizeTracked(pass, invocation));
    }

    private void synchronizeTracked(ReconcilePass pass, SyncInvocation invocation) {
        log.debug("Synchronizing pass {} over {} entities", pass.passId(), pass.entities().size());

        int errorsBefore = pass.errorCount();
        try {
            delegate.synchronizeAll(pass);
        } catch (RuntimeException e) {
            recorder.metrics().syncFailed();
            log.warn("Pass {} failed, not recording: {}", pass.passId(), e.getMessage());
            throw e;
        } finally {
            recorder.metrics().syncDuration(invocation.elapsedUntil(recorder.clock().instant()));
        }

        int newErrors = pass.errorCount() - errorsBefore;
        if (newErrors > 0) {
            recorder.metrics().syncFailed();
            log.warn("Pass {} reported {} error(s), not recording", pass.passId(), newErrors);
            return;
        }

        recorder.record(invocation, ChangeDescriptions.describeBatch(pass.entities()), pass, null);
    }
}
