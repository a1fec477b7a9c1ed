package com.schematrack.tracker;

import com.schematrack.host.ReconcilePass;
import com.schematrack.tracker.ledger.LedgerException;
import com.schematrack.tracker.ledger.MigrationRecord;
import com.schematrack.tracker.ledger.VersionLedger;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the ledger entry of a successful synchronization. Shared by both interceptors.
 */
final class LedgerRecorder {

    private static final Logger log = LoggerFactory.getLogger(LedgerRecorder.class);

    private final VersionLedger ledger;
    private final VersionLabelGenerator labels;
    private final Clock clock;
    private final TrackerMetrics metrics;

    LedgerRecorder(
            VersionLedger ledger, VersionLabelGenerator labels, Clock clock, TrackerMetrics metrics) {
        this.ledger = ledger;
        this.labels = labels;
        this.clock = clock;
        this.metrics = metrics;
    }

    Clock clock() {
        return clock;
    }

    TrackerMetrics metrics() {
        return metrics;
    }

    /**
     * Appends the entry for a completed synchronization. A ledger failure is reported on the pass's
     * error channel instead of being thrown.
     *
     * @param invocation the synchronization being recorded
     * @param changes description of what was synchronized
     * @param pass pass whose error channel receives failures
     * @param entityName entity reported with a failure, or null for a whole pass
     * @return the stored record, or empty if the write failed
     */
    Optional<MigrationRecord> record(
            SyncInvocation invocation, String changes, ReconcilePass pass, String entityName) {
        Instant now = clock.instant();
        Instant appliedAt = now.isBefore(invocation.startedAt()) ? invocation.startedAt() : now;
        MigrationRecord record = MigrationRecord.unsaved(
                labels.labelFor(invocation.startedAt()), appliedAt, changes);

        try {
            MigrationRecord stored = ledger.append(record);
            metrics.recorded();
            log.info("Recorded schema version {}: {}", stored.version(), firstLine(changes));
            return Optional.of(stored);
        } catch (LedgerException e) {
            metrics.ledgerFailed(e);
            log.warn("Failed to record schema version {}: {}", record.version(), e.getMessage());
            pass.reportError(MigrationTracker.NAME, entityName, e);
            return Optional.empty();
        }
    }

    private static String firstLine(String changes) {
        int newline = changes.indexOf('\n');
        return newline < 0 ? changes : changes.substring(0, newline) + " ...";
    }
}
