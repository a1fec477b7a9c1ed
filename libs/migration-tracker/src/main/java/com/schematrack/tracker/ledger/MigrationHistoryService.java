package com.schematrack.tracker.ledger;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view over the schema version ledger, for actuator endpoints, admin tools or health
 * checks.
 * <p>
 * This is a POJO (no Spring annotations); the Spring wiring happens in
 * {@link com.schematrack.tracker.config.MigrationTrackerConfig}.
 */
public class MigrationHistoryService {

    private final VersionLedger ledger;

    public MigrationHistoryService(VersionLedger ledger) {
        if (ledger == null) {
            throw new IllegalArgumentException("ledger must not be null");
        }
        this.ledger = ledger;
    }

    /**
     * Returns the full history, newest first.
     */
    public List<MigrationRecord> history() {
        return ledger.listHistory();
    }

    /**
     * Returns the most recently applied record, if any.
     */
    public Optional<MigrationRecord> latest() {
        return history().stream().findFirst();
    }

    /**
     * Returns the version label of the most recently applied record, if any.
     */
    public Optional<String> currentVersion() {
        return latest().map(MigrationRecord::version);
    }

    /**
     * Returns the number of recorded synchronizations.
     */
    public int count() {
        return history().size();
    }
}
