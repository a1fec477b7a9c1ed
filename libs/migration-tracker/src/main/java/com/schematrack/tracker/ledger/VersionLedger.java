package com.schematrack.tracker.ledger;

import java.util.List;

/**
 * Durable, append-only store of {@link MigrationRecord} entries.
 * <p>
 * Implementations rely on the storage layer for atomic inserts and version uniqueness; they hold
 * no locks of their own and are safe to share between threads.
 */
public interface VersionLedger {

    /**
     * Creates the ledger's storage structure if it does not exist yet. Safe to call on every
     * startup.
     *
     * @throws LedgerUnavailableException if the structure cannot be created or does not have the
     *     expected shape
     */
    void ensureInitialized();

    /**
     * Appends one record.
     *
     * @param record the record to store; its id is ignored
     * @return the stored record with its assigned id
     * @throws LedgerConflictException if a record with the same version already exists
     * @throws LedgerUnavailableException if storage cannot be reached
     */
    MigrationRecord append(MigrationRecord record);

    /**
     * Returns every record, most recently applied first.
     *
     * @throws LedgerUnavailableException if storage cannot be reached
     */
    List<MigrationRecord> listHistory();
}
