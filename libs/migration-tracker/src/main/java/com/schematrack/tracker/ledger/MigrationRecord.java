package com.schematrack.tracker.ledger;

import java.time.Instant;

/**
 * One entry of the schema version ledger. Never mutated once stored.
 *
 * @param id surrogate identity assigned by storage; null until appended
 * @param version unique label derived from the synchronization time (e.g., "20240101120000")
 * @param appliedAt when the entry was written
 * @param changes human-readable description of what was synchronized
 */
public record MigrationRecord(Long id, String version, Instant appliedAt, String changes) {

    public MigrationRecord {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("version must not be null or blank");
        }
        if (appliedAt == null) {
            throw new IllegalArgumentException("appliedAt must not be null");
        }
        if (changes == null) {
            throw new IllegalArgumentException("changes must not be null");
        }
    }

    /** Creates a record that storage has not assigned an id to yet. */
    public static MigrationRecord unsaved(String version, Instant appliedAt, String changes) {
        return new MigrationRecord(null, version, appliedAt, changes);
    }

    /** Returns a copy carrying the storage-assigned id. */
    public MigrationRecord withId(long assignedId) {
        return new MigrationRecord(assignedId, version, appliedAt, changes);
    }
}
