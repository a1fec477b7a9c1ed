package com.schematrack.tracker.ledger;

/**
 * Thrown when a record's version label collides with one already in the ledger. The existing
 * record is left untouched.
 */
public class LedgerConflictException extends LedgerException {

    private final String version;

    public LedgerConflictException(String version, Throwable cause) {
        super("Schema version '%s' is already recorded".formatted(version), cause);
        this.version = version;
    }

    public String version() {
        return version;
    }

    @Override
    public String reason() {
        return "conflict";
    }
}
