package com.schematrack.tracker.ledger;

/**
 * Base class for failures of a {@link VersionLedger}.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }

    protected LedgerException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Short machine-readable reason, used as a metric tag.
     */
    public abstract String reason();
}
