package com.schematrack.tracker.ledger;

/**
 * Thrown when the ledger's storage cannot be reached or is not in the expected shape.
 */
public class LedgerUnavailableException extends LedgerException {

    public LedgerUnavailableException(String message) {
        super(message);
    }

    public LedgerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String reason() {
        return "unavailable";
    }
}
