package com.schematrack.tracker;

/**
 * Thrown when {@link MigrationTracker#initialize} cannot create the ledger table or install its
 * interceptor. Tracking must be considered inactive.
 */
public class TrackerInitializationException extends RuntimeException {

    public TrackerInitializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
