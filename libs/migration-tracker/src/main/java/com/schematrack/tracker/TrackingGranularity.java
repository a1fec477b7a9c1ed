package com.schematrack.tracker;

/**
 * Where the tracker hooks into the host's reconciliation.
 */
public enum TrackingGranularity {

    /** One ledger entry per synchronized entity, naming that entity. */
    PER_ENTITY,

    /** One ledger entry per reconcile pass, listing every entity of the pass. */
    PER_PASS
}
