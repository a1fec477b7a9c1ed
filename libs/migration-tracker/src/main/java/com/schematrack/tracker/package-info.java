/**
 * Records a durable history of automatic schema synchronizations.
 *
 * <p>{@link com.schematrack.tracker.MigrationTracker} installs an interceptor on a
 * {@link com.schematrack.host.SchemaReconciler}:
 *
 * <ul>
 *   <li>{@link com.schematrack.tracker.EntitySyncInterceptor}: one ledger entry per synchronized
 *       entity ({@link com.schematrack.tracker.TrackingGranularity#PER_ENTITY}, the default)
 *   <li>{@link com.schematrack.tracker.PassSyncInterceptor}: one entry per reconcile pass
 *       ({@link com.schematrack.tracker.TrackingGranularity#PER_PASS})
 * </ul>
 *
 * <p>Failed synchronizations are never recorded. Ledger write failures are reported on the pass's
 * error channel; the schema change they follow is not rolled back.
 */
package com.schematrack.tracker;
