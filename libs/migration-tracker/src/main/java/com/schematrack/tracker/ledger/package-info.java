/**
 * Append-only storage of {@link com.schematrack.tracker.ledger.MigrationRecord} entries.
 *
 * <p>Contains:
 *
 * <ul>
 *   <li>{@link com.schematrack.tracker.ledger.VersionLedger}: write/read contract
 *   <li>{@link com.schematrack.tracker.ledger.JdbcVersionLedger}: JDBC implementation; the table
 *       is created by a Flyway migration under {@code classpath:db/schematrack}
 *   <li>{@link com.schematrack.tracker.ledger.MigrationHistoryService}: read-only history view
 * </ul>
 */
package com.schematrack.tracker.ledger;
