package com.schematrack.tracker.ledger;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/**
 * {@link VersionLedger} stored in the {@code schema_versions} table of a relational database.
 *
 * <p>The table is created by the Flyway script under {@link #MIGRATION_LOCATION}. Flyway tracks
 * that script in its own history table (default {@link #DEFAULT_HISTORY_TABLE}) so the ledger can
 * share a schema with an application that runs Flyway itself. Baselining starts at version 0, which
 * keeps {@code V1} applicable when the ledger is added to a schema that already holds tables.
 *
 * <p>Storage exceptions are translated by Spring: a {@link DuplicateKeyException} becomes a
 * {@link LedgerConflictException}, any other {@link DataAccessException} a
 * {@link LedgerUnavailableException}.
 */
public class JdbcVersionLedger implements VersionLedger {

    private static final Logger log = LoggerFactory.getLogger(JdbcVersionLedger.class);

    /** Ledger table name. */
    public static final String TABLE = "schema_versions";

    /** Flyway location of the ledger table scripts. */
    public static final String MIGRATION_LOCATION = "classpath:db/schematrack";

    /** Default name of the Flyway history table tracking the ledger scripts. */
    public static final String DEFAULT_HISTORY_TABLE = "schematrack_flyway_history";

    private final DataSource dataSource;
    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final String historyTable;

    public JdbcVersionLedger(DataSource dataSource) {
        this(dataSource, DEFAULT_HISTORY_TABLE);
    }

    /**
     * Creates a ledger on the given data source.
     *
     * @param dataSource connection source shared with the host
     * @param historyTable Flyway history table for the ledger scripts
     */
    public JdbcVersionLedger(DataSource dataSource, String historyTable) {
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource must not be null");
        }
        if (historyTable == null || historyTable.isBlank()) {
            throw new IllegalArgumentException("historyTable must not be null or blank");
        }
        this.dataSource = dataSource;
        this.jdbcTemplate = new NamedParameterJdbcTemplate(dataSource);
        this.historyTable = historyTable;
    }

    @Override
    public void ensureInitialized() {
        try {
            MigrateResult result = Flyway.configure()
                    .dataSource(dataSource)
                    .locations(MIGRATION_LOCATION)
                    .table(historyTable)
                    .baselineOnMigrate(true)
                    .baselineVersion("0")
                    .cleanDisabled(true)
                    .load()
                    .migrate();
            log.info("Ledger table {} ready ({} script(s) applied)", TABLE, result.migrationsExecuted);
        } catch (FlywayException e) {
            throw new LedgerUnavailableException(
                    "Failed to create " + TABLE + " table: " + e.getMessage(), e);
        }
        verifyShape();
    }

    @Override
    public MigrationRecord append(MigrationRecord record) {
        String insert = """
                INSERT INTO schema_versions (version, applied_at, changes)
                VALUES (:version, :appliedAt, :changes)
                """;
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("version", record.version())
                .addValue("appliedAt", OffsetDateTime.ofInstant(record.appliedAt(), ZoneOffset.UTC))
                .addValue("changes", record.changes());
        try {
            jdbcTemplate.update(insert, params);
            Long id = jdbcTemplate.queryForObject(
                    "SELECT id FROM schema_versions WHERE version = :version", params, Long.class);
            log.debug("Appended schema version {} with id {}", record.version(), id);
            return record.withId(id);
        } catch (DuplicateKeyException e) {
            throw new LedgerConflictException(record.version(), e);
        } catch (DataAccessException e) {
            throw new LedgerUnavailableException(
                    "Failed to record schema version " + record.version() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<MigrationRecord> listHistory() {
        String query = """
                SELECT id, version, applied_at, changes
                FROM schema_versions
                ORDER BY applied_at DESC, id DESC
                """;
        try {
            List<MigrationRecord> history =
                    jdbcTemplate.query(query, new MapSqlParameterSource(), JdbcVersionLedger::mapRow);
            log.debug("Retrieved {} migration history records", history.size());
            return history;
        } catch (DataAccessException e) {
            throw new LedgerUnavailableException(
                    "Failed to retrieve migration history: " + e.getMessage(), e);
        }
    }

    public String historyTable() {
        return historyTable;
    }

    // Fails when a pre-existing schema_versions table lacks one of the ledger columns.
    private void verifyShape() {
        try {
            jdbcTemplate.query(
                    "SELECT id, version, applied_at, changes FROM schema_versions WHERE 1 = 0",
                    new MapSqlParameterSource(),
                    JdbcVersionLedger::mapRow);
        } catch (DataAccessException e) {
            throw new LedgerUnavailableException(
                    TABLE + " table does not have the expected columns: " + e.getMessage(), e);
        }
    }

    private static MigrationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new MigrationRecord(
                rs.getLong("id"),
                rs.getString("version"),
                rs.getObject("applied_at", OffsetDateTime.class).toInstant(),
                rs.getString("changes"));
    }
}
