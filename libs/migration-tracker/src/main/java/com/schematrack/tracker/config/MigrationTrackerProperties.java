package com.schematrack.tracker.config;

import com.schematrack.tracker.TrackingGranularity;
import com.schematrack.tracker.VersionLabelGenerator;
import com.schematrack.tracker.ledger.JdbcVersionLedger;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Externalized configuration of the migration tracker.
 *
 * <p>Bound from the {@code schematrack.tracker.*} prefix:
 *
 * <pre>{@code
 * schematrack:
 *   tracker:
 *     enabled: true
 *     granularity: PER_ENTITY
 *     version-pattern: yyyyMMddHHmmss
 *     zone: UTC
 *     history-table: schematrack_flyway_history
 * }</pre>
 *
 * @param enabled whether the tracker beans are created
 * @param granularity where to hook into the host (default {@code PER_ENTITY})
 * @param versionPattern {@link java.time.format.DateTimeFormatter} pattern of version labels
 * @param zone zone id version labels are rendered in (default {@code UTC})
 * @param historyTable Flyway history table tracking the ledger table script
 */
@Validated
@ConfigurationProperties(prefix = "schematrack.tracker")
public record MigrationTrackerProperties(
        boolean enabled,
        @NotNull TrackingGranularity granularity,
        @NotBlank String versionPattern,
        @NotBlank String zone,
        @NotBlank String historyTable) {

    /**
     * Compact constructor: applies defaults for optional fields. Runs BEFORE Bean Validation, so
     * defaults satisfy constraints.
     */
    public MigrationTrackerProperties {
        if (granularity == null) {
            granularity = TrackingGranularity.PER_ENTITY;
        }
        if (versionPattern == null || versionPattern.isBlank()) {
            versionPattern = VersionLabelGenerator.DEFAULT_PATTERN;
        }
        if (zone == null || zone.isBlank()) {
            zone = VersionLabelGenerator.DEFAULT_ZONE.getId();
        }
        if (historyTable == null || historyTable.isBlank()) {
            historyTable = JdbcVersionLedger.DEFAULT_HISTORY_TABLE;
        }
    }

    /**
     * Builds the label generator described by {@link #versionPattern()} and {@link #zone()}.
     *
     * @throws IllegalArgumentException if the pattern is invalid
     * @throws java.time.DateTimeException if the zone id is invalid
     */
    public VersionLabelGenerator labelGenerator() {
        return new VersionLabelGenerator(versionPattern, ZoneId.of(zone));
    }
}
