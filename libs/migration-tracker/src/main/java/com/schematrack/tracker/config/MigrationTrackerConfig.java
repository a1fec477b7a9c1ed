package com.schematrack.tracker.config;

import com.schematrack.host.SchemaReconciler;
import com.schematrack.tracker.MigrationTracker;
import com.schematrack.tracker.TrackerMetrics;
import com.schematrack.tracker.ledger.JdbcVersionLedger;
import com.schematrack.tracker.ledger.MigrationHistoryService;
import com.schematrack.tracker.ledger.VersionLedger;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.util.List;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring configuration of the migration tracker.
 *
 * <p>Registered as an auto-configuration through
 * {@code META-INF/spring/org.springframework.boot.autoconfigure.AutoConfiguration.imports}; it can
 * also be {@code @Import}ed directly. Creates a {@link MigrationTracker} that is initialized against
 * every {@link SchemaReconciler} bean while the context starts. An initialization failure fails the
 * context: the application must not run believing its schema changes are audited when they are not.
 *
 * <p>The ledger is the application's {@link VersionLedger} bean if it declares one, otherwise a
 * {@link JdbcVersionLedger} on the application's {@link DataSource}. The choice is made when the
 * tracker is created, so it holds however this configuration was brought in. The JDBC fallback is
 * not registered as a bean; {@link MigrationTracker#ledger()} exposes the ledger in use.
 *
 * <h2>Beans</h2>
 *
 * <ul>
 *   <li>{@link TrackerMetrics}: on the application's {@link MeterRegistry} if there is one
 *   <li>{@link MigrationTracker}
 *   <li>{@link MigrationHistoryService}: reads the tracker's ledger
 * </ul>
 *
 * @see MigrationTrackerProperties
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@EnableConfigurationProperties(MigrationTrackerProperties.class)
@ConditionalOnProperty(prefix = "schematrack.tracker", name = "enabled", havingValue = "true")
public class MigrationTrackerConfig {

    private static final Logger log = LoggerFactory.getLogger(MigrationTrackerConfig.class);

    @Bean
    public TrackerMetrics trackerMetrics(
            ObjectProvider<MeterRegistry> meterRegistry, MigrationTrackerProperties properties) {
        return new TrackerMetrics(
                meterRegistry.getIfAvailable(SimpleMeterRegistry::new), properties.granularity());
    }

    /**
     * Creates the tracker and initializes it against every reconciler in the context. Without any
     * reconciler only the ledger table is created, so the history can still be read.
     *
     * @throws com.schematrack.tracker.TrackerInitializationException if the ledger table cannot be
     *     created or an extension point cannot be claimed
     */
    @Bean
    public MigrationTracker migrationTracker(
            ObjectProvider<VersionLedger> versionLedger,
            ObjectProvider<DataSource> dataSource,
            TrackerMetrics trackerMetrics,
            MigrationTrackerProperties properties,
            ObjectProvider<Clock> clock,
            ObjectProvider<SchemaReconciler> reconcilers) {
        VersionLedger ledger = versionLedger.getIfAvailable(
                () -> new JdbcVersionLedger(dataSource.getObject(), properties.historyTable()));
        MigrationTracker tracker = new MigrationTracker(
                ledger,
                properties.granularity(),
                properties.labelGenerator(),
                clock.getIfAvailable(Clock::systemUTC),
                trackerMetrics);

        List<SchemaReconciler> hosts = reconcilers.orderedStream().toList();
        if (hosts.isEmpty()) {
            log.warn("No SchemaReconciler bean found; {} only prepares the ledger table",
                    MigrationTracker.NAME);
            tracker.initializeLedger();
        } else {
            hosts.forEach(tracker::initialize);
        }
        return tracker;
    }

    @Bean
    public MigrationHistoryService migrationHistoryService(MigrationTracker migrationTracker) {
        return new MigrationHistoryService(migrationTracker.ledger());
    }
}
