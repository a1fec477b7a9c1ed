package com.schematrack.tracker;

import com.schematrack.host.ExtensionPointUnavailableException;
import com.schematrack.host.SchemaReconciler;
import com.schematrack.tracker.ledger.LedgerException;
import com.schematrack.tracker.ledger.MigrationRecord;
import com.schematrack.tracker.ledger.VersionLedger;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks a host's automatic schema synchronizations in a {@link VersionLedger}.
 * <p>
 * {@link #initialize(SchemaReconciler)} creates the ledger table and installs the interceptor
 * matching the configured {@link TrackingGranularity}. Both steps are idempotent: initializing the
 * same host again leaves a single interceptor in place.
 *
 * <pre>{@code
 * MigrationTracker tracker = new MigrationTracker(new JdbcVersionLedger(dataSource));
 * tracker.initialize(reconciler);
 * reconciler.reconcile(orders, customers);
 * List<MigrationRecord> history = tracker.history();
 * }</pre>
 */
public class MigrationTracker {

    private static final Logger log = LoggerFactory.getLogger(MigrationTracker.class);

    /** Owner name under which the interceptor is installed; also the source of reported errors. */
    public static final String NAME = "schema-migration-tracker";

    private final VersionLedger ledger;
    private final TrackingGranularity granularity;
    private final LedgerRecorder recorder;

    /**
     * Creates a per-entity tracker with default version labels and the UTC system clock.
     *
     * @param ledger where entries are stored
     */
    public MigrationTracker(VersionLedger ledger) {
        this(ledger,
                TrackingGranularity.PER_ENTITY,
                new VersionLabelGenerator(),
                Clock.systemUTC(),
                new TrackerMetrics(new SimpleMeterRegistry(), TrackingGranularity.PER_ENTITY));
    }

    /**
     * Creates a tracker.
     *
     * @param ledger where entries are stored
     * @param granularity where to hook into the host
     * @param labels version label format
     * @param clock source of start and applied instants
     * @param metrics meters to update
     */
    public MigrationTracker(
            VersionLedger ledger,
            TrackingGranularity granularity,
            VersionLabelGenerator labels,
            Clock clock,
            TrackerMetrics metrics) {
        if (ledger == null) {
            throw new IllegalArgumentException("ledger must not be null");
        }
        if (granularity == null) {
            throw new IllegalArgumentException("granularity must not be null");
        }
        if (labels == null || clock == null || metrics == null) {
            throw new IllegalArgumentException("labels, clock and metrics must not be null");
        }
        this.ledger = ledger;
        this.granularity = granularity;
        this.recorder = new LedgerRecorder(ledger, labels, clock, metrics);
    }

    /**
     * Returns the tracker's name.
     */
    public String name() {
        return NAME;
    }

    public TrackingGranularity granularity() {
        return granularity;
    }

    /**
     * Creates the ledger table if needed and installs the interceptor on the host.
     *
     * @param host the reconciler whose synchronizations are tracked
     * @throws TrackerInitializationException if the table cannot be created or the extension point
     *     cannot be claimed
     */
    public void initialize(SchemaReconciler host) {
        if (host == null) {
            throw new IllegalArgumentException("host must not be null");
        }
        log.info("Initializing {} ({})", NAME, granularity);
        initializeLedger();

        try {
            boolean installed = switch (granularity) {
                case PER_ENTITY -> host.entityExtensionPoint().install(
                        NAME, next -> new EntitySyncInterceptor(next, recorder), false);
                case PER_PASS -> host.passExtensionPoint().install(
                        NAME, next -> new PassSyncInterceptor(next, recorder), false);
            };
            if (installed) {
                log.info("{} installed ({})", NAME, granularity);
            } else {
                log.debug("{} was already installed on this host", NAME);
            }
        } catch (ExtensionPointUnavailableException e) {
            throw new TrackerInitializationException(
                    "Failed to register schema sync interceptor: " + e.getMessage(), e);
        }
    }

    /**
     * Creates the ledger table if needed, without touching any host. Idempotent.
     *
     * @throws TrackerInitializationException if the table cannot be created
     */
    public void initializeLedger() {
        try {
            ledger.ensureInitialized();
        } catch (LedgerException e) {
            throw new TrackerInitializationException(
                    "Failed to create schema version table: " + e.getMessage(), e);
        }
    }

    public VersionLedger ledger() {
        return ledger;
    }

    /**
     * Returns the migration history, newest first.
     *
     * @throws com.schematrack.tracker.ledger.LedgerUnavailableException if storage cannot be reached
     */
    public List<MigrationRecord> history() {
        return ledger.listHistory();
    }
}
