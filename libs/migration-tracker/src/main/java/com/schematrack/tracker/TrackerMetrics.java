package com.schematrack.tracker;

import com.schematrack.tracker.ledger.LedgerException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;

/**
 * Micrometer meters of the migration tracker.
 * <p>
 * Every meter carries a {@code granularity} tag so per-entity and per-pass tracking can be told
 * apart on the same registry.
 */
public final class TrackerMetrics {

    /** Successful synchronizations written to the ledger. */
    public static final String SYNC_RECORDED = "schematrack.sync.recorded";

    /** Synchronizations that failed and were not recorded. */
    public static final String SYNC_FAILED = "schematrack.sync.failed";

    /** Ledger writes that failed after a successful synchronization. */
    public static final String LEDGER_FAILED = "schematrack.ledger.failed";

    /** Duration of intercepted synchronizations, successful or not. */
    public static final String SYNC_DURATION = "schematrack.sync.duration";

    /** Tag key for the tracking granularity. */
    public static final String TAG_GRANULARITY = "granularity";

    /** Tag key for the ledger failure reason. */
    public static final String TAG_REASON = "reason";

    private final MeterRegistry registry;
    private final Tags baseTags;
    private final Counter recorded;
    private final Counter failed;
    private final Timer duration;

    /**
     * Creates the tracker meters on the given registry.
     *
     * @param registry the Micrometer meter registry
     * @param granularity tracking granularity, included as a tag
     */
    public TrackerMetrics(MeterRegistry registry, TrackingGranularity granularity) {
        if (registry == null) {
            throw new IllegalArgumentException("registry must not be null");
        }
        if (granularity == null) {
            throw new IllegalArgumentException("granularity must not be null");
        }
        this.registry = registry;
        this.baseTags = Tags.of(TAG_GRANULARITY, granularity.name().toLowerCase());
        this.recorded = Counter.builder(SYNC_RECORDED)
                .description("Schema synchronizations recorded in the ledger")
                .tags(baseTags)
                .register(registry);
        this.failed = Counter.builder(SYNC_FAILED)
                .description("Schema synchronizations that failed and were not recorded")
                .tags(baseTags)
                .register(registry);
        this.duration = Timer.builder(SYNC_DURATION)
                .description("Duration of intercepted schema synchronizations")
                .tags(baseTags)
                .register(registry);
    }

    void recorded() {
        recorded.increment();
    }

    void syncFailed() {
        failed.increment();
    }

    void ledgerFailed(LedgerException failure) {
        Counter.builder(LEDGER_FAILED)
                .description("Ledger writes that failed after a successful schema synchronization")
                .tags(baseTags.and(TAG_REASON, failure.reason()))
                .register(registry)
                .increment();
    }

    void syncDuration(Duration elapsed) {
        duration.record(elapsed);
    }

    /**
     * Returns the underlying meter registry.
     */
    public MeterRegistry registry() {
        return registry;
    }
}
