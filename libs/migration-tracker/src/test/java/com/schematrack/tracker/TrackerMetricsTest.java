package com.schematrack.tracker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.schematrack.tracker.ledger.LedgerConflictException;
import com.schematrack.tracker.ledger.LedgerUnavailableException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link TrackerMetrics}.
 */
@DisplayName("TrackerMetrics")
class TrackerMetricsTest {

    private SimpleMeterRegistry registry;
    private TrackerMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new TrackerMetrics(registry, TrackingGranularity.PER_ENTITY);
    }

    @Test
    @DisplayName("should reject null registry")
    void shouldRejectNullRegistry() {
        assertThatThrownBy(() -> new TrackerMetrics(null, TrackingGranularity.PER_PASS))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("registry");
    }

    @Test
    @DisplayName("counters carry the granularity tag")
    void countersCarryGranularity() {
        metrics.recorded();
        metrics.recorded();
        metrics.syncFailed();

        assertThat(registry.get(TrackerMetrics.SYNC_RECORDED)
                .tag(TrackerMetrics.TAG_GRANULARITY, "per_entity").counter().count()).isEqualTo(2.0);
        assertThat(registry.get(TrackerMetrics.SYNC_FAILED).counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("ledger failures are counted per reason")
    void ledgerFailuresPerReason() {
        metrics.ledgerFailed(new LedgerConflictException("20240101000000", null));
        metrics.ledgerFailed(new LedgerConflictException("20240101000001", null));
        metrics.ledgerFailed(new LedgerUnavailableException("down"));

        assertThat(registry.get(TrackerMetrics.LEDGER_FAILED)
                .tag(TrackerMetrics.TAG_REASON, "conflict").counter().count()).isEqualTo(2.0);
        assertThat(registry.get(TrackerMetrics.LEDGER_FAILED)
                .tag(TrackerMetrics.TAG_REASON, "unavailable").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("sync durations are timed")
    void durationsAreTimed() {
        metrics.syncDuration(Duration.ofMillis(120));

        var timer = registry.get(TrackerMetrics.SYNC_DURATION).timer();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(120.0);
        assertThat(metrics.registry()).isSameAs(registry);
    }
}
