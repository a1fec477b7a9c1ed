package com.schematrack.tracker.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link MigrationRecord}.
 */
@DisplayName("MigrationRecord")
class MigrationRecordTest {

    private static final Instant T = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    @DisplayName("unsaved record has no id until storage assigns one")
    void unsavedHasNoId() {
        var record = MigrationRecord.unsaved("20240101000000", T, "AutoMigrated Order");

        assertThat(record.id()).isNull();
        assertThat(record.withId(7)).isEqualTo(new MigrationRecord(7L, "20240101000000", T, "AutoMigrated Order"));
    }

    @Test
    @DisplayName("requires version, appliedAt and changes")
    void requiresFields() {
        assertThatThrownBy(() -> MigrationRecord.unsaved(" ", T, "x"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("version");
        assertThatThrownBy(() -> MigrationRecord.unsaved("v", null, "x"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("appliedAt");
        assertThatThrownBy(() -> MigrationRecord.unsaved("v", T, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("changes");
    }
}
