package com.schematrack.tracker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link VersionLabelGenerator}.
 */
@DisplayName("VersionLabelGenerator")
class VersionLabelGeneratorTest {

    private static final Instant T = Instant.parse("2024-03-05T07:08:09.750Z");

    @Test
    @DisplayName("default label is the UTC timestamp to the second")
    void defaultLabel() {
        var labels = new VersionLabelGenerator();

        assertThat(labels.labelFor(T)).isEqualTo("20240305070809");
        assertThat(labels.pattern()).isEqualTo("yyyyMMddHHmmss");
        assertThat(labels.zone()).isEqualTo(ZoneOffset.UTC);
    }

    @Test
    @DisplayName("instants within the same second share a label")
    void sameSecondSameLabel() {
        var labels = new VersionLabelGenerator();

        assertThat(labels.labelFor(T)).isEqualTo(labels.labelFor(T.minusMillis(700)));
    }

    @Test
    @DisplayName("custom pattern and zone are honoured")
    void customPatternAndZone() {
        var labels = new VersionLabelGenerator("yyyyMMddHHmmssSSS", ZoneId.of("Asia/Tokyo"));

        assertThat(labels.labelFor(T)).isEqualTo("20240305160809750");
    }

    @Test
    @DisplayName("invalid pattern is rejected")
    void invalidPattern() {
        assertThatThrownBy(() -> new VersionLabelGenerator("yyyy'", ZoneOffset.UTC))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new VersionLabelGenerator(" ", ZoneOffset.UTC))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("pattern");
    }
}
