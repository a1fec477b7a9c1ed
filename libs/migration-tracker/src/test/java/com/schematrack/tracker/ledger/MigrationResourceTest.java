package com.schematrack.tracker.ledger;

import static org.assertj.core.api.Assertions.assertThat;

import com.schematrack.tracker.config.MigrationTrackerConfig;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Verifies the ledger's SQL and configuration resources are packaged on the classpath, a problem
 * that would otherwise only surface at deployment time.
 */
@DisplayName("Ledger resource verification")
class MigrationResourceTest {

    @Test
    @DisplayName("V1__create_schema_versions.sql defines the ledger table")
    void ledgerScript() throws IOException {
        String sql = readClasspathResource("db/schematrack/V1__create_schema_versions.sql");

        assertThat(sql).containsIgnoringCase("CREATE TABLE IF NOT EXISTS schema_versions");
        assertThat(sql).contains("version", "applied_at", "changes");
        assertThat(sql).as("version labels must be unique").containsIgnoringCase("UNIQUE (version)");
    }

    @Test
    @DisplayName("application-schematrack.yml documents the tracker defaults")
    void profileDefaults() throws IOException {
        String yml = readClasspathResource("application-schematrack.yml");

        assertThat(yml).contains("schematrack:", "granularity: PER_ENTITY", "version-pattern: yyyyMMddHHmmss");
    }

    @Test
    @DisplayName("MigrationTrackerConfig is registered as an auto-configuration")
    void autoConfigurationRegistered() throws IOException {
        String imports = readClasspathResource(
                "META-INF/spring/org.springframework.boot.autoconfigure.AutoConfiguration.imports");

        assertThat(imports.lines()).contains(MigrationTrackerConfig.class.getName());
    }

    private String readClasspathResource(String path) throws IOException {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            assertThat(is).as("Resource '%s' must be on the classpath", path).isNotNull();
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
