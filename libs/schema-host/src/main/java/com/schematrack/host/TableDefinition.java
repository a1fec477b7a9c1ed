package com.schematrack.host;

import java.util.List;

/**
 * Simple {@link DdlEntity} backed by a name and a fixed list of statements.
 *
 * @param logicalName the entity's logical name
 * @param ddlStatements statements executed, in order, to synchronize the entity's table
 */
public record TableDefinition(String logicalName, List<String> ddlStatements) implements DdlEntity {

    public TableDefinition {
        if (logicalName == null || logicalName.isBlank()) {
            throw new IllegalArgumentException("logicalName must not be null or blank");
        }
        ddlStatements = List.copyOf(ddlStatements);
    }

    /** Convenience factory for a single-statement definition. */
    public static TableDefinition of(String logicalName, String... ddlStatements) {
        return new TableDefinition(logicalName, List.of(ddlStatements));
    }
}
