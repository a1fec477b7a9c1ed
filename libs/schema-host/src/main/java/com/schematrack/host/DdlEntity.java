package com.schematrack.host;

import java.util.List;

/**
 * A {@link SchemaEntity} that carries the DDL statements bringing its table up to date.
 *
 * <p>Statements must be idempotent ({@code CREATE TABLE IF NOT EXISTS}, {@code ALTER TABLE ... ADD
 * COLUMN IF NOT EXISTS}); {@link JdbcSchemaSynchronizer} executes them on every pass.
 */
public interface DdlEntity extends SchemaEntity {

    /**
     * Returns the statements to execute, in order.
     */
    List<String> ddlStatements();
}
