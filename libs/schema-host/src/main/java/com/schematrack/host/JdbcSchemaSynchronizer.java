package com.schematrack.host;

import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Default {@link EntitySynchronizer} that executes the DDL a {@link DdlEntity} declares.
 * <p>
 * Statements run one by one on the shared {@link JdbcTemplate}, outside any transaction; a failing
 * statement leaves the earlier ones applied.
 */
public class JdbcSchemaSynchronizer implements EntitySynchronizer {

    private static final Logger log = LoggerFactory.getLogger(JdbcSchemaSynchronizer.class);

    private final JdbcTemplate jdbcTemplate;

    public JdbcSchemaSynchronizer(DataSource dataSource) {
        this(new JdbcTemplate(dataSource));
    }

    public JdbcSchemaSynchronizer(JdbcTemplate jdbcTemplate) {
        if (jdbcTemplate == null) {
            throw new IllegalArgumentException("jdbcTemplate must not be null");
        }
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void synchronize(SchemaEntity entity, ReconcilePass pass) {
        String entityName = entity.logicalName();
        if (!(entity instanceof DdlEntity ddlEntity)) {
            throw new SchemaSyncException(
                    entityName, "Entity " + entityName + " does not declare any DDL");
        }

        int index = 0;
        for (String statement : ddlEntity.ddlStatements()) {
            index++;
            try {
                jdbcTemplate.execute(statement);
            } catch (DataAccessException e) {
                throw new SchemaSyncException(
                        entityName,
                        "Statement %d of %s failed: %s".formatted(index, entityName, e.getMessage()),
                        e);
            }
        }
        log.debug("Synchronized {} ({} statements, pass {})", entityName, index, pass.passId());
    }
}
