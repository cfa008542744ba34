package com.property.distress.store.jdbc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

/**
 * Creates the tables and indexes if they do not exist yet.
 */
public final class JdbcSchemaInitializer {
    private static final Logger log = LoggerFactory.getLogger(JdbcSchemaInitializer.class);
    public static final String SCHEMA_RESOURCE = "db/schema.sql";

    private JdbcSchemaInitializer() {
    }

    public static void initialize(DataSource dataSource) {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_RESOURCE));
        populator.setSqlScriptEncoding("UTF-8");
        populator.execute(dataSource);
        log.info("schema.initialized resource={}", SCHEMA_RESOURCE);
    }
}
