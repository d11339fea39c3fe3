package io.syncbeat.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;
import java.util.Objects;

/**
 * Creates the {@code contacts} and {@code invoices} tables when they do not exist yet.
 */
public class MirrorSchemaInitializer {

    private static final Logger log = LoggerFactory.getLogger(MirrorSchemaInitializer.class);

    public static final String SCHEMA_LOCATION = "db/syncbeat-mirror-schema.sql";

    private final DataSource dataSource;

    public MirrorSchemaInitializer(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource must not be null");
    }

    public void initialize() {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_LOCATION));
        populator.execute(dataSource);
        log.info("Mirror schema ensured location={}", SCHEMA_LOCATION);
    }
}
