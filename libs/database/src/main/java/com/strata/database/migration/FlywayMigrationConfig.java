package com.strata.database.migration;

import com.strata.database.DatabaseVendor;
import java.util.Map;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the Flyway instance that owns the hierarchy schema.
 *
 * <p>Runs against the application's pooled {@link DataSource}. Spring Boot's {@link
 * FlywayAutoConfiguration} must be switched off ({@code spring.flyway.enabled: false}) so the
 * schema is migrated exactly once, with the vendor-expanded locations and the {@code app_role}
 * placeholder the PostgreSQL scripts need.
 */
@Configuration
@EnableConfigurationProperties(FlywayConfigProperties.class)
@ConditionalOnProperty(
        prefix = "strata.flyway",
        name = "enabled",
        havingValue = "true",
        matchIfMissing = true)
public class FlywayMigrationConfig {

    /** Bean name of the hierarchy Flyway instance. */
    public static final String FLYWAY_BEAN = "strataFlyway";

    private static final Logger log = LoggerFactory.getLogger(FlywayMigrationConfig.class);

    @Bean(name = FLYWAY_BEAN, initMethod = "migrate")
    public Flyway strataFlyway(DataSource dataSource, FlywayConfigProperties properties) {
        String vendor = DatabaseVendor.resolve(dataSource);
        var locations = properties.locationsFor(vendor);
        log.info("Migrating {} schema from {}", vendor, locations);
        return createFlyway(dataSource, properties, locations.toArray(String[]::new));
    }

    public static Flyway createFlyway(
            DataSource dataSource, FlywayConfigProperties properties, String... locations) {
        return Flyway.configure()
                .dataSource(dataSource)
                .locations(locations)
                .placeholders(Map.of("app_role", properties.appRole()))
                .failOnMissingLocations(false)
                .cleanDisabled(true)
                .load();
    }
}
