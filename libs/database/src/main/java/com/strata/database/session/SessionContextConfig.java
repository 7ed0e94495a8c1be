package com.strata.database.session;

import com.strata.database.DatabaseVendor;
import javax.sql.DataSource;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the {@link SessionContextPropagator} for the application's data source. */
@Configuration
@EnableConfigurationProperties(SessionProperties.class)
public class SessionContextConfig {

    private static final Logger log = LoggerFactory.getLogger(SessionContextConfig.class);

    @Bean
    public SessionVariableDialect sessionVariableDialect(DataSource dataSource) {
        return SessionVariableDialect.forVendor(DatabaseVendor.resolve(dataSource));
    }

    /**
     * The propagator is the only entry point to the database, so it is created after the schema
     * migration (when one is configured) has run.
     */
    @Bean
    public SessionContextPropagator sessionContextPropagator(
            DataSource dataSource,
            SessionVariableDialect dialect,
            SessionProperties properties,
            ObjectProvider<Flyway> migrations) {
        migrations.ifAvailable(
                flyway ->
                        log.info(
                                "Schema ready with {} applied migration(s)",
                                flyway.info().applied().length));
        return new SessionContextPropagator(dataSource, dialect, properties.statementTimeout());
    }
}
