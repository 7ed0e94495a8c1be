package com.strata.database;

import com.strata.database.migration.FlywayConfigProperties;
import com.strata.database.migration.FlywayMigrationConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.util.UUID;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

/**
 * Migrated in-memory H2 database behind a one-connection Hikari pool, so consecutive sessions are
 * guaranteed to reuse the same physical connection unless it was evicted. Flyway migrates through
 * its own unpooled connections since it holds more than one at a time.
 */
public final class H2TestDatabase implements AutoCloseable {

    private final HikariDataSource dataSource;

    private H2TestDatabase(HikariDataSource dataSource) {
        this.dataSource = dataSource;
    }

    public static H2TestDatabase migrated() {
        String url =
                "jdbc:h2:mem:strata-"
                        + UUID.randomUUID()
                        + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH"
                        + ";DB_CLOSE_DELAY=-1";

        var migrationSource = new DriverManagerDataSource(url, "sa", "");
        var properties = new FlywayConfigProperties(null, null, null);
        FlywayMigrationConfig.createFlyway(
                        migrationSource,
                        properties,
                        properties.locationsFor(DatabaseVendor.resolve(migrationSource))
                                .toArray(String[]::new))
                .migrate();

        var config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setUsername("sa");
        config.setMaximumPoolSize(1);
        return new H2TestDatabase(new HikariDataSource(config));
    }

    public HikariDataSource dataSource() {
        return dataSource;
    }

    /** Unfiltered access, playing the role of the schema owner. */
    public JdbcTemplate owner() {
        return new JdbcTemplate(dataSource);
    }

    public UUID insertCluster(String name, String createdBy) {
        UUID id = UUID.randomUUID();
        owner().update(
                        "INSERT INTO clusters (id, name, created_by, created_at, updated_at)"
                                + " VALUES (?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)",
                        id,
                        name,
                        createdBy);
        return id;
    }

    public void insertMembership(UUID clusterId, String identityId, String role) {
        owner().update(
                        "INSERT INTO cluster_memberships"
                                + " (id, cluster_id, identity_id, role, created_at, updated_at)"
                                + " VALUES (?, ?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)",
                        UUID.randomUUID(),
                        clusterId,
                        identityId,
                        role);
    }

    public UUID insertDomain(String name, UUID clusterId) {
        UUID id = UUID.randomUUID();
        owner().update(
                        "INSERT INTO domains (id, name, created_by, created_at, updated_at)"
                                + " VALUES (?, ?, 'seed', CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)",
                        id,
                        name);
        owner().update(
                        "INSERT INTO cluster_domain_links (cluster_id, domain_id, created_at)"
                                + " VALUES (?, ?, CURRENT_TIMESTAMP)",
                        clusterId,
                        id);
        return id;
    }

    public UUID insertResource(String name, UUID domainId) {
        UUID id = UUID.randomUUID();
        owner().update(
                        "INSERT INTO resources"
                                + " (id, name, configuration, created_by, created_at, updated_at)"
                                + " VALUES (?, ?, '{}', 'seed', CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)",
                        id,
                        name);
        owner().update(
                        "INSERT INTO domain_resource_links (domain_id, resource_id, created_at)"
                                + " VALUES (?, ?, CURRENT_TIMESTAMP)",
                        domainId,
                        id);
        return id;
    }

    @Override
    public void close() {
        dataSource.close();
    }
}
