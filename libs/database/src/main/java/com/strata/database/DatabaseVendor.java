package com.strata.database;

import java.sql.DatabaseMetaData;
import javax.sql.DataSource;
import org.springframework.boot.jdbc.DatabaseDriver;
import org.springframework.jdbc.support.JdbcUtils;
import org.springframework.jdbc.support.MetaDataAccessException;

/** Resolves the vendor id ({@code postgresql}, {@code h2}, …) behind a {@link DataSource}. */
public final class DatabaseVendor {

    private DatabaseVendor() {
        // utility class
    }

    /**
     * Returns the Spring Boot {@link DatabaseDriver} id for the data source's JDBC URL.
     *
     * @throws IllegalStateException if the metadata cannot be read
     */
    public static String resolve(DataSource dataSource) {
        try {
            String url = JdbcUtils.extractDatabaseMetaData(dataSource, DatabaseMetaData::getURL);
            return DatabaseDriver.fromJdbcUrl(url).getId();
        } catch (MetaDataAccessException e) {
            throw new IllegalStateException("Unable to determine database vendor", e);
        }
    }
}
