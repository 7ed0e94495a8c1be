package com.strata.database.session;

import org.springframework.jdbc.core.JdbcTemplate;

/**
 * How a database stores the caller's identity on a connection.
 *
 * <p>The identity lives in a connection-scoped variable. Row-filtering predicates read it through
 * {@link #currentIdentityExpression()}, so the application never passes the identity into a
 * visibility predicate as an ordinary parameter.
 */
public interface SessionVariableDialect {

    /** Sets the session variable to {@code identityId} on the template's connection. */
    void bind(JdbcTemplate jdbc, String identityId);

    /** Clears the session variable so the connection can go back to the pool. */
    void reset(JdbcTemplate jdbc);

    /** Reads the variable back; null when nothing is bound. */
    String currentIdentity(JdbcTemplate jdbc);

    /** SQL expression evaluating to the bound identity, or NULL when unbound. */
    String currentIdentityExpression();

    /**
     * Returns the dialect for a vendor id as produced by {@link com.strata.database.DatabaseVendor}.
     *
     * @throws IllegalStateException for vendors without session-variable support
     */
    static SessionVariableDialect forVendor(String vendorId) {
        return switch (vendorId) {
            case "postgresql" -> new PostgresSessionDialect();
            case "h2" -> new H2SessionDialect();
            default -> throw new IllegalStateException(
                    "No session variable dialect for database vendor '" + vendorId + "'");
        };
    }
}
