package com.strata.database.session;

import com.strata.database.policy.RowFilterPolicy;
import com.strata.security.IdentityContext;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.jdbc.support.SQLExceptionTranslator;

/**
 * One identity bound to one borrowed connection for the length of one logical request.
 *
 * <p>Handed to the work passed to {@link SessionContextPropagator#withContext}; every repository
 * call takes it as an explicit argument. Once the propagator has unbound it, any further use fails
 * with {@link IllegalStateException}.
 */
public final class BoundSession {

    private final IdentityContext identity;
    private final GuardedDataSource dataSource;
    private final JdbcTemplate jdbc;
    private final NamedParameterJdbcTemplate namedJdbc;
    private final RowFilterPolicy rowFilter;
    private volatile SessionState state = SessionState.UNBOUND;

    BoundSession(
            IdentityContext identity,
            Connection connection,
            SessionVariableDialect dialect,
            SQLExceptionTranslator translator,
            Duration statementTimeout) {
        this.identity = identity;
        this.dataSource = new GuardedDataSource(connection);
        this.jdbc = new JdbcTemplate(dataSource, true);
        this.jdbc.setExceptionTranslator(translator);
        if (statementTimeout != null && !statementTimeout.isZero()) {
            this.jdbc.setQueryTimeout((int) Math.max(1, statementTimeout.toSeconds()));
        }
        this.namedJdbc = new NamedParameterJdbcTemplate(jdbc);
        this.rowFilter = new RowFilterPolicy(dialect);
    }

    /** The caller this session acts for. */
    public IdentityContext identity() {
        return identity;
    }

    /** Shortcut for {@code identity().identityId()}. */
    public String identityId() {
        return identity.identityId();
    }

    public SessionState state() {
        return state;
    }

    /** Visibility predicates evaluated against this session's bound identity. */
    public RowFilterPolicy rowFilter() {
        return rowFilter;
    }

    /**
     * JDBC access on the bound connection.
     *
     * @throws IllegalStateException if the session is not bound
     */
    public JdbcTemplate jdbc() {
        requireBound();
        return jdbc;
    }

    /**
     * Named-parameter JDBC access on the bound connection.
     *
     * @throws IllegalStateException if the session is not bound
     */
    public NamedParameterJdbcTemplate namedJdbc() {
        requireBound();
        return namedJdbc;
    }

    // used by the propagator for the bind and reset statements, which run outside BOUND
    JdbcTemplate internalJdbc() {
        return jdbc;
    }

    void transition(SessionState next) {
        this.state = next;
    }

    private void requireBound() {
        if (state != SessionState.BOUND) {
            throw new IllegalStateException(
                    "Session for " + identity.identityId() + " is " + state + ", not BOUND");
        }
    }

    /**
     * Single-connection data source that refuses hand-outs after the session has ended, so a
     * template captured by application code cannot reach a connection that is back in the pool.
     */
    private final class GuardedDataSource extends SingleConnectionDataSource {

        GuardedDataSource(Connection connection) {
            super(connection, true);
        }

        @Override
        public Connection getConnection() throws SQLException {
            if (state == SessionState.UNBOUND) {
                throw new IllegalStateException(
                        "Session for " + identity.identityId() + " has already been released");
            }
            return super.getConnection();
        }
    }
}
