package com.strata.database.session;

import com.strata.security.IdentityContext;
import com.strata.security.IdentityContextValidator;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.UncategorizedSQLException;
import org.springframework.jdbc.support.SQLErrorCodeSQLExceptionTranslator;
import org.springframework.jdbc.support.SQLExceptionTranslator;

/**
 * Binds an {@link IdentityContext} to a pooled connection for the duration of one unit of work.
 *
 * <p>For every call to {@link #withContext}:
 *
 * <ol>
 *   <li>the identity is validated; a malformed identity fails before a connection is borrowed
 *   <li>a connection is borrowed and the identity written to the session variable
 *   <li>the work runs in a single transaction, committed on return and rolled back on any throwable
 *   <li>the session variable is cleared after commit or rollback, on every exit path
 * </ol>
 *
 * <p>If clearing fails the connection is evicted from the pool instead of being returned, so a
 * stale identity can never reach the next borrower.
 */
public class SessionContextPropagator {

    private static final Logger log = LoggerFactory.getLogger(SessionContextPropagator.class);

    private final DataSource dataSource;
    private final SessionVariableDialect dialect;
    private final SQLExceptionTranslator translator;
    private final Duration statementTimeout;

    public SessionContextPropagator(
            DataSource dataSource, SessionVariableDialect dialect, Duration statementTimeout) {
        this.dataSource = dataSource;
        this.dialect = dialect;
        this.translator = new SQLErrorCodeSQLExceptionTranslator(dataSource);
        this.statementTimeout = statementTimeout;
    }

    public SessionVariableDialect dialect() {
        return dialect;
    }

    /**
     * Runs {@code work} with {@code identity} bound to a dedicated connection and transaction.
     *
     * @throws SessionBindingException if the identity is malformed (nothing has been queried)
     */
    public <T> T withContext(IdentityContext identity, SessionWork<T> work) {
        var validation = IdentityContextValidator.validate(identity);
        if (!validation.valid()) {
            throw new SessionBindingException(validation.errors());
        }

        Connection connection = borrow();
        BoundSession session = null;
        boolean connectionClean = false;
        try {
            session = new BoundSession(identity, connection, dialect, translator, statementTimeout);
            boolean autoCommit = connection.getAutoCommit();
            try {
                session.transition(SessionState.BINDING);
                dialect.bind(session.internalJdbc(), identity.identityId());
                session.transition(SessionState.BOUND);
                log.debug("Bound identity {} to session", identity.identityId());

                connection.setAutoCommit(false);
                T result = runInTransaction(connection, session, work);
                return result;
            } finally {
                session.transition(SessionState.UNBINDING);
                connectionClean = unbind(session, connection, autoCommit);
            }
        } catch (SQLException e) {
            throw translate("session setup", e);
        } finally {
            if (session != null) {
                session.transition(SessionState.UNBOUND);
            }
            release(connection, connectionClean);
        }
    }

    private <T> T runInTransaction(Connection connection, BoundSession session, SessionWork<T> work)
            throws SQLException {
        T result;
        try {
            result = work.execute(session);
        } catch (RuntimeException | Error e) {
            rollback(connection, e);
            throw e;
        }
        try {
            connection.commit();
        } catch (SQLException e) {
            rollback(connection, e);
            throw e;
        }
        return result;
    }

    private void rollback(Connection connection, Throwable cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    /** Clears the session variable; returns false when the connection must not be reused. */
    private boolean unbind(BoundSession session, Connection connection, boolean autoCommit) {
        try {
            if (!connection.getAutoCommit()) {
                // anything still open here was never committed
                connection.rollback();
            }
            connection.setAutoCommit(autoCommit);
            dialect.reset(session.internalJdbc());
            log.debug("Unbound identity {} from session", session.identityId());
            return true;
        } catch (SQLException | DataAccessException e) {
            log.warn(
                    "Failed to reset session for identity {}; connection will be evicted",
                    session.identityId(),
                    e);
            return false;
        }
    }

    private Connection borrow() {
        try {
            return dataSource.getConnection();
        } catch (SQLException e) {
            throw new CannotGetJdbcConnectionException("Failed to obtain JDBC connection", e);
        }
    }

    private void release(Connection connection, boolean clean) {
        try {
            if (!clean) {
                evict(connection);
            }
            connection.close();
        } catch (SQLException e) {
            log.warn("Failed to release JDBC connection", e);
        }
    }

    private void evict(Connection connection) throws SQLException {
        if (dataSource.isWrapperFor(HikariDataSource.class)) {
            dataSource.unwrap(HikariDataSource.class).evictConnection(connection);
        } else {
            connection.abort(Runnable::run);
        }
    }

    private DataAccessException translate(String task, SQLException e) {
        DataAccessException translated = translator.translate(task, null, e);
        return translated != null ? translated : new UncategorizedSQLException(task, null, e);
    }
}
