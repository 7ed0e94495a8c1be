package com.strata.database.session;

import org.springframework.jdbc.core.JdbcTemplate;

/**
 * PostgreSQL custom setting {@code app.current_identity}.
 *
 * <p>The setting is session level ({@code is_local = false}) so that it survives until the
 * propagator resets it after commit or rollback. The row-level-security migration reads the same
 * setting.
 */
public class PostgresSessionDialect implements SessionVariableDialect {

    public static final String SETTING = "app.current_identity";

    @Override
    public void bind(JdbcTemplate jdbc, String identityId) {
        jdbc.queryForObject("SELECT set_config('" + SETTING + "', ?, false)", String.class, identityId);
    }

    @Override
    public void reset(JdbcTemplate jdbc) {
        jdbc.queryForObject("SELECT set_config('" + SETTING + "', '', false)", String.class);
    }

    @Override
    public String currentIdentity(JdbcTemplate jdbc) {
        return jdbc.queryForObject("SELECT " + currentIdentityExpression(), String.class);
    }

    @Override
    public String currentIdentityExpression() {
        return "NULLIF(current_setting('" + SETTING + "', true), '')";
    }
}
