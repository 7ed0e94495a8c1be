package com.strata.database.session;

import org.springframework.jdbc.core.JdbcTemplate;

/** H2 user variable {@code @app_current_identity}, used for tests and local runs. */
public class H2SessionDialect implements SessionVariableDialect {

    public static final String VARIABLE = "@app_current_identity";

    @Override
    public void bind(JdbcTemplate jdbc, String identityId) {
        jdbc.update("SET " + VARIABLE + " = ?", identityId);
    }

    @Override
    public void reset(JdbcTemplate jdbc) {
        jdbc.update("SET " + VARIABLE + " = NULL");
    }

    @Override
    public String currentIdentity(JdbcTemplate jdbc) {
        return jdbc.queryForObject("SELECT CAST(" + VARIABLE + " AS VARCHAR(255))", String.class);
    }

    @Override
    public String currentIdentityExpression() {
        return VARIABLE;
    }
}
