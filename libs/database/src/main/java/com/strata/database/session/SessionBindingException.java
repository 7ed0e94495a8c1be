package com.strata.database.session;

import java.util.List;

/**
 * Thrown when an identity cannot be bound to a database session. No query has run when this is
 * raised.
 */
public class SessionBindingException extends RuntimeException {

    private final List<String> problems;

    public SessionBindingException(List<String> problems) {
        super("Identity cannot be bound to a database session: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() {
        return problems;
    }
}
