package com.strata.database.session;

/**
 * Work executed inside {@link SessionContextPropagator#withContext}.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface SessionWork<T> {

    T execute(BoundSession session);
}
