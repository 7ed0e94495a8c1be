package com.strata.database.session;

/**
 * Lifecycle of one {@link BoundSession}.
 *
 * <p>{@code UNBOUND → BINDING → BOUND → UNBINDING → UNBOUND}. Both success and failure end in
 * {@code UNBOUND}; a binding failure goes straight back to it.
 */
public enum SessionState {
    UNBOUND,
    BINDING,
    BOUND,
    UNBINDING
}
