package com.strata.security;

import java.util.Map;
import java.util.Optional;

/**
 * Verified identity of the caller for one inbound request.
 *
 * <p>Built once per request from a validated identity token and passed explicitly to every core
 * operation. It is never held in a static or thread-local slot; the database session it gets bound
 * to is the only place it lives outside the call stack.
 *
 * @param identityId unique identifier of the caller (the token's {@code sub} claim)
 * @param claims remaining token claims, copied and immutable
 */
public record IdentityContext(String identityId, Map<String, Object> claims) {

    /** Maximum length of an identity identifier, matching the {@code identity_id} columns. */
    public static final int MAX_IDENTITY_LENGTH = 255;

    public IdentityContext {
        claims = claims == null ? Map.of() : Map.copyOf(claims);
    }

    /** Creates a context carrying only the identifier. */
    public static IdentityContext of(String identityId) {
        return new IdentityContext(identityId, Map.of());
    }

    /**
     * Returns a string claim, if present.
     *
     * @param name claim name (e.g. {@code email})
     */
    public Optional<String> claim(String name) {
        Object value = claims.get(name);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }

    @Override
    public String toString() {
        // claims may carry personal data; keep them out of log lines
        return "IdentityContext[identityId=" + identityId + "]";
    }
}
