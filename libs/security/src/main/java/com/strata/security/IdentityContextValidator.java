package com.strata.security;

import java.util.ArrayList;

/**
 * Checks that an {@link IdentityContext} is well-formed before it is bound to a database session.
 *
 * <p>All problems are reported at once. A malformed identity must never reach the session
 * variable, so callers treat a failing result as an authentication failure.
 */
public final class IdentityContextValidator {

    private IdentityContextValidator() {
        // utility class
    }

    /**
     * Validates the given identity.
     *
     * @param identity the identity to check (may be null)
     * @return a {@link IdentityValidationResult} with any errors found
     */
    public static IdentityValidationResult validate(IdentityContext identity) {
        var errors = new ArrayList<String>();

        if (identity == null) {
            errors.add("identity must not be null");
            return IdentityValidationResult.fail(errors);
        }

        String id = identity.identityId();
        if (id == null || id.isBlank()) {
            errors.add("identityId must not be null or blank");
        } else {
            if (id.length() > IdentityContext.MAX_IDENTITY_LENGTH) {
                errors.add(
                        "identityId must be at most %d characters"
                                .formatted(IdentityContext.MAX_IDENTITY_LENGTH));
            }
            if (!id.equals(id.strip())) {
                errors.add("identityId must not have leading or trailing whitespace");
            }
            if (id.chars().anyMatch(Character::isISOControl)) {
                errors.add("identityId must not contain control characters");
            }
        }

        return errors.isEmpty() ? IdentityValidationResult.ok() : IdentityValidationResult.fail(errors);
    }
}
