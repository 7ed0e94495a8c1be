package com.strata.hierarchy.domain;

/**
 * Base class for the failures the hierarchy service reports to its callers.
 *
 * <p>Each subclass maps to one HTTP status in {@code GlobalExceptionHandler}; the {@link
 * #errorCode()} is the stable machine-readable value of the {@code error_code} response field.
 */
public abstract class HierarchyException extends RuntimeException {

    private final String errorCode;

    protected HierarchyException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected HierarchyException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String errorCode() {
        return errorCode;
    }
}
