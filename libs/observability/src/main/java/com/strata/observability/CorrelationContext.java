package com.strata.observability;

/**
 * Per-request logging context.
 *
 * <p>Only values that are safe to print on every log line belong here. Identity claims do not.
 *
 * @param correlationId id echoed to the client in {@code X-Correlation-ID}
 * @param identityId authenticated caller, null until authentication has run
 */
public record CorrelationContext(String correlationId, String identityId) {

    /** MDC key for the correlation id. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for the caller's identity id. */
    public static final String MDC_IDENTITY_ID = "userId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Returns a copy carrying the given identity id. */
    public CorrelationContext withIdentity(String identityId) {
        return new CorrelationContext(correlationId, identityId);
    }
}
