package com.strata.observability;

import java.util.Optional;
import org.slf4j.MDC;

/**
 * Thread-local holder for {@link CorrelationContext}, mirrored into the SLF4J MDC.
 *
 * <p>Used for log decoration only. Authorization never reads from here; the identity used for
 * access decisions is passed explicitly.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the context for the current thread and populates the MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        put(CorrelationContext.MDC_CORRELATION_ID, context.correlationId());
        put(CorrelationContext.MDC_IDENTITY_ID, context.identityId());
    }

    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Attaches the authenticated identity to the current context. No-op when no context is set.
     */
    public static void attachIdentity(String identityId) {
        get().ifPresent(ctx -> set(ctx.withIdentity(identityId)));
    }

    /** Clears the context and its MDC keys. */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_IDENTITY_ID);
    }

    private static void put(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
