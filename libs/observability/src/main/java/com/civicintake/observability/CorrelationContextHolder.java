package com.civicintake.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * Thread-local holder for the current {@link CorrelationContext}, kept in sync with SLF4J MDC.
 * <p>
 * Request threads are pooled by the servlet container, so whoever calls {@link #set} is
 * responsible for calling {@link #clear()} when the request completes. Work handed to another
 * thread must carry the context explicitly through {@link #callWithContext}.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the context for the current thread and writes its fields to the MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        putOrRemove(CorrelationContext.MDC_CORRELATION_ID, context.correlationId());
        putOrRemove(CorrelationContext.MDC_REQUEST_ID, context.requestId());
        putOrRemove(CorrelationContext.MDC_USER_ID, context.userId());
        putOrRemove(CorrelationContext.MDC_ROLE, context.role());
    }

    /**
     * Returns the current thread's context, if any.
     */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Returns the current correlation id, if a context is set.
     */
    public static Optional<String> currentCorrelationId() {
        return get().map(CorrelationContext::correlationId);
    }

    /**
     * Attaches an authenticated actor to the current context. Does nothing when no context is
     * set, which is the case for code running outside a request.
     */
    public static void bindActor(String userId, String role) {
        CorrelationContext current = CONTEXT.get();
        if (current != null) {
            set(current.withActor(userId, role));
        }
    }

    /**
     * Removes the context and every MDC key it owns.
     */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
        MDC.remove(CorrelationContext.MDC_USER_ID);
        MDC.remove(CorrelationContext.MDC_ROLE);
    }

    /**
     * Runs {@code work} with {@code context} installed and restores whatever was installed
     * before, including nothing.
     */
    public static <T> T callWithContext(CorrelationContext context, Supplier<T> work) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            return work.get();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void putOrRemove(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
