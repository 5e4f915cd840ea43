package com.civicintake.observability;

/**
 * Immutable per-request correlation data, mirrored into the SLF4J MDC by
 * {@link CorrelationContextHolder}.
 * <p>
 * A context is established when a request enters the service, before authentication has
 * happened, so {@code userId} and {@code role} start out null and are filled in with
 * {@link #withActor(String, String)} once a credential has been verified.
 *
 * @param correlationId identifier shared by every log line and audit event of one business flow
 * @param requestId     identifier of this single HTTP exchange
 * @param userId        authenticated principal id, or null while anonymous
 * @param role          authenticated principal role, or null while anonymous
 */
public record CorrelationContext(
        String correlationId,
        String requestId,
        String userId,
        String role
) {

    /** MDC key for the correlation id. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for the request id. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for the authenticated user id. */
    public static final String MDC_USER_ID = "userId";

    /** MDC key for the authenticated user role. */
    public static final String MDC_ROLE = "role";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates an anonymous context for a request that has not been authenticated yet.
     */
    public static CorrelationContext anonymous(String correlationId, String requestId) {
        return new CorrelationContext(correlationId, requestId, null, null);
    }

    /**
     * Returns a copy of this context bound to the given actor.
     */
    public CorrelationContext withActor(String userId, String role) {
        return new CorrelationContext(correlationId, requestId, userId, role);
    }

    /**
     * Whether an authenticated actor has been attached to this context.
     */
    public boolean hasActor() {
        return userId != null;
    }
}
