package com.wayfarer.observability;

/**
 * Immutable correlation context that flows with a single CRM request.
 * <p>
 * Established by the web tier as soon as a request arrives and enriched with the
 * authenticated principal once the bearer token has been verified. Values are pushed
 * into SLF4J MDC so every log line written while the request is in flight (including
 * access-gate denials) can be tied back to the caller.
 *
 * @param correlationId unique ID for the request chain (propagated via {@code X-Correlation-ID})
 * @param userId        authenticated principal id (null until authentication succeeds)
 * @param role          authenticated principal role (null until authentication succeeds)
 * @param requestId     unique ID for this specific HTTP request
 */
public record CorrelationContext(
        String correlationId,
        String userId,
        String role,
        String requestId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for principal id. */
    public static final String MDC_USER_ID = "userId";

    /** MDC key for principal role. */
    public static final String MDC_ROLE = "role";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Creates an anonymous context carrying only the correlation and request ids. */
    public static CorrelationContext anonymous(String correlationId, String requestId) {
        return new CorrelationContext(correlationId, null, null, requestId);
    }

    /**
     * Returns a copy of this context bound to the given principal.
     *
     * @param userId principal id
     * @param role   principal role
     */
    public CorrelationContext withPrincipal(String userId, String role) {
        return new CorrelationContext(correlationId, userId, role, requestId);
    }

    /** Whether a principal has been attached to this context. */
    public boolean isAuthenticated() {
        return userId != null;
    }
}
