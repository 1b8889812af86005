package com.parish.observability;

/**
 * Immutable correlation context that flows through one request.
 * <p>
 * The web filter establishes it with the correlation and request identifiers as soon as
 * a request arrives. Once the caller's session has been resolved, the context is replaced
 * by a copy carrying the tenant, the user and the kind of session, so that every log line
 * written while serving the request is tagged with the tenant it concerns.
 *
 * @param correlationId unique ID for the business flow, propagated from the caller when present
 * @param requestId     unique ID for this specific request
 * @param tenantId      tenant the request acts on (null before resolution and for platform admins)
 * @param userId        resolved user or subject performing the action (null before resolution)
 * @param sessionKind   kind of session that was resolved (null before resolution)
 */
public record CorrelationContext(
        String correlationId,
        String requestId,
        String tenantId,
        String userId,
        String sessionKind
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for tenant ID. */
    public static final String MDC_TENANT_ID = "tenantId";

    /** MDC key for user ID. */
    public static final String MDC_USER_ID = "userId";

    /** MDC key for the resolved session kind. */
    public static final String MDC_SESSION_KIND = "sessionKind";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates a context for a request whose caller is not known yet.
     *
     * @param correlationId correlation identifier (required)
     * @param requestId     request identifier
     * @return an anonymous correlation context
     */
    public static CorrelationContext anonymous(String correlationId, String requestId) {
        return new CorrelationContext(correlationId, requestId, null, null, null);
    }

    /**
     * Returns a copy enriched with the resolved principal.
     *
     * @param tenantId    tenant the caller acts on, may be null
     * @param userId      user or subject identifier
     * @param sessionKind session kind name
     * @return the enriched context
     */
    public CorrelationContext withPrincipal(String tenantId, String userId, String sessionKind) {
        return new CorrelationContext(correlationId, requestId, tenantId, userId, sessionKind);
    }
}
