package com.bluequee.observability;

/**
 * Immutable correlation context for one request.
 *
 * <p>Established at the edge (HTTP filter) and enriched once the caller's identity is known. The
 * values are mirrored into SLF4J MDC by {@link CorrelationContextHolder} so every log line carries
 * them.
 *
 * @param correlationId unique ID for the business flow, never blank
 * @param organizationId organization the request acts within (nullable)
 * @param userId authenticated user (nullable before identity resolution)
 * @param requestId unique ID for this specific request (nullable)
 */
public record CorrelationContext(
        String correlationId, Long organizationId, Long userId, String requestId) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_ORGANIZATION_ID = "organizationId";
    public static final String MDC_USER_ID = "userId";
    public static final String MDC_REQUEST_ID = "requestId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Context carrying only a correlation id. */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null, null);
    }

    /** Copy of this context with the caller's identity attached. */
    public CorrelationContext withIdentity(Long organizationId, Long userId) {
        return new CorrelationContext(correlationId, organizationId, userId, requestId);
    }
}
