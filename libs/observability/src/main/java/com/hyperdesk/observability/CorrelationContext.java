package com.hyperdesk.observability;

/**
 * Identifiers that tie log lines, metrics and spans to one unit of work.
 * <p>
 * A context is established at the edge of every command or event delivery and copied into
 * SLF4J MDC by {@link CorrelationContextHolder}, so log output from handlers, stores and
 * adapters carries the same keys.
 *
 * @param correlationId business flow id; a VM request keeps one correlation id from creation
 *                      through provisioning
 * @param tenantId      owning tenant (nullable for platform-level work)
 * @param userId        acting user or system principal (nullable)
 * @param requestId     VM request the work concerns (nullable before one exists)
 */
public record CorrelationContext(
        String correlationId,
        String tenantId,
        String userId,
        String requestId
) {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_TENANT_ID = "tenantId";
    public static final String MDC_USER_ID = "userId";
    public static final String MDC_REQUEST_ID = "requestId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Same context, scoped to a specific VM request. */
    public CorrelationContext withRequestId(String newRequestId) {
        return new CorrelationContext(correlationId, tenantId, userId, newRequestId);
    }
}
