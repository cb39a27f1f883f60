package com.mqol.observability;

/**
 * Immutable correlation context that travels with a single request.
 * <p>
 * The HTTP filter creates it with only a correlation and request id; the actor and the team are
 * filled in once the request has been authenticated and the team has been resolved through an
 * access decision. Every value that is set is mirrored into the SLF4J MDC by
 * {@link CorrelationContextHolder}.
 *
 * @param correlationId id for the business flow, propagated from the caller when present
 * @param requestId     id for this specific request (nullable)
 * @param actorId       authenticated actor performing the request (nullable until authenticated)
 * @param tenantId      canonical team id, only ever set from a resolved access decision (nullable)
 */
public record CorrelationContext(
        String correlationId,
        String requestId,
        String actorId,
        String tenantId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for the acting user. */
    public static final String MDC_ACTOR_ID = "actorId";

    /** MDC key for the resolved team. */
    public static final String MDC_TENANT_ID = "tenantId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Context carrying only a correlation id. */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null, null);
    }

    /** Copy with the authenticated actor set. */
    public CorrelationContext withActor(String actorId) {
        return new CorrelationContext(correlationId, requestId, actorId, tenantId);
    }

    /** Copy with the resolved team set. */
    public CorrelationContext withTenant(String tenantId) {
        return new CorrelationContext(correlationId, requestId, actorId, tenantId);
    }
}
