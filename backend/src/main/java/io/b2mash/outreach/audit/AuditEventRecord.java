package io.b2mash.outreach.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder}.
 *
 * @param eventType free-form event type following the {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g., "lead_assignment", "resource")
 * @param entityId ID of the affected entity
 * @param tenantId owning tenant; null for platform-wide events such as resource retirement
 * @param actorType SERVICE for internal API callers, SYSTEM for scheduled jobs
 * @param source API inside an HTTP request, SCHEDULED for jobs and the queue worker
 * @param requestId MDC request id; null outside an HTTP request
 * @param details key field changes as JSONB; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    UUID tenantId,
    String actorType,
    String source,
    String requestId,
    Map<String, Object> details) {}
