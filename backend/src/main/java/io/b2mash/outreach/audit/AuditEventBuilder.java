package io.b2mash.outreach.audit;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builder that constructs an {@link AuditEventRecord}. Auto-populates actor type, source and the
 * request id from the current request when one is bound.
 *
 * <p>Required fields: {@code eventType}, {@code entityType}, {@code entityId}.
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("lead.assigned")
 *     .entityType("lead_assignment")
 *     .entityId(assignment.getId())
 *     .tenantId(context.tenantId())
 *     .details(Map.of("lead_id", lead.getId().toString()))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private String eventType;
  private String entityType;
  private UUID entityId;
  private UUID tenantId;
  private String actorType;
  private String source;
  private Map<String, Object> details;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder tenantId(UUID tenantId) {
    this.tenantId = tenantId;
    return this;
  }

  public AuditEventBuilder actorType(String actorType) {
    this.actorType = actorType;
    return this;
  }

  public AuditEventBuilder source(String source) {
    this.source = source;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  /**
   * Builds the record. Where not set explicitly, {@code actorType} is "SERVICE" inside an HTTP
   * request and "SYSTEM" otherwise, and {@code source} is "API" or "SCHEDULED" respectively.
   */
  public AuditEventRecord build() {
    if (eventType == null || entityType == null || entityId == null) {
      throw new IllegalStateException("eventType, entityType and entityId are required");
    }
    HttpServletRequest request = resolveHttpRequest();
    String resolvedActorType =
        actorType != null ? actorType : request != null ? "SERVICE" : "SYSTEM";
    String resolvedSource = source != null ? source : request != null ? "API" : "SCHEDULED";
    String requestId = request != null ? MDC.get("requestId") : null;

    return new AuditEventRecord(
        eventType,
        entityType,
        entityId,
        tenantId,
        resolvedActorType,
        resolvedSource,
        requestId,
        details);
  }

  private static HttpServletRequest resolveHttpRequest() {
    var attrs = RequestContextHolder.getRequestAttributes();
    if (attrs instanceof ServletRequestAttributes servletAttrs) {
      return servletAttrs.getRequest();
    }
    return null;
  }
}
