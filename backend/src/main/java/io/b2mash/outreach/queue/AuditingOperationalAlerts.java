package io.b2mash.outreach.queue;

import io.b2mash.outreach.audit.AuditEventBuilder;
import io.b2mash.outreach.audit.AuditService;
import java.util.HashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Logs terminal failures at error level and records them in the audit trail. */
@Component
public class AuditingOperationalAlerts implements OperationalAlerts {

  private static final Logger log = LoggerFactory.getLogger(AuditingOperationalAlerts.class);

  private final AuditService auditService;

  public AuditingOperationalAlerts(AuditService auditService) {
    this.auditService = auditService;
  }

  @Override
  public void actionFailed(ActionQueueItem item) {
    log.error(
        "Action {} ({}) for tenant {} failed after {} attempts: {}",
        item.getId(),
        item.getActionType(),
        item.getTenantId(),
        item.getAttempts(),
        item.getLastError());

    var details = new HashMap<String, Object>();
    details.put("action_type", item.getActionType().name());
    details.put("resource_id", item.getResourceId().toString());
    details.put("lead_id", item.getLeadId().toString());
    details.put("attempts", item.getAttempts());
    if (item.getLastError() != null) {
      details.put("last_error", item.getLastError());
    }
    auditService.log(
        AuditEventBuilder.builder()
            .eventType("action.failed")
            .entityType("action_queue_item")
            .entityId(item.getId())
            .tenantId(item.getTenantId())
            .details(details)
            .build());
  }
}
