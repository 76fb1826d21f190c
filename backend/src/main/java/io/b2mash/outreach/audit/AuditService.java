package io.b2mash.outreach.audit;

import java.util.List;
import java.util.UUID;

/** Records and queries audit events. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction. If the enclosing transaction rolls
   * back, the audit event is also rolled back.
   */
  void log(AuditEventRecord record);

  /** Events recorded for a tenant, newest first. */
  List<AuditEvent> findForTenant(UUID tenantId);

  /** Events recorded against one entity, newest first. */
  List<AuditEvent> findForEntity(UUID entityId);
}
