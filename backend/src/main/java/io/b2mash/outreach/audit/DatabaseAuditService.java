package io.b2mash.outreach.audit;

import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Database-backed implementation of {@link AuditService}. {@code log()} participates in the
 * caller's transaction (no REQUIRES_NEW).
 */
@Service
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  private final AuditEventRepository auditEventRepository;

  public DatabaseAuditService(AuditEventRepository auditEventRepository) {
    this.auditEventRepository = auditEventRepository;
  }

  @Override
  @Transactional
  public void log(AuditEventRecord record) {
    auditEventRepository.save(new AuditEvent(record));
    log.debug(
        "Recorded audit event: type={}, entity={}/{}, tenant={}",
        record.eventType(),
        record.entityType(),
        record.entityId(),
        record.tenantId());
  }

  @Override
  @Transactional(readOnly = true)
  public List<AuditEvent> findForTenant(UUID tenantId) {
    return auditEventRepository.findByTenantIdOrderByOccurredAtDesc(tenantId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<AuditEvent> findForEntity(UUID entityId) {
    return auditEventRepository.findByEntityIdOrderByOccurredAtDesc(entityId);
  }
}
