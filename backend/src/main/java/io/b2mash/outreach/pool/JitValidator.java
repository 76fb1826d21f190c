package io.b2mash.outreach.pool;

import io.b2mash.outreach.tenant.TenantContext;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Last-mile gate run immediately before every send. Read-only and idempotent: it may be called on
 * each dispatch attempt without changing any state. Checks run in the order of {@link
 * JitRejection} and the first failure wins.
 */
@Component
public class JitValidator {

  private final PoolLeadRepository leadRepository;
  private final LeadAssignmentRepository assignmentRepository;
  private final SuppressionEntryRepository suppressionRepository;
  private final PoolProperties poolProperties;

  public JitValidator(
      PoolLeadRepository leadRepository,
      LeadAssignmentRepository assignmentRepository,
      SuppressionEntryRepository suppressionRepository,
      PoolProperties poolProperties) {
    this.leadRepository = leadRepository;
    this.assignmentRepository = assignmentRepository;
    this.suppressionRepository = suppressionRepository;
    this.poolProperties = poolProperties;
  }

  @Transactional(readOnly = true)
  public JitResult validate(TenantContext context, UUID leadId, Channel channel, Instant now) {
    return leadRepository
        .findById(leadId)
        .map(lead -> check(context, lead, channel, now))
        .orElse(JitResult.reject(JitRejection.LEAD_NOT_FOUND));
  }

  @Transactional(readOnly = true)
  public JitResult validateByEmail(
      TenantContext context, String email, Channel channel, Instant now) {
    if (email == null) {
      return JitResult.reject(JitRejection.LEAD_NOT_FOUND);
    }
    return leadRepository
        .findByEmail(email.trim().toLowerCase(Locale.ROOT))
        .map(lead -> check(context, lead, channel, now))
        .orElse(JitResult.reject(JitRejection.LEAD_NOT_FOUND));
  }

  /** Validates several leads at once; the result preserves the order of {@code leadIds}. */
  @Transactional(readOnly = true)
  public Map<UUID, JitResult> validateBatch(
      TenantContext context, List<UUID> leadIds, Channel channel, Instant now) {
    var results = new LinkedHashMap<UUID, JitResult>();
    for (UUID leadId : leadIds) {
      results.put(leadId, validate(context, leadId, channel, now));
    }
    return results;
  }

  private JitResult check(TenantContext context, PoolLead lead, Channel channel, Instant now) {
    if (lead.isBounced()) {
      return JitResult.reject(JitRejection.BOUNCED_GLOBALLY);
    }
    if (lead.isUnsubscribed()) {
      return JitResult.reject(JitRejection.UNSUBSCRIBED_GLOBALLY);
    }
    if (lead.getPoolStatus().isPermanentlyIneligible()) {
      return JitResult.reject(JitRejection.POOL_STATUS_INVALID);
    }
    if (channel == Channel.EMAIL) {
      if (lead.getEmail() == null || lead.getEmailVerification() == EmailVerification.INVALID) {
        return JitResult.reject(JitRejection.INVALID_EMAIL);
      }
      if (lead.getEmailVerification() == EmailVerification.GUESSED
          || lead.getEmailVerification() == EmailVerification.UNKNOWN) {
        return JitResult.reject(JitRejection.UNVERIFIED_EMAIL);
      }
    }
    if (isSuppressed(context, lead)) {
      return JitResult.reject(JitRejection.SUPPRESSED);
    }

    var assignment =
        assignmentRepository.findByTenantIdAndLeadIdAndStatus(
            context.tenantId(), lead.getId(), AssignmentStatus.ACTIVE);
    if (assignment.isEmpty()) {
      return JitResult.reject(JitRejection.NOT_ASSIGNED);
    }
    var active = assignment.get();
    if (active.getTotalTouches() >= active.getMaxTouches()) {
      return JitResult.reject(JitRejection.MAX_TOUCHES_REACHED);
    }
    if (active.hasNegativeReply()) {
      return JitResult.reject(JitRejection.NEGATIVE_REPLY);
    }
    if (active.getCoolingUntil() != null && now.isBefore(active.getCoolingUntil())) {
      return JitResult.reject(JitRejection.COOLING_PERIOD);
    }
    if (active.getLastContactedAt() != null
        && now.isBefore(active.getLastContactedAt().plus(poolProperties.minTouchGap()))) {
      return JitResult.reject(JitRejection.TOO_RECENT);
    }
    return JitResult.ok(active.getId());
  }

  private boolean isSuppressed(TenantContext context, PoolLead lead) {
    if (lead.getEmail() == null) {
      return false;
    }
    return !suppressionRepository
        .findMatching(
            context.tenantId(),
            SuppressionKind.EMAIL,
            lead.getEmail(),
            SuppressionKind.DOMAIN,
            lead.emailDomain())
        .isEmpty();
  }
}
