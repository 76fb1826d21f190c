package io.b2mash.outreach.queue;

import io.b2mash.outreach.pool.Channel;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * One scheduled outbound action for a lead on a resource account. Status changes go through {@link
 * ActionStateMachine}; the package-private mutators below perform no checks of their own.
 */
@Entity
@Table(name = "action_queue_items")
public class ActionQueueItem {

  public static final int DEFAULT_MAX_ATTEMPTS = 3;

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "tenant_id", nullable = false, updatable = false)
  private UUID tenantId;

  @Column(name = "resource_id", nullable = false, updatable = false)
  private UUID resourceId;

  @Column(name = "lead_id", nullable = false, updatable = false)
  private UUID leadId;

  @Column(name = "campaign_id", updatable = false)
  private UUID campaignId;

  @Enumerated(EnumType.STRING)
  @Column(name = "action_type", nullable = false, length = 30, updatable = false)
  private ActionType actionType;

  @Enumerated(EnumType.STRING)
  @Column(name = "channel", nullable = false, length = 20, updatable = false)
  private Channel channel;

  @Column(name = "payload_ref", length = 255, updatable = false)
  private String payloadRef;

  @Column(name = "scheduled_at", nullable = false)
  private Instant scheduledAt;

  @Column(name = "priority", nullable = false)
  private int priority;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ActionStatus status;

  @Column(name = "attempts", nullable = false)
  private int attempts;

  @Column(name = "max_attempts", nullable = false)
  private int maxAttempts;

  @Column(name = "last_error", length = 1000)
  private String lastError;

  @Column(name = "claimed_by", length = 100)
  private String claimedBy;

  @Column(name = "claimed_at")
  private Instant claimedAt;

  @Column(name = "processed_at")
  private Instant processedAt;

  @Column(name = "provider_reference", length = 255)
  private String providerReference;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected ActionQueueItem() {}

  public ActionQueueItem(
      UUID tenantId,
      UUID resourceId,
      UUID leadId,
      UUID campaignId,
      ActionType actionType,
      String payloadRef,
      Instant scheduledAt,
      int priority,
      int maxAttempts) {
    this.tenantId = tenantId;
    this.resourceId = resourceId;
    this.leadId = leadId;
    this.campaignId = campaignId;
    this.actionType = actionType;
    this.channel = actionType.channel();
    this.payloadRef = payloadRef;
    this.scheduledAt = scheduledAt;
    this.priority = priority;
    this.maxAttempts = maxAttempts > 0 ? maxAttempts : DEFAULT_MAX_ATTEMPTS;
    this.status = ActionStatus.PENDING;
    this.attempts = 0;
  }

  @PrePersist
  void onCreate() {
    this.createdAt = Instant.now();
    this.updatedAt = this.createdAt;
  }

  @PreUpdate
  void onUpdate() {
    this.updatedAt = Instant.now();
  }

  public boolean hasAttemptsLeft() {
    return attempts < maxAttempts;
  }

  public boolean isClaimedBy(String workerId) {
    return status == ActionStatus.PROCESSING && workerId != null && workerId.equals(claimedBy);
  }

  void claim(String workerId, Instant at) {
    this.status = ActionStatus.PROCESSING;
    this.attempts++;
    this.claimedBy = workerId;
    this.claimedAt = at;
  }

  void complete(ActionStatus terminal, String error, Instant at) {
    this.status = terminal;
    this.lastError = truncate(error);
    this.processedAt = at;
    clearClaim();
  }

  void markSent(String providerReference, Instant at) {
    this.providerReference = providerReference;
    complete(ActionStatus.SENT, null, at);
  }

  void reschedule(ActionStatus next, Instant at, String error, boolean refundAttempt) {
    this.status = next;
    this.scheduledAt = at;
    if (error != null) {
      this.lastError = truncate(error);
    }
    if (refundAttempt && attempts > 0) {
      this.attempts--;
    }
    clearClaim();
  }

  private void clearClaim() {
    this.claimedBy = null;
    this.claimedAt = null;
  }

  private static String truncate(String error) {
    if (error == null || error.length() <= 1000) {
      return error;
    }
    return error.substring(0, 1000);
  }

  public UUID getId() {
    return id;
  }

  public UUID getTenantId() {
    return tenantId;
  }

  public UUID getResourceId() {
    return resourceId;
  }

  public UUID getLeadId() {
    return leadId;
  }

  public UUID getCampaignId() {
    return campaignId;
  }

  public ActionType getActionType() {
    return actionType;
  }

  public Channel getChannel() {
    return channel;
  }

  public String getPayloadRef() {
    return payloadRef;
  }

  public Instant getScheduledAt() {
    return scheduledAt;
  }

  public int getPriority() {
    return priority;
  }

  public ActionStatus getStatus() {
    return status;
  }

  public int getAttempts() {
    return attempts;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public String getLastError() {
    return lastError;
  }

  public String getClaimedBy() {
    return claimedBy;
  }

  public Instant getClaimedAt() {
    return claimedAt;
  }

  public Instant getProcessedAt() {
    return processedAt;
  }

  public String getProviderReference() {
    return providerReference;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
