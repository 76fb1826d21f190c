package io.b2mash.outreach.pool;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Exclusive ownership link between a {@link PoolLead} and a tenant. At most one row per lead is
 * {@link AssignmentStatus#ACTIVE}; a partial unique index on {@code lead_id} backs this up.
 */
@Entity
@Table(name = "lead_assignments")
public class LeadAssignment {

  public static final int DEFAULT_MAX_TOUCHES = 10;

  /** Reply intents after which no further outreach is allowed. */
  public static final Set<String> NEGATIVE_INTENTS =
      Set.of("not_interested", "unsubscribe", "do_not_contact");

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "lead_id", nullable = false, updatable = false)
  private UUID leadId;

  @Column(name = "tenant_id", nullable = false, updatable = false)
  private UUID tenantId;

  @Column(name = "campaign_id")
  private UUID campaignId;

  @Column(name = "assigned_at", nullable = false, updatable = false)
  private Instant assignedAt;

  @Column(name = "assigned_by", nullable = false, length = 100)
  private String assignedBy;

  @Column(name = "assignment_reason", length = 255)
  private String assignmentReason;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private AssignmentStatus status;

  @Column(name = "released_at")
  private Instant releasedAt;

  @Column(name = "release_reason", length = 255)
  private String releaseReason;

  @Column(name = "converted_at")
  private Instant convertedAt;

  @Column(name = "conversion_type", length = 50)
  private String conversionType;

  @Column(name = "total_touches", nullable = false)
  private int totalTouches;

  @Column(name = "first_contacted_at")
  private Instant firstContactedAt;

  @Column(name = "last_contacted_at")
  private Instant lastContactedAt;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "channels_used", columnDefinition = "jsonb")
  private List<String> channelsUsed;

  @Column(name = "has_replied", nullable = false)
  private boolean replied;

  @Column(name = "replied_at")
  private Instant repliedAt;

  @Column(name = "reply_intent", length = 50)
  private String replyIntent;

  @Column(name = "max_touches", nullable = false)
  private int maxTouches;

  @Column(name = "cooling_until")
  private Instant coolingUntil;

  protected LeadAssignment() {}

  public LeadAssignment(
      UUID leadId, UUID tenantId, UUID campaignId, String assignedBy, String assignmentReason) {
    this.leadId = leadId;
    this.tenantId = tenantId;
    this.campaignId = campaignId;
    this.assignedBy = assignedBy != null ? assignedBy : "allocator";
    this.assignmentReason = assignmentReason;
    this.status = AssignmentStatus.ACTIVE;
    this.maxTouches = DEFAULT_MAX_TOUCHES;
    this.channelsUsed = new ArrayList<>();
    this.assignedAt = Instant.now();
  }

  public boolean isActive() {
    return status == AssignmentStatus.ACTIVE;
  }

  public void release(String reason) {
    requireActive();
    this.status = AssignmentStatus.RELEASED;
    this.releasedAt = Instant.now();
    this.releaseReason = reason;
  }

  public void convert(String conversionType) {
    requireActive();
    this.status = AssignmentStatus.CONVERTED;
    this.convertedAt = Instant.now();
    this.conversionType = conversionType;
  }

  /** Records one outbound touch on the given channel. */
  public void recordTouch(Channel channel, Instant at) {
    requireActive();
    this.totalTouches++;
    if (firstContactedAt == null) {
      this.firstContactedAt = at;
    }
    this.lastContactedAt = at;
    if (channelsUsed == null) {
      this.channelsUsed = new ArrayList<>();
    }
    if (!channelsUsed.contains(channel.name())) {
      this.channelsUsed = new ArrayList<>(channelsUsed);
      this.channelsUsed.add(channel.name());
    }
  }

  /** Pauses outreach to this lead until the given instant. */
  public void coolOff(Instant until) {
    requireActive();
    this.coolingUntil = until;
  }

  public void recordReply(String intent, Instant at) {
    this.replied = true;
    this.repliedAt = at;
    this.replyIntent = intent;
  }

  public boolean hasNegativeReply() {
    return replied && replyIntent != null && NEGATIVE_INTENTS.contains(replyIntent);
  }

  public void changeMaxTouches(int maxTouches) {
    if (maxTouches < 1) {
      throw new IllegalArgumentException("maxTouches must be positive");
    }
    this.maxTouches = maxTouches;
  }

  private void requireActive() {
    if (status != AssignmentStatus.ACTIVE) {
      throw new IllegalStateException("Assignment " + id + " is " + status);
    }
  }

  public UUID getId() {
    return id;
  }

  public UUID getLeadId() {
    return leadId;
  }

  public UUID getTenantId() {
    return tenantId;
  }

  public UUID getCampaignId() {
    return campaignId;
  }

  public Instant getAssignedAt() {
    return assignedAt;
  }

  public String getAssignedBy() {
    return assignedBy;
  }

  public String getAssignmentReason() {
    return assignmentReason;
  }

  public AssignmentStatus getStatus() {
    return status;
  }

  public Instant getReleasedAt() {
    return releasedAt;
  }

  public String getReleaseReason() {
    return releaseReason;
  }

  public Instant getConvertedAt() {
    return convertedAt;
  }

  public String getConversionType() {
    return conversionType;
  }

  public int getTotalTouches() {
    return totalTouches;
  }

  public Instant getFirstContactedAt() {
    return firstContactedAt;
  }

  public Instant getLastContactedAt() {
    return lastContactedAt;
  }

  public List<String> getChannelsUsed() {
    return channelsUsed != null ? channelsUsed : List.of();
  }

  public boolean hasReplied() {
    return replied;
  }

  public Instant getRepliedAt() {
    return repliedAt;
  }

  public String getReplyIntent() {
    return replyIntent;
  }

  public int getMaxTouches() {
    return maxTouches;
  }

  public Instant getCoolingUntil() {
    return coolingUntil;
  }
}
