package io.b2mash.outreach.pool;

import io.b2mash.outreach.scoring.LeadTier;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Locale;
import java.util.UUID;

/**
 * A prospect record owned platform-wide. Ownership by a tenant is expressed through an active
 * {@link LeadAssignment}; the denormalized {@code tenantId} and {@code currentAssignmentId} mirror
 * it for fast lookups and are only changed by the transition methods below.
 */
@Entity
@Table(name = "pool_leads")
public class PoolLead {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "external_id", length = 100)
  private String externalId;

  @Column(name = "email", length = 320)
  private String email;

  @Enumerated(EnumType.STRING)
  @Column(name = "email_verification", nullable = false, length = 20)
  private EmailVerification emailVerification;

  @Column(name = "first_name", length = 100)
  private String firstName;

  @Column(name = "last_name", length = 100)
  private String lastName;

  @Column(name = "title", length = 255)
  private String title;

  @Column(name = "seniority", length = 50)
  private String seniority;

  @Column(name = "phone", length = 50)
  private String phone;

  @Column(name = "linkedin_url", length = 500)
  private String linkedinUrl;

  @Column(name = "company_name", length = 255)
  private String companyName;

  @Column(name = "company_domain", length = 255)
  private String companyDomain;

  @Column(name = "industry", length = 100)
  private String industry;

  @Column(name = "employee_count")
  private Integer employeeCount;

  @Column(name = "country", length = 100)
  private String country;

  @Column(name = "is_hiring", nullable = false)
  private boolean hiring;

  @Column(name = "latest_funding_date")
  private LocalDate latestFundingDate;

  @Enumerated(EnumType.STRING)
  @Column(name = "pool_status", nullable = false, length = 20)
  private PoolStatus poolStatus;

  @Column(name = "is_bounced", nullable = false)
  private boolean bounced;

  @Column(name = "bounced_at")
  private Instant bouncedAt;

  @Column(name = "bounce_reason", length = 255)
  private String bounceReason;

  @Column(name = "is_unsubscribed", nullable = false)
  private boolean unsubscribed;

  @Column(name = "unsubscribed_at")
  private Instant unsubscribedAt;

  @Column(name = "tenant_id")
  private UUID tenantId;

  @Column(name = "campaign_id")
  private UUID campaignId;

  @Column(name = "current_assignment_id")
  private UUID currentAssignmentId;

  @Column(name = "als_score")
  private Integer alsScore;

  @Enumerated(EnumType.STRING)
  @Column(name = "als_tier", length = 10)
  private LeadTier alsTier;

  @Column(name = "scored_at")
  private Instant scoredAt;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected PoolLead() {}

  public PoolLead(String externalId, String email, EmailVerification emailVerification) {
    this.externalId = externalId;
    this.email = email != null ? email.trim().toLowerCase(Locale.ROOT) : null;
    this.emailVerification =
        emailVerification != null ? emailVerification : EmailVerification.UNKNOWN;
    this.poolStatus =
        this.emailVerification == EmailVerification.INVALID
            ? PoolStatus.INVALID
            : PoolStatus.AVAILABLE;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void updateContact(
      String firstName,
      String lastName,
      String title,
      String seniority,
      String phone,
      String linkedinUrl) {
    this.firstName = firstName;
    this.lastName = lastName;
    this.title = title;
    this.seniority = seniority;
    this.phone = phone;
    this.linkedinUrl = linkedinUrl;
    this.updatedAt = Instant.now();
  }

  public void updateFirmographics(
      String companyName,
      String companyDomain,
      String industry,
      Integer employeeCount,
      String country,
      boolean hiring,
      LocalDate latestFundingDate) {
    this.companyName = companyName;
    this.companyDomain = companyDomain != null ? companyDomain.toLowerCase(Locale.ROOT) : null;
    this.industry = industry;
    this.employeeCount = employeeCount;
    this.country = country;
    this.hiring = hiring;
    this.latestFundingDate = latestFundingDate;
    this.updatedAt = Instant.now();
  }

  /** True when the lead may be handed to a tenant, ignoring assignment rows. */
  public boolean isAssignable() {
    return poolStatus == PoolStatus.AVAILABLE && !bounced && !unsubscribed;
  }

  /** Flips an available lead to assigned. Caller must hold the row lock. */
  public void assignTo(UUID tenantId, UUID campaignId, UUID assignmentId) {
    if (!isAssignable()) {
      throw new IllegalStateException("Lead " + id + " is not assignable (" + poolStatus + ")");
    }
    this.poolStatus = PoolStatus.ASSIGNED;
    this.tenantId = tenantId;
    this.campaignId = campaignId;
    this.currentAssignmentId = assignmentId;
    this.updatedAt = Instant.now();
  }

  /**
   * Returns the lead to the pool after its assignment ends. A globally bounced or unsubscribed
   * lead becomes permanently ineligible instead of available.
   */
  public void returnToPool() {
    if (poolStatus != PoolStatus.ASSIGNED) {
      throw new IllegalStateException("Lead " + id + " is not assigned (" + poolStatus + ")");
    }
    this.tenantId = null;
    this.campaignId = null;
    this.currentAssignmentId = null;
    if (bounced) {
      this.poolStatus = PoolStatus.BOUNCED;
    } else if (unsubscribed) {
      this.poolStatus = PoolStatus.UNSUBSCRIBED;
    } else {
      this.poolStatus = PoolStatus.AVAILABLE;
    }
    this.updatedAt = Instant.now();
  }

  /** Conversion is terminal; the lead stays with its tenant. */
  public void markConverted() {
    if (poolStatus != PoolStatus.ASSIGNED) {
      throw new IllegalStateException("Only an assigned lead can convert (" + poolStatus + ")");
    }
    this.poolStatus = PoolStatus.CONVERTED;
    this.currentAssignmentId = null;
    this.updatedAt = Instant.now();
  }

  /** Sets the global bounce flag. An unassigned lead leaves the pool immediately. */
  public void flagBounced(String reason) {
    this.bounced = true;
    this.bouncedAt = Instant.now();
    this.bounceReason = reason;
    if (poolStatus == PoolStatus.AVAILABLE) {
      this.poolStatus = PoolStatus.BOUNCED;
    }
    this.updatedAt = Instant.now();
  }

  /** Sets the global unsubscribe flag. An unassigned lead leaves the pool immediately. */
  public void flagUnsubscribed() {
    this.unsubscribed = true;
    this.unsubscribedAt = Instant.now();
    if (poolStatus == PoolStatus.AVAILABLE) {
      this.poolStatus = PoolStatus.UNSUBSCRIBED;
    }
    this.updatedAt = Instant.now();
  }

  public void applyScore(int score, LeadTier tier, Instant scoredAt) {
    this.alsScore = score;
    this.alsTier = tier;
    this.scoredAt = scoredAt;
    this.updatedAt = Instant.now();
  }

  public String emailDomain() {
    if (email == null || !email.contains("@")) {
      return null;
    }
    return email.substring(email.indexOf('@') + 1);
  }

  public UUID getId() {
    return id;
  }

  public String getExternalId() {
    return externalId;
  }

  public String getEmail() {
    return email;
  }

  public EmailVerification getEmailVerification() {
    return emailVerification;
  }

  public String getFirstName() {
    return firstName;
  }

  public String getLastName() {
    return lastName;
  }

  public String getTitle() {
    return title;
  }

  public String getSeniority() {
    return seniority;
  }

  public String getPhone() {
    return phone;
  }

  public String getLinkedinUrl() {
    return linkedinUrl;
  }

  public String getCompanyName() {
    return companyName;
  }

  public String getCompanyDomain() {
    return companyDomain;
  }

  public String getIndustry() {
    return industry;
  }

  public Integer getEmployeeCount() {
    return employeeCount;
  }

  public String getCountry() {
    return country;
  }

  public boolean isHiring() {
    return hiring;
  }

  public LocalDate getLatestFundingDate() {
    return latestFundingDate;
  }

  public PoolStatus getPoolStatus() {
    return poolStatus;
  }

  public boolean isBounced() {
    return bounced;
  }

  public Instant getBouncedAt() {
    return bouncedAt;
  }

  public String getBounceReason() {
    return bounceReason;
  }

  public boolean isUnsubscribed() {
    return unsubscribed;
  }

  public Instant getUnsubscribedAt() {
    return unsubscribedAt;
  }

  public UUID getTenantId() {
    return tenantId;
  }

  public UUID getCampaignId() {
    return campaignId;
  }

  public UUID getCurrentAssignmentId() {
    return currentAssignmentId;
  }

  public Integer getAlsScore() {
    return alsScore;
  }

  public LeadTier getAlsTier() {
    return alsTier;
  }

  public Instant getScoredAt() {
    return scoredAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
