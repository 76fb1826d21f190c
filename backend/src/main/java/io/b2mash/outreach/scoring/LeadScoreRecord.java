package io.b2mash.outreach.scoring;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * Persisted component breakdown of a lead's current score, together with the weights that produced
 * it. One row per lead; rescoring overwrites it.
 */
@Entity
@Table(name = "lead_score_components")
public class LeadScoreRecord {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "lead_id", nullable = false, unique = true, updatable = false)
  private UUID leadId;

  @Column(name = "scored_for_tenant_id")
  private UUID scoredForTenantId;

  @Column(name = "data_quality", nullable = false)
  private int dataQuality;

  @Column(name = "authority", nullable = false)
  private int authority;

  @Column(name = "company_fit", nullable = false)
  private int companyFit;

  @Column(name = "timing", nullable = false)
  private int timing;

  @Column(name = "risk_deduction", nullable = false)
  private int riskDeduction;

  @Column(name = "weight_data_quality", nullable = false, precision = 5, scale = 4)
  private BigDecimal weightDataQuality;

  @Column(name = "weight_authority", nullable = false, precision = 5, scale = 4)
  private BigDecimal weightAuthority;

  @Column(name = "weight_company_fit", nullable = false, precision = 5, scale = 4)
  private BigDecimal weightCompanyFit;

  @Column(name = "weight_timing", nullable = false, precision = 5, scale = 4)
  private BigDecimal weightTiming;

  @Column(name = "weight_risk", nullable = false, precision = 5, scale = 4)
  private BigDecimal weightRisk;

  @Column(name = "total_score", nullable = false)
  private int totalScore;

  @Enumerated(EnumType.STRING)
  @Column(name = "tier", nullable = false, length = 10)
  private LeadTier tier;

  @Column(name = "scored_at", nullable = false)
  private Instant scoredAt;

  protected LeadScoreRecord() {}

  public LeadScoreRecord(UUID leadId) {
    this.leadId = leadId;
  }

  public void apply(LeadScore score, UUID tenantId, Instant scoredAt) {
    var c = score.components();
    var w = score.weights();
    this.scoredForTenantId = tenantId;
    this.dataQuality = c.dataQuality();
    this.authority = c.authority();
    this.companyFit = c.companyFit();
    this.timing = c.timing();
    this.riskDeduction = c.riskDeduction();
    this.weightDataQuality = decimal(w.dataQuality());
    this.weightAuthority = decimal(w.authority());
    this.weightCompanyFit = decimal(w.companyFit());
    this.weightTiming = decimal(w.timing());
    this.weightRisk = decimal(w.risk());
    this.totalScore = score.total();
    this.tier = score.tier();
    this.scoredAt = scoredAt;
  }

  public ScoreComponents components() {
    return new ScoreComponents(dataQuality, authority, companyFit, timing, riskDeduction);
  }

  public ScoreWeights weights() {
    return new ScoreWeights(
        weightDataQuality.doubleValue(),
        weightAuthority.doubleValue(),
        weightCompanyFit.doubleValue(),
        weightTiming.doubleValue(),
        weightRisk.doubleValue());
  }

  private static BigDecimal decimal(double value) {
    return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP);
  }

  public UUID getId() {
    return id;
  }

  public UUID getLeadId() {
    return leadId;
  }

  public UUID getScoredForTenantId() {
    return scoredForTenantId;
  }

  public int getTotalScore() {
    return totalScore;
  }

  public LeadTier getTier() {
    return tier;
  }

  public Instant getScoredAt() {
    return scoredAt;
  }
}
