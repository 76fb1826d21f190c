package io.b2mash.outreach.scoring;

import io.b2mash.outreach.exception.ForbiddenException;
import io.b2mash.outreach.exception.ResourceNotFoundException;
import io.b2mash.outreach.pool.PoolLead;
import io.b2mash.outreach.pool.PoolLeadRepository;
import io.b2mash.outreach.tenant.TenantContext;
import io.b2mash.outreach.tenant.TenantRepository;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class LeadScoringService {

  private static final Logger log = LoggerFactory.getLogger(LeadScoringService.class);

  private final LeadScoringEngine engine;
  private final PoolLeadRepository leadRepository;
  private final LeadScoreRecordRepository scoreRecordRepository;
  private final TenantRepository tenantRepository;

  public LeadScoringService(
      LeadScoringEngine engine,
      PoolLeadRepository leadRepository,
      LeadScoreRecordRepository scoreRecordRepository,
      TenantRepository tenantRepository) {
    this.engine = engine;
    this.leadRepository = leadRepository;
    this.scoreRecordRepository = scoreRecordRepository;
    this.tenantRepository = tenantRepository;
  }

  /** Batch scoring outcome: how many leads were scored and how they fell across tiers. */
  public record BatchScoreResult(int scored, Map<LeadTier, Integer> distribution) {}

  /**
   * Scores a lead with the tenant's scoring profile and persists the total, tier and component
   * breakdown.
   *
   * @throws ResourceNotFoundException if the lead does not exist
   * @throws ForbiddenException if the lead is owned by another tenant
   */
  @Transactional
  public LeadScore scoreLead(TenantContext context, UUID leadId) {
    var lead =
        leadRepository
            .findById(leadId)
            .orElseThrow(() -> new ResourceNotFoundException("Lead", leadId));
    if (lead.getTenantId() != null && !context.owns(lead.getTenantId())) {
      throw new ForbiddenException(
          "Lead not owned", "Lead " + leadId + " belongs to another tenant");
    }
    return scoreAndPersist(
        lead, profileFor(context), context.tenantId(), LocalDate.now(context.zone()));
  }

  /** Scores the given leads with one tenant profile. Leads owned by other tenants are skipped. */
  @Transactional
  public BatchScoreResult scoreBatch(TenantContext context, List<UUID> leadIds) {
    var profile = profileFor(context);
    var today = LocalDate.now(context.zone());
    var distribution = emptyDistribution();
    int scored = 0;
    for (var lead : leadRepository.findAllById(leadIds)) {
      if (lead.getTenantId() != null && !context.owns(lead.getTenantId())) {
        log.debug("Skipping lead {} owned by another tenant", lead.getId());
        continue;
      }
      var score = scoreAndPersist(lead, profile, context.tenantId(), today);
      distribution.merge(score.tier(), 1, Integer::sum);
      scored++;
    }
    log.info("Scored {} leads for tenant {}: {}", scored, context.tenantId(), distribution);
    return new BatchScoreResult(scored, distribution);
  }

  /** Scores every lead that has never been scored, using the neutral platform profile. */
  @Transactional
  public BatchScoreResult scoreUnscoredPool() {
    var today = LocalDate.now();
    var distribution = emptyDistribution();
    var unscored = leadRepository.findByAlsScoreIsNull();
    for (var lead : unscored) {
      var score = scoreAndPersist(lead, ScoringProfile.NEUTRAL, null, today);
      distribution.merge(score.tier(), 1, Integer::sum);
    }
    return new BatchScoreResult(unscored.size(), distribution);
  }

  @Transactional(readOnly = true)
  public LeadScoreRecord getBreakdown(UUID leadId) {
    return scoreRecordRepository
        .findByLeadId(leadId)
        .orElseThrow(() -> new ResourceNotFoundException("Lead score", leadId));
  }

  private LeadScore scoreAndPersist(
      PoolLead lead, ScoringProfile profile, UUID tenantId, LocalDate today) {
    var score = engine.score(lead, profile, today);
    var now = Instant.now();
    var record =
        scoreRecordRepository
            .findByLeadId(lead.getId())
            .orElseGet(() -> new LeadScoreRecord(lead.getId()));
    record.apply(score, tenantId, now);
    scoreRecordRepository.save(record);
    lead.applyScore(score.total(), score.tier(), now);
    leadRepository.save(lead);
    return score;
  }

  private ScoringProfile profileFor(TenantContext context) {
    return tenantRepository
        .findById(context.tenantId())
        .map(ScoringProfile::of)
        .orElse(ScoringProfile.NEUTRAL);
  }

  private static Map<LeadTier, Integer> emptyDistribution() {
    var distribution = new EnumMap<LeadTier, Integer>(LeadTier.class);
    for (LeadTier tier : LeadTier.values()) {
      distribution.put(tier, 0);
    }
    return distribution;
  }
}
