package io.b2mash.outreach.scoring;

import io.b2mash.outreach.tenant.TenantContextResolver;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ScoringController {

  private final LeadScoringService scoringService;
  private final TenantContextResolver tenantContextResolver;

  public ScoringController(
      LeadScoringService scoringService, TenantContextResolver tenantContextResolver) {
    this.scoringService = scoringService;
    this.tenantContextResolver = tenantContextResolver;
  }

  @PostMapping("/internal/tenants/{tenantId}/leads/{leadId}/score")
  public ResponseEntity<LeadScore> scoreLead(
      @PathVariable UUID tenantId, @PathVariable UUID leadId) {
    return ResponseEntity.ok(
        scoringService.scoreLead(tenantContextResolver.resolve(tenantId), leadId));
  }

  @PostMapping("/internal/tenants/{tenantId}/leads/score-batch")
  public ResponseEntity<LeadScoringService.BatchScoreResult> scoreBatch(
      @PathVariable UUID tenantId, @Valid @RequestBody ScoreBatchRequest request) {
    return ResponseEntity.ok(
        scoringService.scoreBatch(tenantContextResolver.resolve(tenantId), request.leadIds()));
  }

  @PostMapping("/internal/leads/score-unscored")
  public ResponseEntity<LeadScoringService.BatchScoreResult> scoreUnscored() {
    return ResponseEntity.ok(scoringService.scoreUnscoredPool());
  }

  @GetMapping("/internal/leads/{leadId}/score")
  public ResponseEntity<ScoreBreakdownResponse> getBreakdown(@PathVariable UUID leadId) {
    return ResponseEntity.ok(ScoreBreakdownResponse.from(scoringService.getBreakdown(leadId)));
  }

  public record ScoreBatchRequest(@NotEmpty(message = "leadIds is required") List<UUID> leadIds) {}

  public record ScoreBreakdownResponse(
      UUID leadId,
      int total,
      LeadTier tier,
      ScoreComponents components,
      ScoreWeights weights,
      UUID scoredForTenantId,
      Instant scoredAt) {

    public static ScoreBreakdownResponse from(LeadScoreRecord record) {
      return new ScoreBreakdownResponse(
          record.getLeadId(),
          record.getTotalScore(),
          record.getTier(),
          record.components(),
          record.weights(),
          record.getScoredForTenantId(),
          record.getScoredAt());
    }
  }
}
