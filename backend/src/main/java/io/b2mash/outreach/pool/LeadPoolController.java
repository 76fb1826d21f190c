package io.b2mash.outreach.pool;

import io.b2mash.outreach.scoring.LeadTier;
import jakarta.validation.Valid;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Platform-level pool operations: ingestion and global bounce/unsubscribe flags. */
@RestController
@RequestMapping("/internal/leads")
public class LeadPoolController {

  private final LeadPoolService leadPoolService;

  public LeadPoolController(LeadPoolService leadPoolService) {
    this.leadPoolService = leadPoolService;
  }

  @PostMapping
  public ResponseEntity<LeadResponse> submitLead(
      @Valid @RequestBody LeadPoolService.SubmitLeadCommand request) {
    var lead = leadPoolService.submitLead(request);
    return ResponseEntity.created(URI.create("/internal/leads/" + lead.getId()))
        .body(LeadResponse.from(lead));
  }

  @GetMapping("/{leadId}")
  public ResponseEntity<LeadResponse> getLead(@PathVariable UUID leadId) {
    return ResponseEntity.ok(LeadResponse.from(leadPoolService.getLead(leadId)));
  }

  @GetMapping("/{leadId}/availability")
  public ResponseEntity<Map<String, Boolean>> availability(@PathVariable UUID leadId) {
    return ResponseEntity.ok(Map.of("available", leadPoolService.isAvailable(leadId)));
  }

  @PostMapping("/{leadId}/bounced")
  public ResponseEntity<LeadResponse> markBounced(
      @PathVariable UUID leadId, @RequestParam(required = false) String reason) {
    return ResponseEntity.ok(LeadResponse.from(leadPoolService.markBounced(leadId, reason)));
  }

  @PostMapping("/{leadId}/unsubscribed")
  public ResponseEntity<LeadResponse> markUnsubscribed(@PathVariable UUID leadId) {
    return ResponseEntity.ok(LeadResponse.from(leadPoolService.markUnsubscribed(leadId)));
  }

  @GetMapping("/stats")
  public ResponseEntity<Map<PoolStatus, Long>> poolStats() {
    return ResponseEntity.ok(leadPoolService.poolStats());
  }

  public record LeadResponse(
      UUID id,
      String externalId,
      String email,
      EmailVerification emailVerification,
      String firstName,
      String lastName,
      String title,
      String companyName,
      String companyDomain,
      String industry,
      Integer employeeCount,
      String country,
      boolean hiring,
      LocalDate latestFundingDate,
      PoolStatus poolStatus,
      boolean bounced,
      boolean unsubscribed,
      UUID tenantId,
      UUID campaignId,
      Integer score,
      LeadTier tier,
      Instant scoredAt) {

    public static LeadResponse from(PoolLead lead) {
      return new LeadResponse(
          lead.getId(),
          lead.getExternalId(),
          lead.getEmail(),
          lead.getEmailVerification(),
          lead.getFirstName(),
          lead.getLastName(),
          lead.getTitle(),
          lead.getCompanyName(),
          lead.getCompanyDomain(),
          lead.getIndustry(),
          lead.getEmployeeCount(),
          lead.getCountry(),
          lead.isHiring(),
          lead.getLatestFundingDate(),
          lead.getPoolStatus(),
          lead.isBounced(),
          lead.isUnsubscribed(),
          lead.getTenantId(),
          lead.getCampaignId(),
          lead.getAlsScore(),
          lead.getAlsTier(),
          lead.getScoredAt());
    }
  }
}
