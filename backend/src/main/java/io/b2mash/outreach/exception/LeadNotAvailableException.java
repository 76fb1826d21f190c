package io.b2mash.outreach.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a lead cannot be assigned because it is not available at commit time: already owned
 * by a tenant, converted, or globally bounced or unsubscribed. Returns HTTP 409. Callers are not
 * retried automatically; they pick another lead.
 */
public class LeadNotAvailableException extends ErrorResponseException {

  private final UUID leadId;

  public LeadNotAvailableException(UUID leadId, String reason) {
    super(HttpStatus.CONFLICT, createProblem(leadId, reason), null);
    this.leadId = leadId;
  }

  public UUID getLeadId() {
    return leadId;
  }

  private static ProblemDetail createProblem(UUID leadId, String reason) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Lead not available");
    problem.setDetail("Lead " + leadId + " is not available: " + reason);
    problem.setProperty("code", "LEAD_NOT_AVAILABLE");
    problem.setProperty("leadId", leadId);
    return problem;
  }
}
