package io.b2mash.outreach.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when a resource is already shared by its maximum number of tenants. HTTP 409. */
public class CapacityExceededException extends ErrorResponseException {

  public CapacityExceededException(UUID resourceId, int maxTenants) {
    super(HttpStatus.CONFLICT, createProblem(resourceId, maxTenants), null);
  }

  private static ProblemDetail createProblem(UUID resourceId, int maxTenants) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Resource at capacity");
    problem.setDetail(
        "Resource " + resourceId + " is already shared by " + maxTenants + " tenant(s)");
    problem.setProperty("code", "CAPACITY_EXCEEDED");
    return problem;
  }
}
