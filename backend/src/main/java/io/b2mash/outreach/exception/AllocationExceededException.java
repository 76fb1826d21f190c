package io.b2mash.outreach.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a campaign's lead allocation would push the tenant's total across non-terminal
 * campaigns above 100%. Returns HTTP 422 with the current and requested totals.
 */
public class AllocationExceededException extends ErrorResponseException {

  public AllocationExceededException(int allocatedElsewhere, int requested) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(allocatedElsewhere, requested), null);
  }

  private static ProblemDetail createProblem(int allocatedElsewhere, int requested) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Allocation exceeded");
    problem.setDetail(
        "Total lead allocation would be "
            + (allocatedElsewhere + requested)
            + "% ("
            + allocatedElsewhere
            + "% already allocated, "
            + requested
            + "% requested)");
    problem.setProperty("code", "ALLOCATION_EXCEEDED");
    problem.setProperty("allocated", allocatedElsewhere);
    problem.setProperty("available", Math.max(0, 100 - allocatedElsewhere));
    return problem;
  }
}
