package io.b2mash.outreach.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when releasing or converting an assignment that is no longer active. HTTP 409. */
public class AssignmentNotActiveException extends ErrorResponseException {

  public AssignmentNotActiveException(UUID assignmentId, String currentStatus) {
    this("Assignment " + assignmentId + " is " + currentStatus);
  }

  private AssignmentNotActiveException(String detail) {
    super(HttpStatus.CONFLICT, createProblem(detail), null);
  }

  /** The caller's tenant holds no active assignment for the lead. */
  public static AssignmentNotActiveException noActiveAssignment(UUID leadId) {
    return new AssignmentNotActiveException("No active assignment for lead " + leadId);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Assignment not active");
    problem.setDetail(detail);
    problem.setProperty("code", "ASSIGNMENT_NOT_ACTIVE");
    return problem;
  }
}
