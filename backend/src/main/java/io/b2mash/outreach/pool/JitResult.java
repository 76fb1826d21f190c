package io.b2mash.outreach.pool;

import java.util.UUID;

/**
 * Outcome of a just-in-time validation.
 *
 * @param valid whether the send may proceed
 * @param rejection the first failing check; null when valid
 * @param assignmentId the tenant's active assignment when valid
 */
public record JitResult(boolean valid, JitRejection rejection, UUID assignmentId) {

  public static JitResult ok(UUID assignmentId) {
    return new JitResult(true, null, assignmentId);
  }

  public static JitResult reject(JitRejection rejection) {
    return new JitResult(false, rejection, null);
  }
}
