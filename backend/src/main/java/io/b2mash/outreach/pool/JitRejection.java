package io.b2mash.outreach.pool;

/** Reason a just-in-time validation refused a send. Declared in evaluation order. */
public enum JitRejection {
  LEAD_NOT_FOUND,
  BOUNCED_GLOBALLY,
  UNSUBSCRIBED_GLOBALLY,
  POOL_STATUS_INVALID,
  INVALID_EMAIL,
  UNVERIFIED_EMAIL,
  SUPPRESSED,
  NOT_ASSIGNED,
  MAX_TOUCHES_REACHED,
  NEGATIVE_REPLY,
  COOLING_PERIOD,
  TOO_RECENT
}
