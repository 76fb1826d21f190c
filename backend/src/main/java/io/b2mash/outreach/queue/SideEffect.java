package io.b2mash.outreach.queue;

/** Work to persist alongside a queue item transition, in the same transaction. */
public enum SideEffect {
  RECORD_SEND_EVENT,
  RECORD_LEAD_TOUCH,
  RECORD_GRANT_USAGE,
  REFUND_DAILY_SLOT,
  ALERT_OPERATIONS
}
