package io.b2mash.outreach.pool;

/** Outbound channel a touch or validation applies to. */
public enum Channel {
  EMAIL,
  LINKEDIN,
  SMS,
  VOICE,
  DIRECT_MAIL
}
