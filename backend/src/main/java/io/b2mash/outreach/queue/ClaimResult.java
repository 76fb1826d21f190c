package io.b2mash.outreach.queue;

public enum ClaimResult {
  CLAIMED,
  ALREADY_CLAIMED
}
