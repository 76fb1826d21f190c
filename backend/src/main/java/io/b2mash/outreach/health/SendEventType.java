package io.b2mash.outreach.health;

public enum SendEventType {
  SENT,
  BOUNCED,
  COMPLAINED,
  CONNECTION_REQUESTED,
  CONNECTION_ACCEPTED
}
