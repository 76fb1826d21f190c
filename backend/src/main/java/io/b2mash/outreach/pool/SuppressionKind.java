package io.b2mash.outreach.pool;

public enum SuppressionKind {
  EMAIL,
  DOMAIN
}
