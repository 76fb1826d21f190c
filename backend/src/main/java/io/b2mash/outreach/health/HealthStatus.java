package io.b2mash.outreach.health;

public enum HealthStatus {
  GOOD,
  WARNING,
  CRITICAL
}
