package io.b2mash.outreach.pool;

public enum AssignmentStatus {
  ACTIVE,
  RELEASED,
  CONVERTED,
  EXPIRED
}
