package io.b2mash.outreach.resource;

public enum GrantStatus {
  ACTIVE,
  RELEASED
}
