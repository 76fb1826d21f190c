package io.b2mash.outreach.resource;

public enum ResourceType {
  EMAIL_DOMAIN,
  PHONE_NUMBER,
  LINKEDIN_SEAT
}
