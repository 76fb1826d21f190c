package io.b2mash.outreach.resource;

/**
 * Sharing state of a resource. {@link #AVAILABLE} and {@link #WARMING} resources have spare
 * capacity; {@link #ASSIGNED} means every tenant slot is taken; {@link #RETIRED} is terminal.
 */
public enum ResourceStatus {
  AVAILABLE,
  ASSIGNED,
  WARMING,
  RETIRED
}
