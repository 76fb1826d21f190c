package io.b2mash.outreach.tenant;

import io.b2mash.outreach.resource.ResourceType;

/** Per-tier resource quota table. Consulted before the allocator grants a resource. */
public final class TierQuotas {

  private TierQuotas() {}

  public static int maxResources(Tier tier, ResourceType type) {
    return switch (tier) {
      case IGNITION ->
          switch (type) {
            case EMAIL_DOMAIN -> 3;
            case PHONE_NUMBER -> 1;
            case LINKEDIN_SEAT -> 4;
          };
      case VELOCITY ->
          switch (type) {
            case EMAIL_DOMAIN -> 5;
            case PHONE_NUMBER -> 2;
            case LINKEDIN_SEAT -> 7;
          };
      case DOMINANCE ->
          switch (type) {
            case EMAIL_DOMAIN -> 9;
            case PHONE_NUMBER -> 3;
            case LINKEDIN_SEAT -> 14;
          };
    };
  }
}
