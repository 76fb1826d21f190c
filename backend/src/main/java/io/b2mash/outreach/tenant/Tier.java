package io.b2mash.outreach.tenant;

/** Subscription tier of a tenant. Drives resource quotas via {@link TierQuotas}. */
public enum Tier {
  IGNITION,
  VELOCITY,
  DOMINANCE;

  /**
   * Derives the tier from a billing plan slug. Unknown slugs fall back to {@link #IGNITION}.
   *
   * @param planSlug plan identifier from billing, e.g. {@code velocity-monthly}
   */
  public static Tier fromPlanSlug(String planSlug) {
    if (planSlug == null) {
      return IGNITION;
    }
    String slug = planSlug.toLowerCase();
    if (slug.contains("dominance")) {
      return DOMINANCE;
    }
    if (slug.contains("velocity")) {
      return VELOCITY;
    }
    return IGNITION;
  }
}
