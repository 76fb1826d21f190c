package io.b2mash.outreach.scoring;

import io.b2mash.outreach.tenant.Tenant;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/** Tenant-specific scoring inputs: what counts as a fit, who counts as a competitor. */
public record ScoringProfile(
    Set<String> targetIndustries, Set<String> competitorDomains, ScoreWeights weights) {

  public static final ScoringProfile NEUTRAL =
      new ScoringProfile(Set.of(), Set.of(), ScoreWeights.DEFAULT);

  public static ScoringProfile of(Tenant tenant) {
    return new ScoringProfile(
        normalize(tenant.getTargetIndustries()),
        normalize(tenant.getCompetitorDomains()),
        ScoreWeights.fromMap(tenant.getScoringWeights()));
  }

  private static Set<String> normalize(List<String> values) {
    return values.stream()
        .filter(v -> v != null && !v.isBlank())
        .map(v -> v.trim().toLowerCase(Locale.ROOT))
        .collect(Collectors.toUnmodifiableSet());
  }
}
