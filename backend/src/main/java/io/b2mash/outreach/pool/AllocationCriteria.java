package io.b2mash.outreach.pool;

import java.util.List;
import java.util.Locale;

/**
 * Ideal-customer-profile filter for bulk allocation. Empty lists match any value; a null
 * verification list means verified addresses only.
 */
public record AllocationCriteria(
    List<String> industries,
    List<String> countries,
    List<String> seniorities,
    Integer minEmployees,
    Integer maxEmployees,
    List<EmailVerification> emailVerifications) {

  public AllocationCriteria {
    industries = lower(industries);
    countries = lower(countries);
    seniorities = lower(seniorities);
    emailVerifications =
        emailVerifications == null || emailVerifications.isEmpty()
            ? List.of(EmailVerification.VERIFIED)
            : List.copyOf(emailVerifications);
    if (minEmployees != null && maxEmployees != null && minEmployees > maxEmployees) {
      throw new IllegalArgumentException("minEmployees must not exceed maxEmployees");
    }
  }

  private static List<String> lower(List<String> values) {
    if (values == null) {
      return List.of();
    }
    return values.stream()
        .filter(v -> v != null && !v.isBlank())
        .map(v -> v.trim().toLowerCase(Locale.ROOT))
        .toList();
  }
}
