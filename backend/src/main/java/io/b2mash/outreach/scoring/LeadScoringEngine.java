package io.b2mash.outreach.scoring;

import io.b2mash.outreach.pool.EmailVerification;
import io.b2mash.outreach.pool.PoolLead;
import io.b2mash.outreach.pool.PoolStatus;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Computes the composite 0-100 lead score from five independent components. Pure: no I/O, no
 * clock other than the {@code today} argument.
 */
@Component
public class LeadScoringEngine {

  private static final Logger log = LoggerFactory.getLogger(LeadScoringEngine.class);

  private static final Map<String, Integer> SENIORITY_POINTS =
      Map.of(
          "owner", 25,
          "founder", 25,
          "c_suite", 22,
          "vp", 18,
          "director", 15,
          "manager", 10,
          "senior", 7,
          "entry", 3);

  // Checked in order; first match wins, so "vice president" precedes "president".
  private static final Map<String, Integer> TITLE_KEYWORDS = titleKeywords();

  private static final List<String> LOW_AUTHORITY_TITLES =
      List.of("assistant", "intern", "student", "coordinator", "receptionist");

  public LeadScore score(PoolLead lead, ScoringProfile profile, LocalDate today) {
    var components =
        new ScoreComponents(
            dataQuality(lead),
            authority(lead),
            companyFit(lead, profile),
            timing(lead, today),
            riskDeduction(lead, profile));
    int total = combine(components, profile.weights());
    return new LeadScore(components, profile.weights(), total, LeadTier.fromScore(total));
  }

  /**
   * Weighted sum, clamped to 0..100. With {@link ScoreWeights#DEFAULT} this is the plain sum of
   * the positive components minus the risk deduction.
   */
  static int combine(ScoreComponents c, ScoreWeights w) {
    var d = ScoreWeights.DEFAULT;
    double total =
        c.dataQuality() * (w.dataQuality() / d.dataQuality())
            + c.authority() * (w.authority() / d.authority())
            + c.companyFit() * (w.companyFit() / d.companyFit())
            + c.timing() * (w.timing() / d.timing())
            - c.riskDeduction() * (w.risk() / d.risk());
    return (int) Math.max(0, Math.min(100, Math.round(total)));
  }

  int dataQuality(PoolLead lead) {
    int points = 0;
    if (hasText(lead.getEmail())) {
      points +=
          switch (lead.getEmailVerification()) {
            case VERIFIED -> 8;
            case CATCH_ALL -> 5;
            case GUESSED -> 3;
            case UNKNOWN -> 2;
            case INVALID -> 0;
          };
    }
    if (hasText(lead.getPhone())) {
      points += 6;
    }
    if (hasText(lead.getLinkedinUrl())) {
      points += 4;
    }
    if (!hasText(lead.getEmail()) && !hasText(lead.getPhone())) {
      log.warn("Lead {} has no reachable contact point, data quality scored 0", lead.getId());
    }
    return Math.min(points, ScoreComponents.MAX_DATA_QUALITY);
  }

  int authority(PoolLead lead) {
    if (hasText(lead.getSeniority())) {
      Integer points = SENIORITY_POINTS.get(lead.getSeniority().trim().toLowerCase(Locale.ROOT));
      if (points != null) {
        return points;
      }
    }
    if (!hasText(lead.getTitle())) {
      return 0;
    }
    String title = lead.getTitle().toLowerCase(Locale.ROOT);
    for (var entry : TITLE_KEYWORDS.entrySet()) {
      if (title.contains(entry.getKey())) {
        return entry.getValue();
      }
    }
    return 5;
  }

  int companyFit(PoolLead lead, ScoringProfile profile) {
    int points = 0;
    if (hasText(lead.getIndustry())
        && profile
            .targetIndustries()
            .contains(lead.getIndustry().trim().toLowerCase(Locale.ROOT))) {
      points += 10;
    }
    Integer employees = lead.getEmployeeCount();
    if (employees != null) {
      if (employees >= 5 && employees <= 50) {
        points += 8;
      } else if (employees >= 51 && employees <= 200) {
        points += 5;
      } else if (employees >= 1 && employees <= 4) {
        points += 3;
      }
    }
    if (hasText(lead.getCountry())) {
      String country = lead.getCountry().trim().toLowerCase(Locale.ROOT);
      if (country.equals("australia") || country.equals("au")) {
        points += 7;
      } else if (List.of("new zealand", "nz", "united states", "us", "usa", "united kingdom", "uk")
          .contains(country)) {
        points += 4;
      }
    }
    return Math.min(points, ScoreComponents.MAX_COMPANY_FIT);
  }

  int timing(PoolLead lead, LocalDate today) {
    int points = 0;
    if (lead.isHiring()) {
      points += 5;
    }
    LocalDate funded = lead.getLatestFundingDate();
    if (funded != null && !funded.isAfter(today)) {
      long months = ChronoUnit.MONTHS.between(funded, today);
      if (months < 12) {
        points += 4;
      } else if (months < 24) {
        points += 2;
      }
    }
    return Math.min(points, ScoreComponents.MAX_TIMING);
  }

  int riskDeduction(PoolLead lead, ScoringProfile profile) {
    int deduction = 0;
    if (lead.isBounced()) {
      deduction += 10;
    }
    if (lead.isUnsubscribed()) {
      deduction += 15;
    }
    if (lead.getPoolStatus() == PoolStatus.BOUNCED || lead.getPoolStatus() == PoolStatus.INVALID) {
      deduction += 10;
    }
    String domain = lead.getCompanyDomain() != null ? lead.getCompanyDomain() : lead.emailDomain();
    if (domain != null && profile.competitorDomains().contains(domain)) {
      deduction += 15;
    }
    if (hasText(lead.getTitle())) {
      String title = lead.getTitle().toLowerCase(Locale.ROOT);
      if (LOW_AUTHORITY_TITLES.stream().anyMatch(title::contains)) {
        deduction += 5;
      }
    }
    return Math.min(deduction, ScoreComponents.MAX_RISK_DEDUCTION);
  }

  private static Map<String, Integer> titleKeywords() {
    var keywords = new LinkedHashMap<String, Integer>();
    keywords.put("owner", 25);
    keywords.put("ceo", 25);
    keywords.put("founder", 25);
    keywords.put("vice president", 18);
    keywords.put("chief", 22);
    keywords.put("president", 22);
    keywords.put("vp", 18);
    keywords.put("director", 15);
    keywords.put("head", 15);
    keywords.put("senior manager", 10);
    keywords.put("manager", 7);
    keywords.put("lead", 7);
    return keywords;
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
