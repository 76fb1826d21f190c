package io.b2mash.outreach.health;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class HealthClassifierTest {

  private final HealthClassifier classifier = new HealthClassifier(HealthProperties.defaults());

  @Test
  void sixPercentBounces_isCritical() {
    var assessment = classifier.assess(1000, 60, 0);

    assertThat(assessment.bounceRate()).isEqualTo(0.06);
    assertThat(assessment.status()).isEqualTo(HealthStatus.CRITICAL);
  }

  @Test
  void threePercentBounces_isWarning() {
    assertThat(classifier.assess(1000, 30, 0).status()).isEqualTo(HealthStatus.WARNING);
  }

  @Test
  void thresholdsAreStrict() {
    assertThat(classifier.classify(0.05, 0.0)).isEqualTo(HealthStatus.WARNING);
    assertThat(classifier.classify(0.02, 0.0)).isEqualTo(HealthStatus.GOOD);
    assertThat(classifier.classify(0.0, 0.001)).isEqualTo(HealthStatus.WARNING);
  }

  @Test
  void complaintsAloneCanBeCritical() {
    assertThat(classifier.assess(10_000, 0, 11).status()).isEqualTo(HealthStatus.CRITICAL);
  }

  @Test
  void noSends_isGood() {
    var assessment = classifier.assess(0, 0, 0);

    assertThat(assessment.bounceRate()).isZero();
    assertThat(assessment.status()).isEqualTo(HealthStatus.GOOD);
  }

  @Test
  void acceptRateCap_needsEnoughRequests() {
    assertThat(classifier.acceptRateCap(9, 0)).isNull();
  }

  @Test
  void acceptRateCap_tiers() {
    assertThat(classifier.acceptRateCap(100, 15)).isEqualTo(10);
    assertThat(classifier.acceptRateCap(100, 25)).isEqualTo(15);
    assertThat(classifier.acceptRateCap(100, 30)).isNull();
  }

  @Test
  void reputation_forSeatsFollowsAcceptRate() {
    var assessment = classifier.assess(0, 0, 0);

    assertThat(classifier.reputation(assessment, 40, 10, 50)).isEqualTo(25);
  }

  @Test
  void reputation_keepsCurrentWithoutData() {
    assertThat(classifier.reputation(classifier.assess(0, 0, 0), 0, 0, 64)).isEqualTo(64);
  }

  @Test
  void reputation_dropsWithBounces() {
    var assessment = classifier.assess(1000, 50, 0);

    assertThat(classifier.reputation(assessment, 0, 0, 80)).isEqualTo(50);
  }
}
