package io.b2mash.outreach.scoring;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.outreach.pool.Channel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class LeadTierTest {

  @ParameterizedTest
  @CsvSource({
    "100, HOT", "85, HOT", "84, WARM", "60, WARM", "59, COOL", "35, COOL", "34, COLD", "20, COLD",
    "19, DEAD", "0, DEAD"
  })
  void fromScore_usesThresholdBoundaries(int score, LeadTier expected) {
    assertThat(LeadTier.fromScore(score)).isEqualTo(expected);
  }

  @Test
  void channels_narrowWithTier() {
    assertThat(LeadTier.HOT.channels()).contains(Channel.SMS, Channel.DIRECT_MAIL);
    assertThat(LeadTier.COLD.channels()).containsExactly(Channel.EMAIL);
    assertThat(LeadTier.DEAD.channels()).isEmpty();
  }
}
