package io.b2mash.outreach.scoring;

import io.b2mash.outreach.pool.Channel;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/** Discrete bucket of the composite lead score, checked from the highest threshold down. */
public enum LeadTier {
  HOT(85, EnumSet.allOf(Channel.class)),
  WARM(60, EnumSet.of(Channel.EMAIL, Channel.LINKEDIN, Channel.VOICE)),
  COOL(35, EnumSet.of(Channel.EMAIL, Channel.LINKEDIN)),
  COLD(20, EnumSet.of(Channel.EMAIL)),
  DEAD(0, EnumSet.noneOf(Channel.class));

  private final int minScore;
  private final Set<Channel> channels;

  LeadTier(int minScore, Set<Channel> channels) {
    this.minScore = minScore;
    this.channels = channels;
  }

  public static LeadTier fromScore(int score) {
    for (LeadTier tier : values()) {
      if (score >= tier.minScore) {
        return tier;
      }
    }
    return DEAD;
  }

  public int minScore() {
    return minScore;
  }

  /** Channels worth spending on a lead of this tier. */
  public Set<Channel> channels() {
    return Collections.unmodifiableSet(channels);
  }
}
