package io.b2mash.outreach.scoring;

/** Result of scoring one lead: the components, the weights applied, the total and its tier. */
public record LeadScore(
    ScoreComponents components, ScoreWeights weights, int total, LeadTier tier) {}
