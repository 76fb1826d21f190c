package io.b2mash.outreach.health;

/** Rates and classification computed from one rolling window of send events. */
public record HealthAssessment(
    long sends,
    long bounces,
    long complaints,
    double bounceRate,
    double complaintRate,
    HealthStatus status) {}
