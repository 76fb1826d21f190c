package io.b2mash.outreach.warmup;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Daily volume ramp for one resource type. Each step applies from its {@code fromDay} (1-based
 * days active) until the next step begins; the last step is the steady-state ceiling.
 */
public record WarmupRamp(List<Step> steps) {

  /** Daily limit applying from the given day onwards. */
  public record Step(int fromDay, int dailyLimit) {}

  public WarmupRamp {
    if (steps == null || steps.isEmpty()) {
      throw new IllegalArgumentException("A warm-up ramp needs at least one step");
    }
    steps = steps.stream().sorted(Comparator.comparingInt(Step::fromDay)).toList();
    if (steps.get(0).fromDay() != 1) {
      throw new IllegalArgumentException("The first warm-up step must start on day 1");
    }
    for (int i = 1; i < steps.size(); i++) {
      if (steps.get(i).fromDay() == steps.get(i - 1).fromDay()) {
        throw new IllegalArgumentException(
            "Duplicate warm-up step for day " + steps.get(i).fromDay());
      }
      if (steps.get(i).dailyLimit() < steps.get(i - 1).dailyLimit()) {
        throw new IllegalArgumentException(
            "Warm-up ramp must not decrease (day " + steps.get(i).fromDay() + ")");
      }
    }
  }

  public static WarmupRamp of(int... fromDayAndLimitPairs) {
    if (fromDayAndLimitPairs.length % 2 != 0) {
      throw new IllegalArgumentException("Expected (fromDay, dailyLimit) pairs");
    }
    var steps = new ArrayList<Step>();
    for (int i = 0; i < fromDayAndLimitPairs.length; i += 2) {
      steps.add(new Step(fromDayAndLimitPairs[i], fromDayAndLimitPairs[i + 1]));
    }
    return new WarmupRamp(steps);
  }

  /** Allowed volume on the given day; 0 before day 1. Non-decreasing in {@code daysActive}. */
  public int limitForDay(long daysActive) {
    if (daysActive < 1) {
      return 0;
    }
    int limit = 0;
    for (Step step : steps) {
      if (daysActive >= step.fromDay()) {
        limit = step.dailyLimit();
      } else {
        break;
      }
    }
    return limit;
  }

  /** First day on which the steady-state ceiling applies. */
  public int steadyStateDay() {
    return steps.get(steps.size() - 1).fromDay();
  }

  public int ceiling() {
    return steps.get(steps.size() - 1).dailyLimit();
  }
}
