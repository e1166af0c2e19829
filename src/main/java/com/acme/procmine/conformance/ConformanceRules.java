package com.acme.procmine.conformance;

/**
 * Tunables of the conformance score.
 *
 * @param extraTolerance      extra activities are flagged when a case is longer than the flow by more than this
 * @param missingTolerance    missing activities are flagged when a case is shorter than the flow by more than this
 * @param orderPenalty        deducted from the score per backwards step
 * @param conformingThreshold minimum score for a deviation-free case to be conforming
 * @param partialThreshold    minimum score for a case to be partially conforming
 */
public record ConformanceRules(int extraTolerance, int missingTolerance, double orderPenalty,
                               double conformingThreshold, double partialThreshold) {
  public static final ConformanceRules DEFAULTS = new ConformanceRules(2, 1, 0.1, 0.8, 0.5);

  public ConformanceRules {
    if (extraTolerance < 0 || missingTolerance < 0) throw new IllegalArgumentException("Tolerances must be >= 0");
    requireUnit(orderPenalty, "orderPenalty");
    requireUnit(conformingThreshold, "conformingThreshold");
    requireUnit(partialThreshold, "partialThreshold");
  }

  private static void requireUnit(double v, String name) {
    if (!(v >= 0 && v <= 1)) throw new IllegalArgumentException(name + " must be within [0,1]: " + v);
  }
}
