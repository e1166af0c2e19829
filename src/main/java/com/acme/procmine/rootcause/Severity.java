package com.acme.procmine.rootcause;

public enum Severity {
  HIGH, MEDIUM, LOW;

  /** Transition band: above 4h is high, above 2h medium. */
  public static Severity ofDuration(double avgHours) {
    if (avgHours > 4) return HIGH;
    return avgHours > 2 ? MEDIUM : LOW;
  }

  /** Resource band: above 10% is high, above 5% medium. */
  public static Severity ofErrorRate(double errorRate) {
    if (errorRate > 10) return HIGH;
    return errorRate > 5 ? MEDIUM : LOW;
  }
}
