package com.acme.procmine.rootcause;

/**
 * A named predicate over transitions or resources, written as a JEXL expression.
 * Transition variables: avgDuration, maxDuration, occurrences, variability.
 * Resource variables: workload, errors, errorRate.
 */
public record IssueRule(String name, Target target, String expression, Severity severity) {
  public enum Target { TRANSITION, RESOURCE }

  public IssueRule {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("Issue rule name must not be blank");
    if (target == null) throw new IllegalArgumentException("Issue rule '" + name + "' has no target");
    if (expression == null || expression.isBlank()) throw new IllegalArgumentException("Issue rule '" + name + "' has no expression");
    if (severity == null) severity = Severity.MEDIUM;
  }
}
