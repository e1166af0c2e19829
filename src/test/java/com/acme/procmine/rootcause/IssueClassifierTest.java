package com.acme.procmine.rootcause;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

class IssueClassifierTest {

  private static final List<IssueRule> DEFAULT_RULES = List.of(
      new IssueRule("Process Bottlenecks", IssueRule.Target.TRANSITION, "avgDuration > 2", Severity.HIGH),
      new IssueRule("Resource Overload", IssueRule.Target.RESOURCE, "workload > 10", Severity.MEDIUM),
      new IssueRule("Quality Issues", IssueRule.Target.RESOURCE, "errorRate > 5", Severity.HIGH),
      new IssueRule("Timing Variability", IssueRule.Target.TRANSITION, "variability > 1", Severity.LOW));

  @Test
  void countsMatchesPerRule() {
    var report = new RootCauseReport(
        List.of(
            new BottleneckEntry("A → B", "A", "B", 5, 9, 3, 2.5, Severity.HIGH),
            new BottleneckEntry("B → C", "B", "C", 1, 1, 4, 0, Severity.LOW)),
        List.of(),
        List.of(
            new ResourceProfile("alice", 20, 3, 15, Severity.HIGH),
            new ResourceProfile("bob", 4, 0, 0, Severity.LOW)));

    var issues = new IssueClassifier(DEFAULT_RULES).classify(report);

    assertThat(issues).containsExactly(
        new IssueCategory("Process Bottlenecks", 1, Severity.HIGH),
        new IssueCategory("Resource Overload", 1, Severity.MEDIUM),
        new IssueCategory("Quality Issues", 1, Severity.HIGH),
        new IssueCategory("Timing Variability", 1, Severity.LOW));
  }

  @Test
  void emptyReportCountsZero() {
    var issues = new IssueClassifier(DEFAULT_RULES).classify(RootCauseReport.empty());

    assertThat(issues).extracting(IssueCategory::count).containsOnly(0);
  }

  @Test
  void rejectsBrokenExpressions() {
    var broken = new IssueRule("Broken", IssueRule.Target.RESOURCE, "workload >", Severity.LOW);

    assertThatIllegalArgumentException().isThrownBy(() -> new IssueClassifier(List.of(broken)))
        .withMessageContaining("Broken");
  }

  @Test
  void rejectsVariablesTheTargetDoesNotDefine() {
    var misaimed = new IssueRule("Misaimed", IssueRule.Target.TRANSITION, "workload > 10", Severity.LOW);

    assertThatIllegalArgumentException().isThrownBy(() -> new IssueClassifier(List.of(misaimed)))
        .withMessageContaining("Misaimed")
        .withMessageContaining("workload");
  }

  @Test
  void acceptsEveryVariableOfItsTarget() {
    var rules = List.of(
        new IssueRule("t", IssueRule.Target.TRANSITION,
            "avgDuration > 1 && maxDuration > 1 && occurrences > 1 && variability >= 0", Severity.LOW),
        new IssueRule("r", IssueRule.Target.RESOURCE, "workload > 1 && errors > 0 && errorRate > 1", Severity.LOW));
    var report = new RootCauseReport(
        List.of(new BottleneckEntry("A → B", "A", "B", 3, 5, 2, 1, Severity.MEDIUM)),
        List.of(),
        List.of(new ResourceProfile("alice", 10, 2, 20, Severity.HIGH)));

    assertThat(new IssueClassifier(rules).classify(report)).extracting(IssueCategory::count).containsExactly(1, 1);
  }

  @Test
  void severityDefaultsToMedium() {
    assertThat(new IssueRule("x", IssueRule.Target.RESOURCE, "errors > 0", null).severity()).isEqualTo(Severity.MEDIUM);
  }
}
