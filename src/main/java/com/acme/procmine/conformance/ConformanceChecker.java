package com.acme.procmine.conformance;

import com.acme.procmine.domain.Event;
import com.acme.procmine.domain.EventLog;

import java.util.*;

/** Rule-based comparison of each case against a given reference flow. */
public class ConformanceChecker {
  private final ConformanceRules rules;

  public ConformanceChecker(ConformanceRules rules) {
    this.rules = Objects.requireNonNull(rules, "rules");
  }

  public ConformanceChecker() { this(ConformanceRules.DEFAULTS); }

  public ConformanceRules rules() { return rules; }

  public ConformanceReport check(EventLog log, ReferenceFlow flow) {
    Objects.requireNonNull(flow, "reference flow");
    List<ConformanceResult> results = new ArrayList<>(log.caseCount());
    Map<String, Integer> tally = new LinkedHashMap<>();
    int conforming = 0, partial = 0, non = 0;

    for (var c : log.cases().entrySet()) {
      List<String> activities = c.getValue().stream().map(Event::activity).toList();
      ConformanceResult r = checkCase(c.getKey(), activities, flow);
      results.add(r);
      r.deviations().forEach(d -> tally.merge(d.kind(), 1, Integer::sum));
      switch (r.status()) {
        case CONFORMING -> conforming++;
        case PARTIALLY_CONFORMING -> partial++;
        case NON_CONFORMING -> non++;
      }
    }

    int overall = results.isEmpty() ? 0 : (int) Math.round(conforming * 100.0 / results.size());
    return new ConformanceReport(flow, List.copyOf(results), Collections.unmodifiableMap(tally),
        conforming, partial, non, overall);
  }

  public ConformanceResult checkCase(String caseId, List<String> actual, ReferenceFlow flow) {
    int n = actual.size();
    int m = flow.size();

    // duplicates each count, so coverage may exceed 1 before clamping
    long covered = actual.stream().filter(flow::contains).count();
    double coverage = (double) covered / m;

    List<Deviation> deviations = new ArrayList<>(3);
    if (n > m + rules.extraTolerance()) deviations.add(Deviation.EXTRA_ACTIVITIES);
    if (n < m - rules.missingTolerance()) deviations.add(Deviation.MISSING_ACTIVITIES);

    int violations = 0;
    for (int i = 1; i < n; i++) {
      int prevIdx = flow.indexOf(actual.get(i - 1));
      int currIdx = flow.indexOf(actual.get(i));
      if (prevIdx >= 0 && currIdx >= 0 && currIdx < prevIdx) violations++;
    }
    if (violations > 0) deviations.add(Deviation.WRONG_ORDER);

    double score = Math.min(1.0, Math.max(0.0, coverage - rules.orderPenalty() * violations));

    ConformanceStatus status;
    if (score >= rules.conformingThreshold() && deviations.isEmpty()) status = ConformanceStatus.CONFORMING;
    else if (score >= rules.partialThreshold()) status = ConformanceStatus.PARTIALLY_CONFORMING;
    else status = ConformanceStatus.NON_CONFORMING;

    return new ConformanceResult(caseId, status, (int) Math.round(score * 100), List.copyOf(deviations), violations);
  }
}
