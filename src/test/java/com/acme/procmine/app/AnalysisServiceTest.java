package com.acme.procmine.app;

import com.acme.procmine.conformance.ConformanceChecker;
import com.acme.procmine.conformance.ConformanceResult;
import com.acme.procmine.conformance.ConformanceStatus;
import com.acme.procmine.conformance.ReferenceFlow;
import com.acme.procmine.domain.Event;
import com.acme.procmine.domain.EventFilter;
import com.acme.procmine.domain.EventLogCache;
import com.acme.procmine.flow.FlowGraphBuilder;
import com.acme.procmine.rootcause.BottleneckAnalyzer;
import com.acme.procmine.rootcause.IssueCategory;
import com.acme.procmine.rootcause.IssueClassifier;
import com.acme.procmine.rootcause.IssueRule;
import com.acme.procmine.rootcause.Severity;
import com.acme.procmine.summary.LogSummarizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.acme.procmine.TestLogs.caseOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

@DisplayName("AnalysisService")
class AnalysisServiceTest {

  private AnalysisService service;

  @BeforeEach
  void setUp() {
    var rules = List.of(new IssueRule("Process Bottlenecks", IssueRule.Target.TRANSITION, "avgDuration > 2", Severity.HIGH));
    service = new AnalysisService(new EventLogCache(), new FlowGraphBuilder(), new ConformanceChecker(),
        new BottleneckAnalyzer(), new IssueClassifier(rules), new LogSummarizer(), ReferenceFlow.of("X", "Y", "Z"));
  }

  @Test
  void emptyLogGivesEmptyReport() {
    var report = service.analyze(List.of());

    assertThat(report.summary().eventCount()).isZero();
    assertThat(report.flow().nodes()).isEmpty();
    assertThat(report.flow().edges()).isEmpty();
    assertThat(report.conformance().cases()).isEmpty();
    assertThat(report.rootCause().bottlenecks()).isEmpty();
    assertThat(report.rootCause().resources()).isEmpty();
    assertThat(report.issues()).extracting(IssueCategory::count).containsOnly(0);
  }

  @Test
  void runsEveryAnalysisOverTheSameLog() {
    List<Event> events = new ArrayList<>(caseOf("c1", 1, "X", "Y", "Z"));
    events.addAll(caseOf("c2", 3, "Z", "Y", "X"));

    var report = service.analyze(events);

    assertThat(report.summary().caseCount()).isEqualTo(2);
    assertThat(report.flow().nodes()).hasSize(3);
    assertThat(report.conformance().cases()).extracting(ConformanceResult::status)
        .containsExactly(ConformanceStatus.CONFORMING, ConformanceStatus.PARTIALLY_CONFORMING);
    assertThat(report.rootCause().bottlenecks().get(0).avgDuration()).isEqualTo(3.0);
    assertThat(report.issues().get(0).count()).isEqualTo(2);
    assertThat(report.reversedTimestampPairs()).isZero();
  }

  @Test
  void requestOverridesFlowFilterAndTopN() {
    List<Event> events = new ArrayList<>(caseOf("c1", 1, "A", "B", "C"));
    events.addAll(caseOf("c2", 1, "D", "E"));

    var report = service.analyze(events, List.of("A", "B", "C"), new EventFilter(null, null, null, "r1"), 1);

    assertThat(report.conformance().referenceFlow()).isEqualTo(ReferenceFlow.of("A", "B", "C"));
    assertThat(report.conformance().cases().get(0).score()).isEqualTo(100);
    assertThat(report.rootCause().bottlenecks()).hasSize(1);
    assertThat(report.rootCause().allTransitions()).hasSize(3);
  }

  @Test
  void repeatedCallsGiveEqualReports() {
    var events = caseOf("c1", 2, "X", "Y", "X", "Z");

    assertThat(service.analyze(events)).isEqualTo(service.analyze(events));
    assertThat(service.analyze(new ArrayList<>(events))).isEqualTo(service.analyze(events));
  }

  @Test
  void rejectsDuplicateReferenceLabels() {
    assertThatIllegalArgumentException()
        .isThrownBy(() -> service.analyze(List.of(), List.of("A", "A"), null, null));
  }
}
