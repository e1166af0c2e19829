package com.acme.procmine.app;

import com.acme.procmine.conformance.ConformanceChecker;
import com.acme.procmine.conformance.ConformanceReport;
import com.acme.procmine.conformance.ReferenceFlow;
import com.acme.procmine.domain.Event;
import com.acme.procmine.domain.EventFilter;
import com.acme.procmine.domain.EventLog;
import com.acme.procmine.domain.EventLogCache;
import com.acme.procmine.flow.FlowGraph;
import com.acme.procmine.flow.FlowGraphBuilder;
import com.acme.procmine.rootcause.BottleneckAnalyzer;
import com.acme.procmine.rootcause.IssueClassifier;
import com.acme.procmine.rootcause.RootCauseReport;
import com.acme.procmine.summary.LogSummarizer;
import com.acme.procmine.summary.LogSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Runs every analysis over one grouped view of the log.
 * The view is shared read-only; each analysis allocates its own output.
 */
@Service
public class AnalysisService {
  private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

  private final EventLogCache cache;
  private final FlowGraphBuilder flowBuilder;
  private final ConformanceChecker conformance;
  private final BottleneckAnalyzer bottlenecks;
  private final IssueClassifier issues;
  private final LogSummarizer summarizer;
  private final ReferenceFlow defaultFlow;

  public AnalysisService(EventLogCache cache, FlowGraphBuilder flowBuilder, ConformanceChecker conformance,
                         BottleneckAnalyzer bottlenecks, IssueClassifier issues, LogSummarizer summarizer,
                         ReferenceFlow defaultFlow) {
    this.cache = cache; this.flowBuilder = flowBuilder; this.conformance = conformance;
    this.bottlenecks = bottlenecks; this.issues = issues; this.summarizer = summarizer;
    this.defaultFlow = defaultFlow;
  }

  public ReferenceFlow defaultReferenceFlow() { return defaultFlow; }

  public AnalysisReport analyze(List<Event> events) {
    return analyze(events, null, null, null);
  }

  /**
   * @param referenceFlow null for the configured default
   * @param filter        null for no filtering
   * @param topN          null for the configured bottleneck count
   */
  public AnalysisReport analyze(List<Event> events, List<String> referenceFlow, EventFilter filter, Integer topN) {
    ReferenceFlow flow = referenceFlow == null || referenceFlow.isEmpty() ? defaultFlow : ReferenceFlow.of(referenceFlow);
    EventLog eventLog = cache.get(events == null ? List.of() : events, filter);

    LogSummary summary = summarizer.summarize(eventLog.events());
    FlowGraph graph = flowBuilder.build(eventLog);
    ConformanceReport conf = conformance.check(eventLog, flow);
    RootCauseReport rootCause = topN == null ? bottlenecks.analyze(eventLog) : bottlenecks.analyze(eventLog, topN);

    log.debug("Analyzed {} events in {} cases: {} activities, {} transitions, {} reversed pairs",
        eventLog.eventCount(), eventLog.caseCount(), graph.nodes().size(), graph.edges().size(), eventLog.reversedPairs());
    return new AnalysisReport(summary, graph, conf, rootCause, issues.classify(rootCause), eventLog.reversedPairs());
  }
}
