package com.acme.procmine.config;

import com.acme.procmine.conformance.ConformanceChecker;
import com.acme.procmine.conformance.ConformanceRules;
import com.acme.procmine.conformance.ReferenceFlow;
import com.acme.procmine.rootcause.AnomalySource;
import com.acme.procmine.rootcause.BottleneckAnalyzer;
import com.acme.procmine.rootcause.IssueClassifier;
import com.acme.procmine.rootcause.RandomAnomalySource;
import com.acme.procmine.summary.LogSummarizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;

@Configuration
@EnableConfigurationProperties(ProcmineProperties.class)
public class EngineConfig {

  @Bean
  public ReferenceFlow defaultReferenceFlow(ProcmineProperties props) {
    return ReferenceFlow.of(props.referenceFlow());
  }

  @Bean
  public ConformanceChecker conformanceChecker(ProcmineProperties props) {
    var c = props.conformance();
    return new ConformanceChecker(new ConformanceRules(c.extraTolerance(), c.missingTolerance(),
        c.orderPenalty(), c.conformingThreshold(), c.partialThreshold()));
  }

  @Bean
  public AnomalySource anomalySource(ProcmineProperties props) {
    var a = props.anomaly();
    return switch (a.mode().toLowerCase()) {
      case "none" -> AnomalySource.NONE;
      case "random" -> new RandomAnomalySource(a.rate(), a.seed());
      default -> throw new IllegalArgumentException("Unknown procmine.anomaly.mode: " + a.mode());
    };
  }

  @Bean
  public BottleneckAnalyzer bottleneckAnalyzer(AnomalySource anomalySource, ProcmineProperties props) {
    return new BottleneckAnalyzer(anomalySource, props.bottleneck().topN());
  }

  @Bean
  public IssueClassifier issueClassifier(ProcmineProperties props) {
    return new IssueClassifier(props.issues());
  }

  @Bean
  public LogSummarizer logSummarizer(ProcmineProperties props) {
    var s = props.summary();
    return new LogSummarizer(s.topActivities(), ZoneId.of(s.zone()));
  }
}
