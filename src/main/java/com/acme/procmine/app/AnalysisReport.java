package com.acme.procmine.app;

import com.acme.procmine.conformance.ConformanceReport;
import com.acme.procmine.flow.FlowGraph;
import com.acme.procmine.rootcause.IssueCategory;
import com.acme.procmine.rootcause.RootCauseReport;
import com.acme.procmine.summary.LogSummary;

import java.util.List;

/** @param reversedTimestampPairs adjacent events whose input order runs backwards in time */
public record AnalysisReport(LogSummary summary,
                             FlowGraph flow,
                             ConformanceReport conformance,
                             RootCauseReport rootCause,
                             List<IssueCategory> issues,
                             int reversedTimestampPairs) {}
