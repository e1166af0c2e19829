package com.acme.procmine.conformance;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * @param deviationCounts    deviation kind to number of cases showing it
 * @param overallConformance share of conforming cases, 0..100
 */
public record ConformanceReport(ReferenceFlow referenceFlow,
                                List<ConformanceResult> cases,
                                Map<String, Integer> deviationCounts,
                                int conformingCases,
                                int partiallyConformingCases,
                                int nonConformingCases,
                                int overallConformance) {

  @JsonProperty
  public int totalCases() { return cases.size(); }
}
