package com.acme.procmine.conformance;

import java.util.List;

/**
 * Outcome for one case.
 *
 * @param score           0..100
 * @param orderViolations adjacent pairs that step backwards in the reference flow
 */
public record ConformanceResult(String caseId, ConformanceStatus status, int score,
                                List<Deviation> deviations, int orderViolations) {}
