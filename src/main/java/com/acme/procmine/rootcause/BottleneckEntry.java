package com.acme.procmine.rootcause;

/**
 * Duration statistics of one transition, in hours.
 *
 * @param transition  display key, {@code "from → to"}
 * @param variability population standard deviation of the durations
 */
public record BottleneckEntry(String transition, String from, String to,
                              double avgDuration, double maxDuration, int occurrences,
                              double variability, Severity severity) {}
