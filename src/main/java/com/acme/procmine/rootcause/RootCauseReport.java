package com.acme.procmine.rootcause;

import java.util.List;

/**
 * @param bottlenecks    top transitions by average duration
 * @param allTransitions every transition, in first-seen order
 * @param resources      resource profiles by descending error rate
 */
public record RootCauseReport(List<BottleneckEntry> bottlenecks,
                              List<BottleneckEntry> allTransitions,
                              List<ResourceProfile> resources) {
  public static RootCauseReport empty() { return new RootCauseReport(List.of(), List.of(), List.of()); }
}
