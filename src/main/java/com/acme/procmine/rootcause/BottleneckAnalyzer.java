package com.acme.procmine.rootcause;

import com.acme.procmine.domain.Event;
import com.acme.procmine.domain.EventLog;

import java.util.*;

/**
 * Ranks transitions by how long they take and resources by how often their work goes wrong.
 * Ties in either ranking keep first-seen order.
 *
 * <p>Transitions are keyed by their display string {@code "from → to"}. Activity labels that
 * themselves contain the arrow can collide, e.g. {@code ("A → B", "C")} and {@code ("A", "B → C")};
 * such pairs share one entry whose {@code from}/{@code to} are those of the first pair seen.
 */
public class BottleneckAnalyzer {
  public static final int DEFAULT_TOP_N = 8;
  static final String ARROW = " → ";

  private final AnomalySource anomalies;
  private final int topN;

  public BottleneckAnalyzer(AnomalySource anomalies, int topN) {
    if (topN < 1) throw new IllegalArgumentException("topN must be >= 1: " + topN);
    this.anomalies = Objects.requireNonNull(anomalies, "anomalies");
    this.topN = topN;
  }

  public BottleneckAnalyzer() { this(AnomalySource.NONE, DEFAULT_TOP_N); }

  public int topN() { return topN; }

  public RootCauseReport analyze(EventLog log) { return analyze(log, topN); }

  public RootCauseReport analyze(EventLog log, int limit) {
    if (limit < 1) throw new IllegalArgumentException("limit must be >= 1: " + limit);
    Map<String, List<Double>> durations = new LinkedHashMap<>();
    Map<String, String[]> endpoints = new HashMap<>();
    Map<String, List<Event>> byResource = new LinkedHashMap<>();

    for (List<Event> seq : log.cases().values()) {
      for (int i = 0; i < seq.size(); i++) {
        Event ev = seq.get(i);
        byResource.computeIfAbsent(ev.resource(), k -> new ArrayList<>()).add(ev);
        if (i == 0) continue;
        Event prev = seq.get(i - 1);
        String key = prev.activity() + ARROW + ev.activity();
        durations.computeIfAbsent(key, k -> new ArrayList<>()).add(EventLog.hoursBetween(prev, ev));
        endpoints.putIfAbsent(key, new String[] {prev.activity(), ev.activity()});
      }
    }

    List<BottleneckEntry> all = new ArrayList<>(durations.size());
    durations.forEach((key, list) -> {
      String[] ends = endpoints.get(key);
      all.add(entry(key, ends[0], ends[1], list));
    });

    List<BottleneckEntry> ranked = new ArrayList<>(all);
    ranked.sort(Comparator.comparingDouble(BottleneckEntry::avgDuration).reversed());

    List<ResourceProfile> resources = new ArrayList<>(byResource.size());
    byResource.forEach((resource, performed) -> resources.add(profile(resource, performed)));
    resources.sort(Comparator.comparingDouble(ResourceProfile::errorRate).reversed());

    return new RootCauseReport(
        List.copyOf(ranked.subList(0, Math.min(limit, ranked.size()))),
        List.copyOf(all),
        List.copyOf(resources));
  }

  static BottleneckEntry entry(String key, String from, String to, List<Double> durations) {
    int n = durations.size();
    if (n == 0) return new BottleneckEntry(key, from, to, 0, 0, 0, 0, Severity.LOW);
    double sum = 0, max = 0;
    for (double d : durations) { sum += d; max = Math.max(max, d); }
    double avg = sum / n;
    double sq = 0;
    for (double d : durations) sq += (d - avg) * (d - avg);
    double variability = Math.sqrt(sq / n);
    return new BottleneckEntry(key, from, to, avg, max, n, variability, Severity.ofDuration(avg));
  }

  private ResourceProfile profile(String resource, List<Event> performed) {
    int workload = performed.size();
    int errors = Math.max(0, anomalies.errorsFor(resource, Collections.unmodifiableList(performed)));
    double rate = workload > 0 ? Math.min(100.0, errors * 100.0 / workload) : 0;
    return new ResourceProfile(resource, workload, errors, rate, Severity.ofErrorRate(rate));
  }
}
