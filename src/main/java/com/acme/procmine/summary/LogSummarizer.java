package com.acme.procmine.summary;

import com.acme.procmine.domain.Event;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.*;

/**
 * Headline counts over a (filtered) event collection.
 * Days are calendar dates in {@code zone}, UTC unless configured otherwise.
 */
public class LogSummarizer {
  public static final int DEFAULT_TOP_ACTIVITIES = 10;

  private final int topActivities;
  private final ZoneId zone;

  public LogSummarizer(int topActivities, ZoneId zone) {
    if (topActivities < 1) throw new IllegalArgumentException("topActivities must be >= 1: " + topActivities);
    this.topActivities = topActivities;
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  public LogSummarizer() { this(DEFAULT_TOP_ACTIVITIES, ZoneOffset.UTC); }

  public LogSummary summarize(Collection<Event> events) {
    Set<String> caseIds = new HashSet<>();
    Set<String> resources = new HashSet<>();
    Map<String, Integer> activities = new LinkedHashMap<>();
    Map<LocalDate, Set<String>> days = new TreeMap<>();

    for (Event e : events) {
      caseIds.add(e.caseId());
      resources.add(e.resource());
      activities.merge(e.activity(), 1, Integer::sum);
      days.computeIfAbsent(LocalDate.ofInstant(e.timestamp(), zone), d -> new HashSet<>()).add(e.caseId());
    }

    List<ActivityCount> counts = new ArrayList<>(activities.size());
    activities.forEach((a, n) -> counts.add(new ActivityCount(a, n)));
    counts.sort(Comparator.comparingInt(ActivityCount::count).reversed());

    List<DailyCaseCount> perDay = new ArrayList<>(days.size());
    days.forEach((d, ids) -> perDay.add(new DailyCaseCount(d, ids.size())));

    return new LogSummary(caseIds.size(), events.size(), resources.size(),
        List.copyOf(counts.subList(0, Math.min(topActivities, counts.size()))), List.copyOf(perDay));
  }
}
