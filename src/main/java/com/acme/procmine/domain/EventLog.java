package com.acme.procmine.domain;

import java.time.Duration;
import java.util.*;

/**
 * Events grouped by case id, each case ordered by timestamp.
 * The sort is stable: events sharing a timestamp keep their input order.
 * Instances are immutable and safe to share between concurrent readers.
 */
public final class EventLog {
  private static final double MILLIS_PER_HOUR = 3_600_000d;

  private final List<Event> events;
  private final Map<String, List<Event>> cases;
  private final int reversedPairs;

  private EventLog(List<Event> events, Map<String, List<Event>> cases, int reversedPairs) {
    this.events = events; this.cases = cases; this.reversedPairs = reversedPairs;
  }

  public static EventLog of(Collection<Event> events) {
    Map<String, List<Event>> grouped = group(events);
    int reversed = 0;
    Map<String, List<Event>> sorted = new LinkedHashMap<>();
    for (var e : grouped.entrySet()) {
      List<Event> seq = e.getValue();
      for (int i = 1; i < seq.size(); i++) {
        if (seq.get(i).timestamp().isBefore(seq.get(i - 1).timestamp())) reversed++;
      }
      List<Event> copy = new ArrayList<>(seq);
      copy.sort(Comparator.comparing(Event::timestamp));
      sorted.put(e.getKey(), List.copyOf(copy));
    }
    List<Event> all = new ArrayList<>();
    grouped.values().forEach(all::addAll);
    return new EventLog(List.copyOf(all), Collections.unmodifiableMap(sorted), reversed);
  }

  public static EventLog empty() { return of(List.of()); }

  /** Case id to its events, ascending by timestamp. Cases appear in first-seen order. */
  public static Map<String, List<Event>> groupedAndSorted(Collection<Event> events) {
    return of(events).cases();
  }

  private static Map<String, List<Event>> group(Collection<Event> events) {
    if (events == null) throw new IllegalArgumentException("events must not be null");
    Map<String, List<Event>> acc = new LinkedHashMap<>();
    for (Event ev : events) {
      if (ev == null) throw new IllegalArgumentException("Event log contains a null event");
      acc.computeIfAbsent(ev.caseId(), k -> new ArrayList<>()).add(ev);
    }
    return acc;
  }

  public Map<String, List<Event>> cases() { return cases; }

  /** All events, grouped by case but otherwise in input order. */
  public List<Event> events() { return events; }

  public int eventCount() { return events.size(); }

  public int caseCount() { return cases.size(); }

  public boolean isEmpty() { return events.isEmpty(); }

  /**
   * Adjacent pairs, in input order within a case, whose timestamp goes backwards.
   * Durations elsewhere are absolute; this is the only place the direction shows.
   */
  public int reversedPairs() { return reversedPairs; }

  /** Absolute time gap between two events, in hours. */
  public static double hoursBetween(Event previous, Event current) {
    return Math.abs(Duration.between(previous.timestamp(), current.timestamp()).toMillis()) / MILLIS_PER_HOUR;
  }
}
