package com.acme.procmine.domain;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.function.Predicate;

/**
 * Narrows a log before analysis. Bounds are inclusive, activity and resource match by substring.
 * Null or blank criteria match everything.
 */
public record EventFilter(Instant from, Instant to, String activity, String resource) implements Predicate<Event> {
  public static final EventFilter NONE = new EventFilter(null, null, null, null);

  public boolean isEmpty() {
    return from == null && to == null && isBlank(activity) && isBlank(resource);
  }

  @Override public boolean test(Event e) {
    if (from != null && e.timestamp().isBefore(from)) return false;
    if (to != null && e.timestamp().isAfter(to)) return false;
    if (!isBlank(activity) && !e.activity().contains(activity)) return false;
    return isBlank(resource) || e.resource().contains(resource);
  }

  public List<Event> apply(Collection<Event> events) {
    return events.stream().filter(this).toList();
  }

  private static boolean isBlank(String s) { return s == null || s.isBlank(); }
}
