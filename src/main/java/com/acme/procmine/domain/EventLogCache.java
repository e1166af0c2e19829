package com.acme.procmine.domain;

import org.springframework.stereotype.Component;

import java.lang.ref.WeakReference;
import java.util.List;

/**
 * Remembers the last grouped view, keyed on the identity of the input list and the filter.
 * The input list is only weakly held. Callers must not mutate a list after handing it over.
 */
@Component
public class EventLogCache {
  private volatile Entry last;

  public EventLog get(List<Event> events, EventFilter filter) {
    EventFilter f = filter == null ? EventFilter.NONE : filter;
    Entry e = last;
    if (e != null && e.hits(events, f)) return e.log();
    EventLog log = EventLog.of(f.isEmpty() ? events : f.apply(events));
    last = new Entry(new WeakReference<>(events), f, log);
    return log;
  }

  public void clear() {
    last = null;
  }

  private record Entry(WeakReference<List<Event>> input, EventFilter filter, EventLog log) {
    boolean hits(List<Event> events, EventFilter f) {
      return events != null && input.get() == events && filter.equals(f);
    }
  }
}
