package com.acme.procmine.rootcause;

import com.acme.procmine.domain.Event;

import java.util.List;

/**
 * Supplies the number of anomalies (defects, incidents) attributed to a resource.
 * The count comes from outside the event log; implementations should not report more errors than events.
 */
@FunctionalInterface
public interface AnomalySource {

  /** Reports no anomalies at all. */
  AnomalySource NONE = (resource, performed) -> 0;

  int errorsFor(String resource, List<Event> performed);
}
