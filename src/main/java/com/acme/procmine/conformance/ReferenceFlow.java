package com.acme.procmine.conformance;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.*;

/** The expected activity sequence a case is compared against. Labels are non-blank and distinct. */
public final class ReferenceFlow {
  private final List<String> activities;
  private final Map<String, Integer> positions;

  private ReferenceFlow(List<String> activities) {
    if (activities == null || activities.isEmpty()) throw new IllegalArgumentException("Reference flow must not be empty");
    Map<String, Integer> pos = new HashMap<>();
    for (int i = 0; i < activities.size(); i++) {
      String label = activities.get(i);
      if (label == null || label.isBlank()) throw new IllegalArgumentException("Reference flow contains a blank label at position " + i);
      if (pos.putIfAbsent(label, i) != null) throw new IllegalArgumentException("Reference flow contains duplicate label: " + label);
    }
    this.activities = List.copyOf(activities);
    this.positions = Map.copyOf(pos);
  }

  public static ReferenceFlow of(List<String> activities) { return new ReferenceFlow(activities); }

  public static ReferenceFlow of(String... activities) { return new ReferenceFlow(Arrays.asList(activities)); }

  @JsonValue
  public List<String> activities() { return activities; }

  public int size() { return activities.size(); }

  public boolean contains(String activity) { return positions.containsKey(activity); }

  /** Position of the activity in the flow, -1 when absent. */
  public int indexOf(String activity) { return positions.getOrDefault(activity, -1); }

  @Override public boolean equals(Object o) {
    return o instanceof ReferenceFlow other && activities.equals(other.activities);
  }

  @Override public int hashCode() { return activities.hashCode(); }

  @Override public String toString() { return String.join(" -> ", activities); }
}
