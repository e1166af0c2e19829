package com.acme.procmine.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/** One row of a process log, as handed over by the ingestion side. */
public record Event(@JsonProperty("case_id") String caseId, String activity, Instant timestamp, String resource) {
  public Event {
    requireText(caseId, "case_id");
    requireText(activity, "activity");
    requireText(resource, "resource");
    if (timestamp == null) throw new IllegalArgumentException("Event timestamp is required (case " + caseId + ")");
  }

  private static void requireText(String value, String field) {
    if (value == null || value.isBlank()) throw new IllegalArgumentException("Event " + field + " must not be blank");
  }
}
