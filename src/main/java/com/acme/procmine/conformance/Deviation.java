package com.acme.procmine.conformance;

import com.fasterxml.jackson.annotation.JsonValue;

/** Deviation kinds, in the order they are checked. */
public enum Deviation {
  EXTRA_ACTIVITIES("Extra activities detected", "Extra Activities"),
  MISSING_ACTIVITIES("Missing activities", "Missing Activities"),
  WRONG_ORDER("Wrong activity order", "Wrong Order");

  private final String label;
  private final String kind;

  Deviation(String label, String kind) { this.label = label; this.kind = kind; }

  /** Per-case label. */
  @JsonValue
  public String label() { return label; }

  /** Key used in the log-wide tally. */
  public String kind() { return kind; }
}
