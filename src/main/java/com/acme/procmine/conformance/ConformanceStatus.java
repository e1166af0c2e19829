package com.acme.procmine.conformance;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConformanceStatus {
  CONFORMING("conforming"),
  PARTIALLY_CONFORMING("partially-conforming"),
  NON_CONFORMING("non-conforming");

  private final String label;

  ConformanceStatus(String label) { this.label = label; }

  @JsonValue
  public String label() { return label; }
}
