package com.acme.procmine.flow;

public record FlowEdge(String from, String to, int frequency, double avgDurationHours) {
  public TransitionKey key() { return new TransitionKey(from, to); }
}
