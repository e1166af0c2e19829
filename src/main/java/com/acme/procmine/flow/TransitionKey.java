package com.acme.procmine.flow;

/** Ordered pair of consecutive activities. {@code from} may equal {@code to}. */
public record TransitionKey(String from, String to) {
  public boolean isSelfLoop() { return from.equals(to); }
}
