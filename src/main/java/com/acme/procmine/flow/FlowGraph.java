package com.acme.procmine.flow;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record FlowGraph(List<FlowNode> nodes, List<FlowEdge> edges) {
  @JsonProperty
  public int maxNodeFrequency() { return nodes.stream().mapToInt(FlowNode::frequency).max().orElse(0); }

  @JsonProperty
  public int maxEdgeFrequency() { return edges.stream().mapToInt(FlowEdge::frequency).max().orElse(0); }

  /** Mean of the per-edge average durations, 0 without edges. */
  @JsonProperty
  public double meanEdgeDurationHours() {
    return edges.stream().mapToDouble(FlowEdge::avgDurationHours).average().orElse(0);
  }
}
