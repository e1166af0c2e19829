package com.acme.procmine.flow;

import com.acme.procmine.domain.Event;
import com.acme.procmine.domain.EventLog;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Builds the directly-follows graph of a log.
 * Nodes and edges come out by descending frequency; equal frequencies keep first-seen order.
 */
@Component
public class FlowGraphBuilder {

  public FlowGraph build(EventLog log) {
    Map<String, NodeAcc> nodes = new LinkedHashMap<>();
    Map<TransitionKey, EdgeAcc> edges = new LinkedHashMap<>();

    for (List<Event> seq : log.cases().values()) {
      for (int i = 0; i < seq.size(); i++) {
        Event ev = seq.get(i);
        NodeAcc node = nodes.computeIfAbsent(ev.activity(), k -> new NodeAcc());
        node.frequency++;
        node.resources.add(ev.resource());

        if (i > 0) {
          Event prev = seq.get(i - 1);
          EdgeAcc edge = edges.computeIfAbsent(new TransitionKey(prev.activity(), ev.activity()), k -> new EdgeAcc());
          edge.add(EventLog.hoursBetween(prev, ev));
        }
      }
    }

    List<FlowNode> nodeList = new ArrayList<>(nodes.size());
    nodes.forEach((activity, acc) -> nodeList.add(new FlowNode(activity, acc.frequency, List.copyOf(acc.resources))));
    nodeList.sort(Comparator.comparingInt(FlowNode::frequency).reversed());

    List<FlowEdge> edgeList = new ArrayList<>(edges.size());
    edges.forEach((key, acc) -> edgeList.add(new FlowEdge(key.from(), key.to(), acc.frequency, acc.mean)));
    edgeList.sort(Comparator.comparingInt(FlowEdge::frequency).reversed());

    return new FlowGraph(List.copyOf(nodeList), List.copyOf(edgeList));
  }

  private static final class NodeAcc {
    int frequency;
    final Set<String> resources = new LinkedHashSet<>();
  }

  private static final class EdgeAcc {
    int frequency;
    double mean;

    void add(double hours) {
      frequency++;
      mean += (hours - mean) / frequency;
    }
  }
}
