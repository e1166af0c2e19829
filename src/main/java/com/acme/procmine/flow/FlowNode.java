package com.acme.procmine.flow;

import java.util.List;

/** An activity with its occurrence count and the distinct resources that performed it, in first-seen order. */
public record FlowNode(String activity, int frequency, List<String> resources) {}
