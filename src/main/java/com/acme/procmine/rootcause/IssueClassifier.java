package com.acme.procmine.rootcause;

import org.apache.commons.jexl3.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Counts ranked bottlenecks and resources matching each configured issue rule.
 * Rules are compiled and checked against their target's variables up front.
 */
public class IssueClassifier {
  static final Set<String> TRANSITION_VARIABLES = Set.of("avgDuration", "maxDuration", "occurrences", "variability");
  static final Set<String> RESOURCE_VARIABLES = Set.of("workload", "errors", "errorRate");

  private final List<Compiled> rules;

  public IssueClassifier(List<IssueRule> rules) {
    JexlEngine jexl = new JexlBuilder().strict(true).silent(false).create();
    List<Compiled> compiled = new ArrayList<>(rules.size());
    for (IssueRule r : rules) {
      JexlScript script;
      try {
        script = jexl.createScript(r.expression());
      } catch (JexlException e) {
        throw new IllegalArgumentException("Invalid expression for issue rule '" + r.name() + "': " + r.expression(), e);
      }
      Set<String> allowed = variablesOf(r.target());
      for (List<String> path : script.getVariables()) {
        String name = path.get(0);
        if (!allowed.contains(name)) {
          throw new IllegalArgumentException("Issue rule '" + r.name() + "' uses unknown " + r.target()
              + " variable '" + name + "', expected one of " + allowed);
        }
      }
      compiled.add(new Compiled(r, script));
    }
    this.rules = List.copyOf(compiled);
  }

  public List<IssueCategory> classify(RootCauseReport report) {
    List<IssueCategory> out = new ArrayList<>(rules.size());
    for (Compiled c : rules) {
      int count = 0;
      if (c.rule().target() == IssueRule.Target.TRANSITION) {
        for (BottleneckEntry b : report.bottlenecks()) if (matches(c, transitionContext(b))) count++;
      } else {
        for (ResourceProfile p : report.resources()) if (matches(c, resourceContext(p))) count++;
      }
      out.add(new IssueCategory(c.rule().name(), count, c.rule().severity()));
    }
    return out;
  }

  private static Set<String> variablesOf(IssueRule.Target target) {
    return target == IssueRule.Target.TRANSITION ? TRANSITION_VARIABLES : RESOURCE_VARIABLES;
  }

  private boolean matches(Compiled c, JexlContext ctx) {
    try {
      return Boolean.TRUE.equals(c.script().execute(ctx));
    } catch (JexlException e) {
      throw new IllegalStateException("Issue rule '" + c.rule().name() + "' failed: " + e.getMessage(), e);
    }
  }

  private static JexlContext transitionContext(BottleneckEntry b) {
    JexlContext jc = new MapContext();
    jc.set("avgDuration", b.avgDuration());
    jc.set("maxDuration", b.maxDuration());
    jc.set("occurrences", b.occurrences());
    jc.set("variability", b.variability());
    return jc;
  }

  private static JexlContext resourceContext(ResourceProfile p) {
    JexlContext jc = new MapContext();
    jc.set("workload", p.workload());
    jc.set("errors", p.errors());
    jc.set("errorRate", p.errorRate());
    return jc;
  }

  private record Compiled(IssueRule rule, JexlScript script) {}
}
