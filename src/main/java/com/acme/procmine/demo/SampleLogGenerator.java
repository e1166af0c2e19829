package com.acme.procmine.demo;

import com.acme.procmine.conformance.ReferenceFlow;
import com.acme.procmine.domain.Event;
import net.datafaker.Faker;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Generates a reproducible process log around a reference flow.
 * Each step may be skipped, swapped with the next one or repeated as rework, so the
 * output exercises every deviation the conformance check knows about.
 */
@Component
public class SampleLogGenerator {
  static final double SKIP_P = 0.08;
  static final double SWAP_P = 0.08;
  static final double REWORK_P = 0.10;
  private static final int RESOURCE_POOL = 6;
  private static final Instant EPOCH = Instant.parse("2024-01-01T08:00:00Z");

  public List<Event> generate(ReferenceFlow flow, int cases, long seed) {
    return generate(flow, cases, seed, EPOCH);
  }

  public List<Event> generate(ReferenceFlow flow, int cases, long seed, Instant start) {
    if (cases < 0) throw new IllegalArgumentException("cases must be >= 0: " + cases);
    Random rnd = new Random(seed);
    Faker faker = new Faker(Locale.ENGLISH, new Random(seed));
    List<String> resources = new ArrayList<>(RESOURCE_POOL);
    for (int i = 0; i < RESOURCE_POOL; i++) resources.add(faker.name().firstName() + "." + faker.name().lastName());

    List<Event> out = new ArrayList<>();
    for (int c = 0; c < cases; c++) {
      String caseId = String.format("CASE-%04d", c + 1);
      Instant t = start.plus(Duration.ofMinutes(rnd.nextInt(14 * 24 * 60)));
      for (String activity : steps(flow.activities(), rnd)) {
        out.add(new Event(caseId, activity, t, resources.get(rnd.nextInt(resources.size()))));
        t = t.plus(gap(rnd));
      }
    }
    return out;
  }

  private List<String> steps(List<String> reference, Random rnd) {
    List<String> steps = new ArrayList<>(reference.size() + 2);
    for (String a : reference) {
      if (rnd.nextDouble() < SKIP_P) continue;
      steps.add(a);
      if (rnd.nextDouble() < REWORK_P) steps.add(a);
    }
    for (int i = 1; i < steps.size(); i++) {
      if (rnd.nextDouble() < SWAP_P) Collections.swap(steps, i - 1, i);
    }
    return steps;
  }

  // mostly short hand-offs, occasionally a long wait
  private Duration gap(Random rnd) {
    long minutes = rnd.nextDouble() < 0.15 ? 240 + rnd.nextInt(720) : 15 + rnd.nextInt(180);
    return Duration.ofMinutes(minutes);
  }
}
