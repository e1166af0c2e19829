package com.acme.procmine.rootcause;

import com.acme.procmine.domain.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.SplittableRandom;

/**
 * Synthetic anomalies for demo data: each performed event is an error with probability {@code rate}.
 * With a seed the draw is reproducible per resource, otherwise it changes on every call.
 */
public final class RandomAnomalySource implements AnomalySource {
  private static final Logger log = LoggerFactory.getLogger(RandomAnomalySource.class);

  private final double rate;
  private final Long seed;

  public RandomAnomalySource(double rate, Long seed) {
    if (!(rate >= 0 && rate <= 1)) throw new IllegalArgumentException("rate must be within [0,1]: " + rate);
    this.rate = rate;
    this.seed = seed;
    log.info("Random anomaly source enabled (rate={}, seed={})", rate, seed == null ? "none" : seed);
  }

  @Override public int errorsFor(String resource, List<Event> performed) {
    SplittableRandom rnd = seed == null ? new SplittableRandom() : new SplittableRandom(seed * 31 + resource.hashCode());
    int errors = 0;
    for (int i = 0; i < performed.size(); i++) {
      if (rnd.nextDouble() < rate) errors++;
    }
    return errors;
  }
}
