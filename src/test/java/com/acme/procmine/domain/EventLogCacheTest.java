package com.acme.procmine.domain;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

import static com.acme.procmine.TestLogs.ev;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

class EventLogCacheTest {

  private final EventLogCache cache = new EventLogCache();
  private final List<Event> events = List.of(ev("c1", "A", 0, "alice"), ev("c1", "B", 1, "bob"));

  @Test
  void sameInputAndFilterReusesView() {
    var first = cache.get(events, null);

    assertThat(cache.get(events, EventFilter.NONE)).isSameAs(first);
  }

  @Test
  void newInputOrFilterRecomputes() {
    var first = cache.get(events, null);

    var other = cache.get(new ArrayList<>(events), null);
    assertThat(other).isNotSameAs(first);
    assertThat(other.cases()).isEqualTo(first.cases());

    var filtered = cache.get(events, new EventFilter(null, null, null, "bob"));
    assertThat(filtered.eventCount()).isEqualTo(1);
  }

  @Test
  void clearDropsTheView() {
    var first = cache.get(events, null);
    cache.clear();

    assertThat(cache.get(events, null)).isNotSameAs(first);
  }

  @Test
  void concurrentCallersSeeTheSameGrouping() {
    var views = IntStream.range(0, 32).parallel()
        .mapToObj(i -> cache.get(i % 2 == 0 ? events : new ArrayList<>(events), null))
        .toList();

    assertThat(views).allSatisfy(v -> assertThat(v.cases()).isEqualTo(EventLog.groupedAndSorted(events)));
  }

  @Test
  void nullInputIsStillRejected() {
    cache.get(events, null);

    assertThatIllegalArgumentException().isThrownBy(() -> cache.get(null, null));
  }
}
