package com.acme.procmine.conformance;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

class ReferenceFlowTest {

  @Test
  void indexesLabels() {
    var flow = ReferenceFlow.of("X", "Y", "Z");

    assertThat(flow.size()).isEqualTo(3);
    assertThat(flow.indexOf("Z")).isEqualTo(2);
    assertThat(flow.indexOf("Q")).isEqualTo(-1);
    assertThat(flow.contains("Y")).isTrue();
  }

  @Test
  void rejectsDuplicateBlankOrEmptyLabels() {
    assertThatIllegalArgumentException().isThrownBy(() -> ReferenceFlow.of("X", "Y", "X"))
        .withMessageContaining("duplicate");
    assertThatIllegalArgumentException().isThrownBy(() -> ReferenceFlow.of("X", " "));
    assertThatIllegalArgumentException().isThrownBy(() -> ReferenceFlow.of(Arrays.asList("X", null)));
    assertThatIllegalArgumentException().isThrownBy(() -> ReferenceFlow.of(List.of()));
  }
}
