package com.flamingo.ai.graphrag.service.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CosineSimilarity Tests")
class CosineSimilarityTest {

  @Test
  @DisplayName("Should be 1 for a vector with itself")
  void shouldBeOneForSameVector() {
    List<Float> v = List.of(0.3f, -1.2f, 4.0f);

    assertThat(CosineSimilarity.between(v, v)).isCloseTo(1.0, within(1e-9));
  }

  @Test
  @DisplayName("Should be -1 for opposite vectors and 0 for orthogonal ones")
  void shouldHandleOppositeAndOrthogonal() {
    assertThat(CosineSimilarity.between(List.of(1f, 2f), List.of(-1f, -2f)))
        .isCloseTo(-1.0, within(1e-9));
    assertThat(CosineSimilarity.between(List.of(1f, 0f), List.of(0f, 1f))).isEqualTo(0.0);
  }

  @Test
  @DisplayName("Should be 0 for a zero vector or mismatched dimensions")
  void shouldBeZeroForDegenerateInput() {
    assertThat(CosineSimilarity.between(List.of(0f, 0f), List.of(1f, 1f))).isEqualTo(0.0);
    assertThat(CosineSimilarity.between(List.of(1f, 1f), List.of(1f, 1f, 1f))).isEqualTo(0.0);
  }
}
