package com.flamingo.ai.graphrag.service.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.graphrag.domain.model.Candidate;
import com.flamingo.ai.graphrag.domain.model.ChunkRecord;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ScoreFusionEngine Tests")
class ScoreFusionEngineTest {

  private final ScoreFusionEngine engine = new ScoreFusionEngine();

  private static Candidate candidate(String id, double lexical, Double embedding) {
    return Candidate.seedOf(ChunkRecord.of(id, id), lexical).toBuilder()
        .embeddingScore(embedding)
        .build();
  }

  // lexical order: a > b > c, embedding order: c > b > a
  private final List<Candidate> candidates =
      List.of(candidate("a", 3, -0.5), candidate("b", 2, 0.1), candidate("c", 1, 0.9));

  @Test
  @DisplayName("Alpha 1 should reproduce the lexical order")
  void alphaOneShouldFollowLexicalOrder() {
    List<Candidate> fused = engine.fuse(candidates, 1.0);

    assertThat(fused).extracting(Candidate::getChunkId).containsExactly("a", "b", "c");
    assertThat(fused.get(0).getHybridScore()).isCloseTo(1.0, within(1e-9));
  }

  @Test
  @DisplayName("Alpha 0 should reproduce the embedding order")
  void alphaZeroShouldFollowEmbeddingOrder() {
    List<Candidate> fused = engine.fuse(candidates, 0.0);

    assertThat(fused).extracting(Candidate::getChunkId).containsExactly("c", "b", "a");
    assertThat(fused.get(0).getHybridScore()).isCloseTo(0.95, within(1e-9));
  }

  @Test
  @DisplayName("Should normalize lexical by the maximum and map cosine into [0, 1]")
  void shouldBlendNormalizedScores() {
    List<Candidate> fused =
        engine.fuse(List.of(candidate("y", 4, null), candidate("x", 2, 0.0)), 0.5);

    // x: 0.5 * 0.5 + 0.5 * 0.5, y: 0.5 * 1.0 + 0.5 * 0; equal, so chunk id decides
    assertThat(fused).extracting(Candidate::getChunkId).containsExactly("x", "y");
    assertThat(fused.get(0).getHybridScore()).isCloseTo(0.5, within(1e-9));
    assertThat(fused.get(1).getHybridScore()).isCloseTo(0.5, within(1e-9));
  }

  @Test
  @DisplayName("Should treat all-zero lexical scores without dividing by zero")
  void shouldHandleAllZeroLexicalScores() {
    List<Candidate> fused = engine.fuse(List.of(candidate("x", 0, 1.0)), 0.5);

    assertThat(fused.get(0).getHybridScore()).isCloseTo(0.5, within(1e-9));
  }

  @Test
  @DisplayName("Should reject alpha outside [0, 1]")
  void shouldRejectInvalidAlpha() {
    assertThatThrownBy(() -> engine.fuse(candidates, 1.5))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
