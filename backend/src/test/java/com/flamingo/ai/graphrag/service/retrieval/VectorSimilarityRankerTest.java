package com.flamingo.ai.graphrag.service.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.graphrag.config.RetrievalConfig;
import com.flamingo.ai.graphrag.domain.enums.ChunkType;
import com.flamingo.ai.graphrag.domain.model.Candidate;
import com.flamingo.ai.graphrag.domain.model.ChunkRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("VectorSimilarityRanker Tests")
class VectorSimilarityRankerTest {

  private static final String NS = "Test_rel_2";
  private static final List<Float> QUERY = List.of(1f, 0f);

  private VectorSimilarityRanker ranker;

  @BeforeEach
  void setUp() {
    ranker =
        new VectorSimilarityRanker(new InProcessVectorSimilarityScorer(), new RetrievalConfig());
  }

  private static ChunkRecord node(String id, Float... embedding) {
    List<Float> vector = embedding.length == 0 ? null : List.of(embedding);
    return new ChunkRecord(id, "text " + id, ChunkType.CLAUSE, null, vector);
  }

  @Test
  @DisplayName("Should drop candidates without embedding and sort by similarity")
  void shouldDropMissingEmbeddingsAndSort() {
    List<ChunkRecord> nodes =
        List.of(node("a", 0f, 1f), node("b", 1f, 0f), node("c"), node("d", 1f, 1f));
    List<Candidate> seeds = nodes.stream().map(n -> Candidate.seedOf(n, 1.0)).toList();

    List<Candidate> ranked = ranker.rank(NS, QUERY, seeds, VectorSimilarityRanker.index(nodes));

    assertThat(ranked).extracting(Candidate::getChunkId).containsExactly("b", "d", "a");
    assertThat(ranked.get(0).getEmbeddingScore()).isCloseTo(1.0, within(1e-6));
    assertThat(ranked.get(1).getEmbeddingScore()).isCloseTo(Math.sqrt(0.5), within(1e-6));
    assertThat(ranked.get(0).getLexicalScore()).isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should keep the configured top-k and break ties by chunk id")
  void shouldTruncateToTopKWithIdTieBreak() {
    List<ChunkRecord> nodes = new ArrayList<>();
    for (int i = 9; i >= 0; i--) {
      nodes.add(node("n" + i, 2f, 0f));
    }

    List<Candidate> ranked = ranker.scan(NS, QUERY, nodes);

    assertThat(ranked)
        .extracting(Candidate::getChunkId)
        .containsExactly("n0", "n1", "n2", "n3", "n4");
    assertThat(ranked).allMatch(Candidate::isSeed);
  }

  @Test
  @DisplayName("Score should annotate every candidate and keep the input order")
  void scoreShouldKeepOrderAndSize() {
    List<ChunkRecord> nodes = List.of(node("a", 0f, 1f), node("b"), node("c", 1f, 0f));
    List<Candidate> seeds = nodes.stream().map(n -> Candidate.seedOf(n, 1.0)).toList();
    Map<String, ChunkRecord> index = VectorSimilarityRanker.index(nodes);

    List<Candidate> scored = ranker.score(NS, QUERY, seeds, index);

    assertThat(scored).extracting(Candidate::getChunkId).containsExactly("a", "b", "c");
    assertThat(scored.get(0).getEmbeddingScore()).isCloseTo(0.0, within(1e-9));
    assertThat(scored.get(1).getEmbeddingScore()).isNull();
    assertThat(scored.get(2).getEmbeddingScore()).isCloseTo(1.0, within(1e-9));
  }

  @Test
  @DisplayName("Should exclude nodes whose embedding dimension differs from the query")
  void shouldExcludeNodesWithWrongDimension() {
    List<Float> query = List.of(1f, 0f, 0f);
    List<ChunkRecord> nodes = List.of(node("good", -1f, 0f, 0f), node("wrongdim", 1f, 0f));

    List<Candidate> ranked = ranker.scan(NS, query, nodes);

    assertThat(ranked).extracting(Candidate::getChunkId).containsExactly("good");
    assertThat(ranked.get(0).getEmbeddingScore()).isCloseTo(-1.0, within(1e-9));
  }
}
