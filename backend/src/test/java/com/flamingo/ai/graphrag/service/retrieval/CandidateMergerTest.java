package com.flamingo.ai.graphrag.service.retrieval;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.graphrag.domain.model.Candidate;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CandidateMerger Tests")
class CandidateMergerTest {

  private final CandidateMerger merger = new CandidateMerger();

  private static Candidate seed(String id, double score) {
    return Candidate.builder().chunkId(id).text(id).lexicalScore(score).seed(true).build();
  }

  private static Candidate neighbor(String id, double score, String seedId) {
    return Candidate.builder()
        .chunkId(id)
        .text(id)
        .hybridScore(score)
        .seedId(seedId)
        .relationType("CITES")
        .hop(1)
        .build();
  }

  @Test
  @DisplayName("A seed should win over a neighbor with the same id, even with a lower score")
  void seedShouldWinOverNeighbor() {
    List<Candidate> merged =
        merger.merge(List.of(seed("a", 1.0)), List.of(neighbor("a", 5.0, "b")));

    assertThat(merged).singleElement().satisfies(c -> assertThat(c.isSeed()).isTrue());
  }

  @Test
  @DisplayName("Between neighbors the higher score wins, then the first arrival")
  void higherScoreThenFirstArrivalShouldWin() {
    List<Candidate> merged =
        merger.merge(
            List.of(),
            List.of(neighbor("n", 0.4, "s1"), neighbor("n", 0.9, "s2"), neighbor("n", 0.9, "s3")));

    assertThat(merged).singleElement().satisfies(c -> assertThat(c.getSeedId()).isEqualTo("s2"));
  }

  @Test
  @DisplayName("Should order by score, then seeds first, then chunk id")
  void shouldApplyRankingOrder() {
    List<Candidate> merged =
        merger.merge(
            List.of(seed("s-b", 2.0), seed("s-a", 1.0)),
            List.of(neighbor("n-z", 1.0, "s-b"), neighbor("n-c", 1.6, "s-b")));

    assertThat(merged)
        .extracting(Candidate::getChunkId)
        .containsExactly("s-b", "n-c", "s-a", "n-z");
  }
}
