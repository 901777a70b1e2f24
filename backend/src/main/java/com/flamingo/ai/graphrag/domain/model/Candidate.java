package com.flamingo.ai.graphrag.domain.model;

import com.flamingo.ai.graphrag.domain.enums.ChunkType;
import java.util.Comparator;
import lombok.Builder;
import lombok.Value;

/**
 * A retrieval candidate created and scored within a single request.
 *
 * <p>Every stage that changes a score produces a new instance via {@link #toBuilder()}; instances
 * are never mutated, so a finished {@link RetrievalResult} cannot change after it is returned.
 */
@Value
@Builder(toBuilder = true)
public class Candidate {

  /**
   * Final ranking order: effective score descending, seeds before neighbors, then chunk id
   * ascending so equal-score ties are reproducible.
   */
  public static final Comparator<Candidate> RANKING_ORDER =
      Comparator.comparingDouble(Candidate::effectiveScore)
          .reversed()
          .thenComparing(Candidate::isSeed, Comparator.reverseOrder())
          .thenComparing(Candidate::getChunkId);

  String chunkId;
  String text;
  @Builder.Default ChunkType chunkType = ChunkType.OTHER;

  /** Number of distinct query words found in the text; 0 for graph neighbors. */
  double lexicalScore;

  /** Cosine similarity in [-1, 1], null when the embedding stage did not score this candidate. */
  Double embeddingScore;

  /** Fused or neighbor-discounted score, null when neither fusion nor expansion produced it. */
  Double hybridScore;

  /** Cross-encoder score (real or synthetic fallback), null when no rerank pass ran. */
  Double rerankScore;

  boolean seed;

  /** Relation type of the edge that reached this neighbor; null for seeds. */
  String relationType;

  /** Seed this neighbor was expanded from; null for seeds. */
  String seedId;

  /** Hop distance from {@link #seedId}; 0 for seeds. */
  int hop;

  /**
   * The score used for ordering: the most downstream signal available (rerank, then hybrid, then
   * embedding, then lexical).
   */
  public double effectiveScore() {
    if (rerankScore != null) {
      return rerankScore;
    }
    if (hybridScore != null) {
      return hybridScore;
    }
    if (embeddingScore != null) {
      return embeddingScore;
    }
    return lexicalScore;
  }

  /** Builds a seed candidate for a matched chunk. */
  public static Candidate seedOf(ChunkRecord chunk, double lexicalScore) {
    return Candidate.builder()
        .chunkId(chunk.id())
        .text(chunk.text())
        .chunkType(chunk.type())
        .lexicalScore(lexicalScore)
        .seed(true)
        .build();
  }
}
