package com.flamingo.ai.graphrag.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.graphrag.domain.model.Candidate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one retrieved passage. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CandidateResponse {

  private String id;
  private String text;
  private String type;
  private double lexicalScore;
  private Double embeddingScore;
  private Double hybridScore;
  private Double rerankScore;
  private double score;

  @JsonProperty("is_seed")
  private boolean seed;

  private String relationType;
  private String seedId;
  private int hop;

  /** Creates a CandidateResponse from a Candidate. */
  public static CandidateResponse from(Candidate candidate) {
    return CandidateResponse.builder()
        .id(candidate.getChunkId())
        .text(candidate.getText())
        .type(candidate.getChunkType().getValue())
        .lexicalScore(candidate.getLexicalScore())
        .embeddingScore(candidate.getEmbeddingScore())
        .hybridScore(candidate.getHybridScore())
        .rerankScore(candidate.getRerankScore())
        .score(candidate.effectiveScore())
        .seed(candidate.isSeed())
        .relationType(candidate.getRelationType())
        .seedId(candidate.getSeedId())
        .hop(candidate.getHop())
        .build();
  }
}
