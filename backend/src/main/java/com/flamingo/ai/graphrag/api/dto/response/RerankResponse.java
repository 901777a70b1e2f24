package com.flamingo.ai.graphrag.api.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a rerank call. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RerankResponse {

  private List<RankedChunk> rerankedChunks;
  private List<Double> scores;
  private List<String> warnings;

  /** A chunk with its cross-encoder score. */
  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class RankedChunk {
    private String id;
    private String text;
    private double score;
  }
}
