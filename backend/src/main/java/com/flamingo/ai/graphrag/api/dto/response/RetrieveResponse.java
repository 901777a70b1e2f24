package com.flamingo.ai.graphrag.api.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.graphrag.domain.model.GraphContextEntry;
import com.flamingo.ai.graphrag.domain.model.RetrievalResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a retrieval call. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RetrieveResponse {

  private List<CandidateResponse> candidates;
  private List<GraphContextItem> graphContext;
  private String modeUsed;
  private boolean embeddingUsed;
  private boolean rerankApplied;
  private List<String> stagesRun;
  private List<String> warnings;
  private String error;

  /** Creates a RetrieveResponse from a RetrievalResult. */
  public static RetrieveResponse from(RetrievalResult result) {
    return RetrieveResponse.builder()
        .candidates(result.candidates().stream().map(CandidateResponse::from).toList())
        .graphContext(result.graphContext().stream().map(GraphContextItem::from).toList())
        .modeUsed(result.modeUsed())
        .embeddingUsed(result.embeddingUsed())
        .rerankApplied(result.rerankApplied())
        .stagesRun(result.stagesRun())
        .warnings(result.warnings())
        .error(result.error())
        .build();
  }

  /** A neighbor that entered the result through a graph relationship. */
  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class GraphContextItem {
    private String nodeId;
    private String relationship;
    private String textPreview;
    private String seedId;
    private int hop;

    static GraphContextItem from(GraphContextEntry entry) {
      return new GraphContextItem(
          entry.nodeId(), entry.relationType(), entry.textPreview(), entry.seedId(), entry.hop());
    }
  }
}
