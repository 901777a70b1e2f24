package com.flamingo.ai.graphrag.api.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.graphrag.domain.enums.RetrievalMode;
import com.flamingo.ai.graphrag.service.retrieval.RetrievalRequest;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a retrieval call. Omitted options use the configured defaults. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RetrieveRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 10000, message = "Query must not exceed 10000 characters")
  private String query;

  @Min(value = 1, message = "top_k must be at least 1")
  @Max(value = 50, message = "top_k must not exceed 50")
  private Integer topK;

  private String namespace;

  private RetrievalMode mode;

  private Boolean rerank;

  @Min(value = 1, message = "rerank_top_n must be at least 1")
  private Integer rerankTopN;

  @Min(value = 1, message = "hop_depth must be at least 1")
  private Integer hopDepth;

  @DecimalMin(value = "0.0", message = "alpha must be between 0 and 1")
  @DecimalMax(value = "1.0", message = "alpha must be between 0 and 1")
  private Double alpha;

  public RetrievalRequest toRetrievalRequest() {
    return RetrievalRequest.builder()
        .query(query)
        .topK(topK)
        .namespace(namespace)
        .mode(mode)
        .rerank(rerank)
        .rerankTopN(rerankTopN)
        .hopDepth(hopDepth)
        .alpha(alpha)
        .build();
  }
}
