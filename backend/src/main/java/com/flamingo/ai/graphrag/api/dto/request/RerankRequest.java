package com.flamingo.ai.graphrag.api.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for reranking caller-supplied chunks with the cross-encoder. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RerankRequest {

  @NotBlank(message = "Query is required")
  private String query;

  @NotNull(message = "Chunks are required")
  @Valid
  private List<Chunk> chunks;

  @Min(value = 1, message = "top_n must be at least 1")
  private Integer topN;

  /** A chunk to score. */
  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Chunk {
    @NotBlank(message = "Chunk id is required")
    private String id;

    private String text;
  }
}
