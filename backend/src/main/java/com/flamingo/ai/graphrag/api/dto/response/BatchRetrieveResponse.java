package com.flamingo.ai.graphrag.api.dto.response;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.graphrag.domain.model.RetrievalResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a batch retrieval: one entry per request, in request order. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BatchRetrieveResponse {

  private List<RetrieveResponse> results;
  private int failedCount;

  public static BatchRetrieveResponse from(List<RetrievalResult> results) {
    return BatchRetrieveResponse.builder()
        .results(results.stream().map(RetrieveResponse::from).toList())
        .failedCount((int) results.stream().filter(RetrievalResult::isFailed).count())
        .build();
  }
}
