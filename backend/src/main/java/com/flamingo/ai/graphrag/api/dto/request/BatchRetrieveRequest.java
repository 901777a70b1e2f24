package com.flamingo.ai.graphrag.api.dto.request;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.flamingo.ai.graphrag.service.retrieval.RetrievalRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for retrieving several queries in one call. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BatchRetrieveRequest {

  @NotEmpty(message = "At least one request is required")
  @Valid
  private List<RetrieveRequest> requests;

  public List<RetrievalRequest> toRetrievalRequests() {
    return requests.stream().map(RetrieveRequest::toRetrievalRequest).toList();
  }
}
