package com.flamingo.ai.graphrag.api.dto.response;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** DTO for service health, including graph store connectivity and model load state. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceHealth {
  private String status;
  private String graphStore;
  private boolean graphStoreReachable;
  private boolean embeddingModelLoaded;
  private boolean crossEncoderModelLoaded;
  private LocalDateTime timestamp;
}
