package com.flamingo.ai.graphrag.service.health;

import com.flamingo.ai.graphrag.api.dto.response.ServiceHealth;
import com.flamingo.ai.graphrag.graph.GraphStore;
import com.flamingo.ai.graphrag.service.provider.CrossEncoderService;
import com.flamingo.ai.graphrag.service.provider.EmbeddingService;
import io.micrometer.core.annotation.Timed;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of HealthService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class HealthServiceImpl implements HealthService {

  private final GraphStore graphStore;
  private final EmbeddingService embeddingService;
  private final CrossEncoderService crossEncoderService;

  @Override
  @Timed(value = "health.check", description = "Time to check service health")
  public ServiceHealth getServiceHealth() {
    boolean reachable = graphStore.verifyConnectivity();
    if (!reachable) {
      log.warn("Health check: graph store {} unreachable", graphStore.describe());
    }
    return ServiceHealth.builder()
        .status(reachable ? "UP" : "DOWN")
        .graphStore(graphStore.describe())
        .graphStoreReachable(reachable)
        .embeddingModelLoaded(embeddingService.isModelLoaded())
        .crossEncoderModelLoaded(crossEncoderService.isModelLoaded())
        .timestamp(LocalDateTime.now())
        .build();
  }
}
