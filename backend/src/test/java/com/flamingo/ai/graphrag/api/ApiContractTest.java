package com.flamingo.ai.graphrag.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.graphrag.api.rest.HealthController;
import com.flamingo.ai.graphrag.api.rest.RetrievalController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests for the public endpoint paths:
 *
 * <ul>
 *   <li>POST /api/retrieval/retrieve - Retrieve passages
 *   <li>POST /api/retrieval/retrieve/batch - Retrieve passages for several queries
 *   <li>POST /api/retrieval/rerank - Rerank caller-supplied chunks
 *   <li>GET /api/retrieval/modes - List retrieval modes
 *   <li>GET /health - Service health
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("RetrievalController API contract")
  class RetrievalControllerContract {

    @Test
    @DisplayName("should be mapped to /api/retrieval")
    void shouldBeMappedToApiRetrieval() {
      RequestMapping mapping = RetrievalController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/retrieval");
    }
  }

  @Nested
  @DisplayName("HealthController API contract")
  class HealthControllerContract {

    @Test
    @DisplayName("should be mapped to /health")
    void shouldBeMappedToHealth() {
      RequestMapping mapping = HealthController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/health");
    }
  }
}
