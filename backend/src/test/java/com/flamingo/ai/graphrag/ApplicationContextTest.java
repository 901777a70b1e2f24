package com.flamingo.ai.graphrag;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.graphrag.domain.enums.RetrievalMode;
import com.flamingo.ai.graphrag.domain.model.Candidate;
import com.flamingo.ai.graphrag.domain.model.RetrievalResult;
import com.flamingo.ai.graphrag.graph.GraphStore;
import com.flamingo.ai.graphrag.graph.InMemoryGraphStore;
import com.flamingo.ai.graphrag.service.health.HealthService;
import com.flamingo.ai.graphrag.service.rerank.CrossEncoderReranker;
import com.flamingo.ai.graphrag.service.retrieval.RetrievalOrchestrator;
import com.flamingo.ai.graphrag.service.retrieval.RetrievalRequest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/**
 * Verifies the Spring application context loads with the in-memory graph fixture, so the test runs
 * without Neo4j or model servers.
 */
@SpringBootTest
class ApplicationContextTest {

  @Autowired private ApplicationContext applicationContext;

  @Autowired private RetrievalOrchestrator retrievalOrchestrator;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(GraphStore.class)).isInstanceOf(InMemoryGraphStore.class);
    assertThat(applicationContext.getBean(CrossEncoderReranker.class)).isNotNull();
    assertThat(applicationContext.getBean(HealthService.class)).isNotNull();
  }

  @Test
  @DisplayName("Lexical retrieval should run end to end against the fixture graph")
  void lexicalRetrievalShouldRunAgainstFixture() {
    RetrievalResult result =
        retrievalOrchestrator.retrieve(
            RetrievalRequest.builder()
                .query("thuế suất")
                .mode(RetrievalMode.LEXICAL_ONLY)
                .build());

    assertThat(result.candidates())
        .extracting(Candidate::getChunkId)
        .containsExactly("law_1_a5", "law_1_a7");
    assertThat(result.warnings()).isEmpty();
  }
}
