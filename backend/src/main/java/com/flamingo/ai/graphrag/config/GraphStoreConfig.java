package com.flamingo.ai.graphrag.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.graphrag.graph.GraphFixtureLoader;
import com.flamingo.ai.graphrag.graph.GraphStore;
import com.flamingo.ai.graphrag.graph.InMemoryGraphStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * Wires the in-memory graph store when {@code retrieval.graph.store=in-memory}. The Neo4j store is
 * a component of its own and is active otherwise.
 */
@Configuration
@ConditionalOnProperty(name = "retrieval.graph.store", havingValue = "in-memory")
@Slf4j
public class GraphStoreConfig {

  @Bean
  public GraphStore inMemoryGraphStore(
      RetrievalConfig retrievalConfig, ObjectMapper objectMapper, ResourceLoader resourceLoader) {
    RetrievalConfig.Graph graph = retrievalConfig.getGraph();
    String fixture = graph.getInMemory().getFixture();
    if (fixture == null || fixture.isBlank()) {
      log.warn("No graph fixture configured, starting with an empty in-memory graph");
      return InMemoryGraphStore.builder().directed(graph.isDirected()).build();
    }
    return new GraphFixtureLoader(objectMapper)
        .load(resourceLoader.getResource(fixture), graph.isDirected());
  }
}
