package com.flamingo.ai.graphrag.service.health;

import com.flamingo.ai.graphrag.graph.GraphStore;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/** Actuator health contributor {@code graphStore}. */
@Component("graphStore")
@RequiredArgsConstructor
public class GraphStoreHealthIndicator implements HealthIndicator {

  private final GraphStore graphStore;

  @Override
  public Health health() {
    Health.Builder builder = graphStore.verifyConnectivity() ? Health.up() : Health.down();
    return builder.withDetail("store", graphStore.describe()).build();
  }
}
