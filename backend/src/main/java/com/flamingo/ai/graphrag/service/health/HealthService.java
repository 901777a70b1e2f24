package com.flamingo.ai.graphrag.service.health;

import com.flamingo.ai.graphrag.api.dto.response.ServiceHealth;

/** Service interface for health checks. */
public interface HealthService {

  /**
   * Checks the graph store and reports which models have been loaded.
   *
   * @return current service health; status is DOWN when the graph store is unreachable
   */
  ServiceHealth getServiceHealth();
}
