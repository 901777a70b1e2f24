package com.flamingo.ai.graphrag.api.rest;

import com.flamingo.ai.graphrag.api.dto.response.ServiceHealth;
import com.flamingo.ai.graphrag.service.health.HealthService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for health checks. */
@RestController
@RequestMapping("/health")
@RequiredArgsConstructor
public class HealthController {

  private final HealthService healthService;

  /** Returns service health; 503 when the graph store is unreachable. */
  @GetMapping
  public ResponseEntity<ServiceHealth> health() {
    ServiceHealth health = healthService.getServiceHealth();
    HttpStatus status =
        health.isGraphStoreReachable() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
    return ResponseEntity.status(status).body(health);
  }
}
