package com.telelink.scoring.controller;

import com.telelink.scoring.dto.HealthStatus;
import com.telelink.scoring.model.ModelRegistry;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/**
 * Reports the loaded model versions. The service only starts once both models have loaded,
 * so a reachable instance is always UP.
 */
@RestController
@RequestMapping("/api/v1")
public class HealthController {

  static final String SERVICE_NAME = "TeleLink Customer Analytics API";
  static final String API_VERSION = "2.0.0";

  private final ModelRegistry models;

  public HealthController(ModelRegistry models) {
    this.models = models;
  }

  @GetMapping("/health")
  public Mono<HealthStatus> health() {
    return Mono.just(new HealthStatus("UP", SERVICE_NAME, API_VERSION, models.format().name(), models.versions()));
  }
}
