package com.ospicorp.anomalydetection.health;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Health")
public class HealthCheckController {
  private final HealthCheckService healthCheckService;

  public HealthCheckController(HealthCheckService healthCheckService) {
    this.healthCheckService = healthCheckService;
  }

  @GetMapping("/healthcheck")
  @Operation(summary = "Service statistics",
      description = "Number of trained series and recent training/inference latencies.")
  public HealthCheckResponse healthcheck() {
    return healthCheckService.check();
  }
}
