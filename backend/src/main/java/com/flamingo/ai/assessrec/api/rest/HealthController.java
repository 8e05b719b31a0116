package com.flamingo.ai.assessrec.api.rest;

import com.flamingo.ai.assessrec.service.health.HealthService;
import com.flamingo.ai.assessrec.service.health.ReadinessReport;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
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

  /** Returns 200 while the catalog is served (possibly degraded), 503 before it is built. */
  @GetMapping
  public ResponseEntity<Map<String, Object>> health() {
    ReadinessReport report = healthService.checkReadiness();

    Map<String, Object> health = new LinkedHashMap<>();
    health.put("status", report.getStatus());
    health.put("catalogLoaded", report.isCatalogLoaded());
    health.put("catalogSize", report.getCatalogSize());
    health.put("embeddingReady", report.isEmbeddingReady());
    health.put("rerankerStrategy", report.getRerankerStrategy());
    health.put("timestamp", LocalDateTime.now());

    HttpStatus status = report.isServing() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
    return ResponseEntity.status(status).body(health);
  }
}
