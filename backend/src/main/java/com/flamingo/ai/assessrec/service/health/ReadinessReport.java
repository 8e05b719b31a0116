package com.flamingo.ai.assessrec.service.health;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Readiness of the recommendation engine's dependencies. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReadinessReport {

  public static final String HEALTHY = "healthy";
  public static final String DEGRADED = "degraded";
  public static final String UNAVAILABLE = "unavailable";

  private String status;
  private boolean catalogLoaded;
  private int catalogSize;
  private boolean embeddingReady;
  private String rerankerStrategy;

  public boolean isServing() {
    return !UNAVAILABLE.equals(status);
  }
}
