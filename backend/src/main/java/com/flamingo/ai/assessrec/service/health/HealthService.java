package com.flamingo.ai.assessrec.service.health;

/** Service interface for readiness checks. */
public interface HealthService {

  /**
   * Reports whether the catalog is loaded and the embedding model is reachable.
   *
   * @return readiness report; status is unavailable until the catalog index is built
   */
  ReadinessReport checkReadiness();
}
