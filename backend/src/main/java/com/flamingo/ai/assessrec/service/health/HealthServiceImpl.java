package com.flamingo.ai.assessrec.service.health;

import com.flamingo.ai.assessrec.config.RecommenderConfig;
import com.flamingo.ai.assessrec.exception.EmbeddingUnavailableException;
import com.flamingo.ai.assessrec.service.embedding.EmbeddingProvider;
import com.flamingo.ai.assessrec.service.index.CatalogIndex;
import com.flamingo.ai.assessrec.service.index.CatalogIndexHolder;
import com.flamingo.ai.assessrec.service.recommendation.BoundedCallExecutor;
import com.flamingo.ai.assessrec.service.recommendation.BoundedCallExecutor.Lane;
import com.flamingo.ai.assessrec.service.rerank.AssessmentReranker;
import io.micrometer.core.annotation.Timed;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of HealthService probing the index and the embedding model. */
@Service
@RequiredArgsConstructor
@Slf4j
public class HealthServiceImpl implements HealthService {

  private static final String PROBE_TEXT = "health check";

  private final CatalogIndexHolder catalogIndexHolder;
  private final EmbeddingProvider embeddingProvider;
  private final AssessmentReranker assessmentReranker;
  private final BoundedCallExecutor boundedCallExecutor;
  private final RecommenderConfig recommenderConfig;

  @Override
  @Timed(value = "health.readiness", description = "Time to check readiness")
  public ReadinessReport checkReadiness() {
    Optional<CatalogIndex> index = catalogIndexHolder.peek();
    boolean loaded = index.isPresent();
    boolean embeddingReady = loaded && index.get().hasVectors() && probeEmbedding();

    String status;
    if (!loaded) {
      status = ReadinessReport.UNAVAILABLE;
    } else if (embeddingReady) {
      status = ReadinessReport.HEALTHY;
    } else {
      status = ReadinessReport.DEGRADED;
    }

    return ReadinessReport.builder()
        .status(status)
        .catalogLoaded(loaded)
        .catalogSize(index.map(CatalogIndex::size).orElse(0))
        .embeddingReady(embeddingReady)
        .rerankerStrategy(assessmentReranker.strategy())
        .build();
  }

  private boolean probeEmbedding() {
    try {
      float[] vector =
          boundedCallExecutor.call(
              Lane.EMBEDDING,
              "Embedding probe",
              recommenderConfig.getEmbedding().getTimeoutMs(),
              () -> embeddingProvider.embedQuery(PROBE_TEXT),
              cause ->
                  cause instanceof EmbeddingUnavailableException unavailable
                      ? unavailable
                      : new EmbeddingUnavailableException("Embedding probe failed", cause));
      return vector != null && vector.length == recommenderConfig.getEmbedding().getDimension();
    } catch (EmbeddingUnavailableException e) {
      log.warn("Embedding probe failed: {}", e.getMessage());
      return false;
    }
  }
}
