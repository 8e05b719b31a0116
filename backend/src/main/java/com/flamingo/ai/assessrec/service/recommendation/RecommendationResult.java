package com.flamingo.ai.assessrec.service.recommendation;

import com.flamingo.ai.assessrec.domain.enums.ConfidenceLevel;
import com.flamingo.ai.assessrec.domain.enums.ScoreSource;
import com.flamingo.ai.assessrec.domain.model.CatalogRecord;
import java.util.List;

/**
 * Outcome of one recommendation request. Scores are kept internal; callers only see the order.
 *
 * @param recommendations records in final order, empty only for an empty catalog
 * @param scoreSource strategy that ranked the candidates, {@code null} when nothing was ranked
 * @param confidence coarse confidence; lexical rankings are always LOW
 * @param reranked whether the reranker's order was applied
 */
public record RecommendationResult(
    List<CatalogRecord> recommendations,
    ScoreSource scoreSource,
    ConfidenceLevel confidence,
    boolean reranked) {

  public RecommendationResult {
    recommendations = List.copyOf(recommendations);
  }

  public static RecommendationResult empty() {
    return new RecommendationResult(List.of(), null, ConfidenceLevel.LOW, false);
  }

  public boolean isEmpty() {
    return recommendations.isEmpty();
  }
}
