package com.flamingo.ai.assessrec.api.rest;

import com.flamingo.ai.assessrec.api.dto.request.RecommendRequest;
import com.flamingo.ai.assessrec.api.dto.response.RecommendationResponse;
import com.flamingo.ai.assessrec.exception.CatalogEmptyException;
import com.flamingo.ai.assessrec.service.recommendation.QueryValidator;
import com.flamingo.ai.assessrec.service.recommendation.RecommendationEngine;
import com.flamingo.ai.assessrec.service.recommendation.RecommendationResult;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for assessment recommendations. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class RecommendationController {

  private final RecommendationEngine recommendationEngine;
  private final QueryValidator queryValidator;

  @Value("${spring.application.name:assessment-recommender}")
  private String applicationName;

  /** Recommends assessments for a hiring query. */
  @PostMapping("/recommend")
  public ResponseEntity<RecommendationResponse> recommend(
      @Valid @RequestBody RecommendRequest request) {
    RecommendationResult result =
        recommendationEngine.recommend(request.getQuery(), request.getK());
    if (result.isEmpty()) {
      throw new CatalogEmptyException();
    }
    log.info(
        "Recommendation served: {} results, source={}, confidence={}",
        result.recommendations().size(),
        result.scoreSource(),
        result.confidence());
    return ResponseEntity.ok(RecommendationResponse.fromResult(result));
  }

  /** Describes the API. */
  @GetMapping("/info")
  public ResponseEntity<Map<String, Object>> info() {
    Map<String, Object> info = new LinkedHashMap<>();
    info.put("name", applicationName);
    info.put("version", "0.1.0");
    info.put(
        "endpoints",
        List.of(
            "POST /api/recommend",
            "GET /api/info",
            "GET /health",
            "GET /api/catalog",
            "POST /api/catalog/refresh"));
    info.put("minRecommendations", 1);
    info.put("maxRecommendations", queryValidator.maxK());
    return ResponseEntity.ok(info);
  }
}
