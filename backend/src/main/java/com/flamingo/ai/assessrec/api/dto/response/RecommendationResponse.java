package com.flamingo.ai.assessrec.api.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.assessrec.service.recommendation.RecommendationResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a recommendation request. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationResponse {

  @JsonProperty("recommended_assessments")
  private List<AssessmentResponse> recommendedAssessments;

  public static RecommendationResponse fromResult(RecommendationResult result) {
    return RecommendationResponse.builder()
        .recommendedAssessments(
            result.recommendations().stream().map(AssessmentResponse::fromRecord).toList())
        .build();
  }
}
