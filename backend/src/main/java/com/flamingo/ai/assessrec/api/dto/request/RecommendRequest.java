package com.flamingo.ai.assessrec.api.dto.request;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a recommendation. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendRequest {

  /** Hiring need or job description; blank queries are rejected by the engine. */
  @Size(max = 20000, message = "Query must not exceed 20000 characters")
  private String query;

  /** Optional result size, clamped to the configured range. */
  private Integer k;
}
