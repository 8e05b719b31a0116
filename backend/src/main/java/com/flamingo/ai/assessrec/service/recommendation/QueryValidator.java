package com.flamingo.ai.assessrec.service.recommendation;

import com.flamingo.ai.assessrec.config.RecommenderConfig;
import com.flamingo.ai.assessrec.config.RecommenderConfig.OverflowPolicy;
import com.flamingo.ai.assessrec.exception.InvalidQueryException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Normalises request input before it reaches the ranking stages. */
@Component
@RequiredArgsConstructor
@Slf4j
public class QueryValidator {

  /** No configuration may raise the result size above this. */
  public static final int HARD_MAX_K = 10;

  private final RecommenderConfig recommenderConfig;

  /**
   * Trims the query and applies the length policy.
   *
   * @param query raw query text
   * @return the query to rank with
   * @throws InvalidQueryException if the query is blank, or too long under the REJECT policy
   */
  public String validate(String query) {
    if (query == null || query.isBlank()) {
      throw new InvalidQueryException("Query must not be empty");
    }
    String trimmed = query.trim();

    RecommenderConfig.Query limits = recommenderConfig.getQuery();
    if (trimmed.length() > limits.getMaxLength()) {
      if (limits.getOverflowPolicy() == OverflowPolicy.REJECT) {
        throw new InvalidQueryException(
            "Query must be at most " + limits.getMaxLength() + " characters");
      }
      log.debug("Truncating query from {} to {} chars", trimmed.length(), limits.getMaxLength());
      trimmed = trimmed.substring(0, limits.getMaxLength()).trim();
    }
    return trimmed;
  }

  /**
   * Clamps the requested result size to {@code [1, maxK]}.
   *
   * @param k requested size, {@code null} for the configured default
   * @return the effective size
   */
  public int clampK(Integer k) {
    int maxK = Math.max(1, Math.min(HARD_MAX_K, recommenderConfig.getRetrieval().getMaxK()));
    int requested = k != null ? k : recommenderConfig.getRetrieval().getDefaultK();
    return Math.max(1, Math.min(maxK, requested));
  }

  public int maxK() {
    return clampK(Integer.MAX_VALUE);
  }
}
